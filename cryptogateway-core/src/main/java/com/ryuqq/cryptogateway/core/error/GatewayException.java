package com.ryuqq.cryptogateway.core.error;

/**
 * 게이트웨이 내부 실패의 최상위 예외.
 *
 * <p>게이트웨이 내부에서는 예외로 실패를 전파하고, 게이트웨이 경계에서 한 번만 잡아
 * {@link ErrorContext}로 변환합니다. 모든 하위 예외는 생성 시점에 {@link ErrorKind}와
 * {@link HostStatus}가 결정됩니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public class GatewayException extends RuntimeException {

    private final ErrorKind kind;
    private final HostStatus hostStatus;
    private final String detail;

    /**
     * GatewayException 생성.
     *
     * @param kind 오류 분류
     * @param hostStatus 호스트 코드
     * @param message 설명
     * @param detail 추가 정보 (null 가능)
     * @param cause 원인 (null 가능)
     */
    public GatewayException(ErrorKind kind, HostStatus hostStatus, String message, String detail, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (hostStatus == null) {
            throw new IllegalArgumentException("hostStatus cannot be null");
        }
        this.kind = kind;
        this.hostStatus = hostStatus;
        this.detail = detail;
    }

    public GatewayException(ErrorKind kind, HostStatus hostStatus, String message) {
        this(kind, hostStatus, message, null, null);
    }

    public ErrorKind kind() {
        return kind;
    }

    public HostStatus hostStatus() {
        return hostStatus;
    }

    public String detail() {
        return detail;
    }

    /**
     * 백엔드 도메인 사유.
     *
     * @return BACKEND_REJECTED가 아니면 null
     */
    public BackendErrorCode backendReason() {
        return null;
    }

    /**
     * ErrorContext로 변환.
     *
     * @param origin 동작 이름 (null 가능)
     * @return ErrorContext
     */
    public ErrorContext toErrorContext(String origin) {
        return new ErrorContext(kind, hostStatus, getMessage(), detail, origin, backendReason());
    }
}
