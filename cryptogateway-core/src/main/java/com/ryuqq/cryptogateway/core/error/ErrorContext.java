package com.ryuqq.cryptogateway.core.error;

/**
 * 실패한 게이트웨이 호출의 오류 정보.
 *
 * <p>호스트의 "last error" 조회에 사용되는 불변 값입니다. 실패한 호출마다 정확히 하나의
 * ErrorContext가 만들어지며, {@code hostStatus}는 항상 실패 코드입니다.</p>
 *
 * @param kind 오류 분류
 * @param hostStatus 호스트에 보고할 코드 (SUCCESS 불가)
 * @param message 사람이 읽을 수 있는 설명 (non-blank)
 * @param detail 추가 정보 (선택, null 가능)
 * @param origin 오류가 발생한 게이트웨이 동작 이름 (선택, null 가능)
 * @param backendReason BACKEND_REJECTED인 경우 백엔드 도메인 사유 (그 외 null)
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public record ErrorContext(
    ErrorKind kind,
    HostStatus hostStatus,
    String message,
    String detail,
    String origin,
    BackendErrorCode backendReason
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind/hostStatus가 null이거나, hostStatus가 SUCCESS이거나,
     *                                  message가 비어 있는 경우
     */
    public ErrorContext {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (hostStatus == null) {
            throw new IllegalArgumentException("hostStatus cannot be null");
        }
        if (hostStatus.isSuccess()) {
            throw new IllegalArgumentException("hostStatus cannot be SUCCESS for an error");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * 최소 정보로 ErrorContext 생성.
     *
     * @param kind 오류 분류
     * @param hostStatus 호스트 코드
     * @param message 설명
     * @return ErrorContext 인스턴스
     */
    public static ErrorContext of(ErrorKind kind, HostStatus hostStatus, String message) {
        return new ErrorContext(kind, hostStatus, message, null, null, null);
    }

    /**
     * origin을 바꾼 복사본 생성.
     *
     * @param newOrigin 동작 이름
     * @return 새 ErrorContext
     */
    public ErrorContext withOrigin(String newOrigin) {
        return new ErrorContext(kind, hostStatus, message, detail, newOrigin, backendReason);
    }

    /**
     * 로그/진단용 한 줄 요약.
     *
     * @return "[origin] KIND HOST_STATUS: message (detail)" 형식 문자열
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        if (origin != null) {
            sb.append('[').append(origin).append("] ");
        }
        sb.append(kind).append(' ').append(hostStatus).append(": ").append(message);
        if (backendReason != null) {
            sb.append(" reason=").append(backendReason);
        }
        if (detail != null && !detail.isBlank()) {
            sb.append(" (").append(detail).append(')');
        }
        return sb.toString();
    }
}
