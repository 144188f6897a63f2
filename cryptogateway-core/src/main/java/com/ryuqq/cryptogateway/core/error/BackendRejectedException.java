package com.ryuqq.cryptogateway.core.error;

/**
 * 백엔드가 요청을 거부함.
 *
 * <p>전송은 성공했지만 백엔드가 도메인 오류를 보고한 경우입니다. 서킷 브레이커에는
 * 실패로 집계되지 않습니다 (백엔드는 정상 응답한 것이므로).</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public class BackendRejectedException extends GatewayException {

    private final BackendErrorCode reason;

    public BackendRejectedException(BackendErrorCode reason, String message) {
        super(ErrorKind.BACKEND_REJECTED, ErrorTranslator.backendToHost(orUnspecified(reason)),
            message == null || message.isBlank() ? "Backend rejected the request: " + orUnspecified(reason) : message,
            null, null);
        this.reason = orUnspecified(reason);
    }

    private static BackendErrorCode orUnspecified(BackendErrorCode reason) {
        return reason == null ? BackendErrorCode.UNSPECIFIED : reason;
    }

    public BackendErrorCode reason() {
        return reason;
    }

    @Override
    public BackendErrorCode backendReason() {
        return reason;
    }
}
