package com.ryuqq.cryptogateway.core.error;

/**
 * 원격 호출의 전송 계층 실패.
 *
 * <p>{@link TransportStatus#DEADLINE_EXCEEDED}이면 DEADLINE_EXCEEDED로, 그 외에는
 * TRANSPORT_ERROR로 분류됩니다. 호스트 코드는 {@link ErrorTranslator#transportToHost}로 결정됩니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public class TransportException extends GatewayException {

    private final TransportStatus status;

    public TransportException(TransportStatus status, String message, Throwable cause) {
        super(ErrorTranslator.transportToKind(status), ErrorTranslator.transportToHost(status),
            message, "transport=" + status, cause);
        this.status = status;
    }

    public TransportException(TransportStatus status, String message) {
        this(status, message, null);
    }

    public TransportStatus status() {
        return status;
    }
}
