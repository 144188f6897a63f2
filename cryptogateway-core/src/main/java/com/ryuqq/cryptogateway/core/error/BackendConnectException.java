package com.ryuqq.cryptogateway.core.error;

/**
 * 백엔드 채널 생성 실패 (DNS, TLS 핸드셰이크, 연결 거부, 연결 대기 시간 초과).
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public class BackendConnectException extends GatewayException {

    private final String target;

    public BackendConnectException(String target, String message, Throwable cause) {
        super(ErrorKind.CONNECT_ERROR, ErrorTranslator.kindToHost(ErrorKind.CONNECT_ERROR),
            "Failed to connect to " + target + ": " + message, null, cause);
        this.target = target;
    }

    public String target() {
        return target;
    }
}
