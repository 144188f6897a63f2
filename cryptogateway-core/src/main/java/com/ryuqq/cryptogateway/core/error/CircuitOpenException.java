package com.ryuqq.cryptogateway.core.error;

/**
 * 서킷 브레이커가 호출을 차단함.
 *
 * <p>네트워크 호출은 시도되지 않았으며, 브레이커 카운터에도 영향을 주지 않습니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public class CircuitOpenException extends GatewayException {

    public CircuitOpenException(String message) {
        super(ErrorKind.CIRCUIT_OPEN, ErrorTranslator.kindToHost(ErrorKind.CIRCUIT_OPEN), message, null, null);
    }
}
