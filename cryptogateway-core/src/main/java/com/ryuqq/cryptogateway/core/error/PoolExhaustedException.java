package com.ryuqq.cryptogateway.core.error;

import java.time.Duration;

/**
 * connectTimeout 내에 풀에서 연결을 얻지 못함.
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public class PoolExhaustedException extends GatewayException {

    public PoolExhaustedException(int maxConnections, Duration waited) {
        super(ErrorKind.POOL_EXHAUSTED, ErrorTranslator.kindToHost(ErrorKind.POOL_EXHAUSTED),
            "Connection pool exhausted (maxConnections=" + maxConnections + ") after waiting " + waited.toMillis() + "ms",
            null, null);
    }

    public PoolExhaustedException(String message) {
        super(ErrorKind.POOL_EXHAUSTED, ErrorTranslator.kindToHost(ErrorKind.POOL_EXHAUSTED), message, null, null);
    }
}
