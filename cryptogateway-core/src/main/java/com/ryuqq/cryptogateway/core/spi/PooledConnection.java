package com.ryuqq.cryptogateway.core.spi;

import java.time.Instant;

/**
 * 풀이 관리하는 연결.
 *
 * <p>acquire로 얻은 연결은 반드시 release 또는 invalidate로 돌려줘야 합니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public interface PooledConnection {

    long id();

    BackendChannel channel();

    Instant createdAt();

    Instant lastUsedAt();
}
