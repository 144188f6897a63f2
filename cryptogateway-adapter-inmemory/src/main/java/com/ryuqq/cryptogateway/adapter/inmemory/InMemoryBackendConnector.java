package com.ryuqq.cryptogateway.adapter.inmemory;

import com.ryuqq.cryptogateway.core.error.BackendConnectException;
import com.ryuqq.cryptogateway.core.spi.BackendConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 인메모리 백엔드용 커넥터.
 *
 * <p>연결 시도 횟수를 세어 테스트가 "네트워크 시도 없음"을 확인할 수 있게 합니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public class InMemoryBackendConnector implements BackendConnector {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBackendConnector.class);

    private final InMemoryCryptoBackend backend;
    private final String target;
    private final AtomicLong sessions = new AtomicLong();
    private final AtomicLong connectAttempts = new AtomicLong();

    public InMemoryBackendConnector(InMemoryCryptoBackend backend) {
        this(backend, "inmemory://default");
    }

    public InMemoryBackendConnector(InMemoryCryptoBackend backend, String target) {
        if (backend == null) {
            throw new IllegalArgumentException("backend cannot be null");
        }
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target cannot be null or blank");
        }
        this.backend = backend;
        this.target = target;
    }

    @Override
    public InMemoryBackendChannel connect(Duration connectTimeout) {
        connectAttempts.incrementAndGet();
        if (!backend.isAvailable()) {
            throw new BackendConnectException(target, "In-memory backend is unavailable", null);
        }
        InMemoryBackendChannel channel = new InMemoryBackendChannel(backend, sessions.incrementAndGet());
        log.debug("Connected to {} (session #{})", target, channel.sessionId());
        return channel;
    }

    @Override
    public String target() {
        return target;
    }

    public long connectAttempts() {
        return connectAttempts.get();
    }

    public InMemoryCryptoBackend backend() {
        return backend;
    }
}
