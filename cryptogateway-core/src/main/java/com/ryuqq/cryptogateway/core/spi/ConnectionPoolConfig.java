package com.ryuqq.cryptogateway.core.spi;

import java.time.Duration;

/**
 * 커넥션 풀 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxConnections: 동시에 존재할 수 있는 최대 연결 수 (기본 10)</li>
 *   <li>idleTimeout: 유휴 연결 폐기 기준 (기본 30초)</li>
 *   <li>connectTimeout: 연결 획득 대기 상한, 새 채널 생성 포함 (기본 5초)</li>
 *   <li>requestTimeout: 원격 호출 하나의 상한 (기본 10초)</li>
 *   <li>idleSweepInterval: 백그라운드 유휴 정리 주기 (기본 10초)</li>
 * </ul>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 * @param maxConnections 최대 연결 수 (1 이상)
 * @param idleTimeout 유휴 폐기 기준 (양수)
 * @param connectTimeout 연결 획득 대기 상한 (양수)
 * @param requestTimeout 원격 호출 상한 (양수)
 * @param idleSweepInterval 유휴 정리 주기 (양수)
 */
public record ConnectionPoolConfig(
    int maxConnections,
    Duration idleTimeout,
    Duration connectTimeout,
    Duration requestTimeout,
    Duration idleSweepInterval
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxConnections=10, idleTimeout=30s, connectTimeout=5s, requestTimeout=10s,
     * idleSweepInterval=10s</p>
     */
    public ConnectionPoolConfig() {
        this(10, Duration.ofSeconds(30), Duration.ofSeconds(5), Duration.ofSeconds(10), Duration.ofSeconds(10));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ConnectionPoolConfig {
        if (maxConnections <= 0) {
            throw new IllegalArgumentException(
                "maxConnections must be positive (current: " + maxConnections + ")"
            );
        }
        requirePositive("idleTimeout", idleTimeout);
        requirePositive("connectTimeout", connectTimeout);
        requirePositive("requestTimeout", requestTimeout);
        requirePositive("idleSweepInterval", idleSweepInterval);
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }

    public ConnectionPoolConfig withMaxConnections(int maxConnections) {
        return new ConnectionPoolConfig(maxConnections, idleTimeout, connectTimeout, requestTimeout, idleSweepInterval);
    }

    public ConnectionPoolConfig withIdleTimeout(Duration idleTimeout) {
        return new ConnectionPoolConfig(maxConnections, idleTimeout, connectTimeout, requestTimeout, idleSweepInterval);
    }

    public ConnectionPoolConfig withConnectTimeout(Duration connectTimeout) {
        return new ConnectionPoolConfig(maxConnections, idleTimeout, connectTimeout, requestTimeout, idleSweepInterval);
    }

    public ConnectionPoolConfig withRequestTimeout(Duration requestTimeout) {
        return new ConnectionPoolConfig(maxConnections, idleTimeout, connectTimeout, requestTimeout, idleSweepInterval);
    }

    public ConnectionPoolConfig withIdleSweepInterval(Duration idleSweepInterval) {
        return new ConnectionPoolConfig(maxConnections, idleTimeout, connectTimeout, requestTimeout, idleSweepInterval);
    }
}
