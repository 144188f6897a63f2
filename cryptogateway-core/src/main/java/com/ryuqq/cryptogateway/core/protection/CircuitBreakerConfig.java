package com.ryuqq.cryptogateway.core.protection;

import java.time.Duration;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>failureThreshold: OPEN으로 전이하는 연속 실패 수 (기본 5)</li>
 *   <li>timeout: OPEN 유지 시간, 마지막 실패 기준 (기본 60초)</li>
 *   <li>halfOpenMaxCalls: HALF_OPEN에서 허용하는 탐색 호출 수 (기본 3)</li>
 *   <li>successThreshold: HALF_OPEN에서 CLOSED로 가기 위한 성공 비율 (기본 0.6)</li>
 * </ul>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 * @param failureThreshold 연속 실패 임계값 (1 이상)
 * @param timeout OPEN 유지 시간 (양수)
 * @param halfOpenMaxCalls 탐색 호출 수 (1 이상)
 * @param successThreshold 성공 비율 (0 초과 1 이하)
 */
public record CircuitBreakerConfig(
    int failureThreshold,
    Duration timeout,
    int halfOpenMaxCalls,
    double successThreshold
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: failureThreshold=5, timeout=60s, halfOpenMaxCalls=3, successThreshold=0.6</p>
     */
    public CircuitBreakerConfig() {
        this(5, Duration.ofSeconds(60), 3, 0.6);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")"
            );
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException(
                "timeout must be positive (current: " + timeout + ")"
            );
        }
        if (halfOpenMaxCalls <= 0) {
            throw new IllegalArgumentException(
                "halfOpenMaxCalls must be positive (current: " + halfOpenMaxCalls + ")"
            );
        }
        if (!(successThreshold > 0.0 && successThreshold <= 1.0)) {
            throw new IllegalArgumentException(
                "successThreshold must be in (0, 1] (current: " + successThreshold + ")"
            );
        }
    }

    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, timeout, halfOpenMaxCalls, successThreshold);
    }

    public CircuitBreakerConfig withTimeout(Duration timeout) {
        return new CircuitBreakerConfig(failureThreshold, timeout, halfOpenMaxCalls, successThreshold);
    }

    public CircuitBreakerConfig withHalfOpenMaxCalls(int halfOpenMaxCalls) {
        return new CircuitBreakerConfig(failureThreshold, timeout, halfOpenMaxCalls, successThreshold);
    }

    public CircuitBreakerConfig withSuccessThreshold(double successThreshold) {
        return new CircuitBreakerConfig(failureThreshold, timeout, halfOpenMaxCalls, successThreshold);
    }
}
