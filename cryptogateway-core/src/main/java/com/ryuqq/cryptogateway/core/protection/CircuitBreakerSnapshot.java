package com.ryuqq.cryptogateway.core.protection;

import java.time.Instant;

/**
 * Circuit Breaker 진단 스냅샷.
 *
 * @param state 현재 상태
 * @param consecutiveFailures CLOSED 상태의 연속 실패 수
 * @param halfOpenInFlight HALF_OPEN 상태에서 진행 중인 탐색 호출 수
 * @param halfOpenSuccesses HALF_OPEN 상태에서 성공한 탐색 호출 수
 * @param rejectedCalls 누적 차단 횟수
 * @param lastFailureAt 마지막 실패 시각 (없으면 null)
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public record CircuitBreakerSnapshot(
    CircuitBreakerState state,
    int consecutiveFailures,
    int halfOpenInFlight,
    int halfOpenSuccesses,
    long rejectedCalls,
    Instant lastFailureAt
) {

    public CircuitBreakerSnapshot {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
    }

    /**
     * 아무 것도 기록되지 않은 CLOSED 스냅샷.
     *
     * @return 초기 스냅샷
     */
    public static CircuitBreakerSnapshot closed() {
        return new CircuitBreakerSnapshot(CircuitBreakerState.CLOSED, 0, 0, 0, 0, null);
    }
}
