package com.ryuqq.cryptogateway.adapter.resilience;

import com.ryuqq.cryptogateway.core.model.CallId;
import com.ryuqq.cryptogateway.core.protection.CircuitBreaker;
import com.ryuqq.cryptogateway.core.protection.CircuitBreakerConfig;
import com.ryuqq.cryptogateway.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.cryptogateway.core.protection.CircuitBreakerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 연속 실패 횟수 기반 Circuit Breaker.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED    ── 연속 실패 failureThreshold회 ─────────────────────→ OPEN
 * OPEN      ── 마지막 실패 후 timeout 경과 (다음 조회 시점) ───────→ HALF_OPEN
 * HALF_OPEN ── 탐색 halfOpenMaxCalls회 완료, 성공 비율 ≥ successThreshold → CLOSED
 * HALF_OPEN ── 탐색 실패 1회, 또는 완료 후 비율 미달 ─────────────────→ OPEN
 * </pre>
 *
 * <p>OPEN → HALF_OPEN 전이는 별도 타이머 없이 {@link #tryAcquire}/{@link #getState} 호출 시점에
 * 시계를 보고 결정합니다. 상태와 카운터는 하나의 {@link ReentrantLock}으로 보호됩니다.</p>
 *
 * <p>HALF_OPEN에서는 그 상태에서 허가한 CallId만 탐색으로 셉니다. 이전 상태에서 허가된 호출이
 * 늦게 끝나며 보고하는 성공/실패/반납은 탐색 결과에 반영하지 않습니다.</p>
 *
 * <p>탐색 실패는 한 번이라도 즉시 OPEN으로 되돌리므로, 모든 탐색이 끝난 시점의 성공 비율은 항상 1.0입니다.
 * 따라서 {@code successThreshold}는 CLOSED 전이를 막지 않으며, 전이 조건은 사실상
 * "halfOpenMaxCalls회 연속 탐색 성공"입니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public final class CountingCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CountingCircuitBreaker.class);

    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int consecutiveFailures;
    private final Set<CallId> trialCalls = new HashSet<>();
    private int halfOpenAdmitted;
    private int halfOpenInFlight;
    private int halfOpenCompleted;
    private int halfOpenSuccesses;
    private long rejectedCalls;
    private Instant lastFailureAt;

    public CountingCircuitBreaker(CircuitBreakerConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @param clock timeout 판정에 사용할 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public CountingCircuitBreaker(CircuitBreakerConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
    }

    @Override
    public boolean tryAcquire(CallId callId) {
        lock.lock();
        try {
            advanceIfTimeoutElapsed();
            switch (state) {
                case CLOSED:
                    return true;
                case HALF_OPEN:
                    if (halfOpenAdmitted < config.halfOpenMaxCalls()) {
                        halfOpenAdmitted++;
                        halfOpenInFlight++;
                        trialCalls.add(callId);
                        log.debug("Half-open probe {}/{} admitted: {}",
                            halfOpenAdmitted, config.halfOpenMaxCalls(), callId.getValue());
                        return true;
                    }
                    rejectedCalls++;
                    return false;
                default:
                    rejectedCalls++;
                    return false;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordSuccess(CallId callId) {
        lock.lock();
        try {
            if (state == CircuitBreakerState.CLOSED) {
                consecutiveFailures = 0;
            } else if (state.isProbing() && trialCalls.remove(callId)) {
                halfOpenInFlight--;
                halfOpenCompleted++;
                halfOpenSuccesses++;
                decideAfterProbes();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordFailure(CallId callId, Throwable throwable) {
        lock.lock();
        try {
            lastFailureAt = clock.instant();
            if (state == CircuitBreakerState.CLOSED) {
                consecutiveFailures++;
                if (consecutiveFailures >= config.failureThreshold()) {
                    open("failure threshold " + config.failureThreshold() + " reached (last: " + describe(throwable) + ")");
                }
            } else if (state.isProbing() && trialCalls.remove(callId)) {
                open("half-open probe " + callId.getValue() + " failed: " + describe(throwable));
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void releasePermit(CallId callId) {
        lock.lock();
        try {
            if (state.isProbing() && trialCalls.remove(callId)) {
                halfOpenInFlight--;
                halfOpenAdmitted--;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerState getState() {
        lock.lock();
        try {
            advanceIfTimeoutElapsed();
            return state;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerSnapshot snapshot() {
        lock.lock();
        try {
            advanceIfTimeoutElapsed();
            return new CircuitBreakerSnapshot(state, consecutiveFailures, halfOpenInFlight, halfOpenSuccesses,
                rejectedCalls, lastFailureAt);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset() {
        lock.lock();
        try {
            state = CircuitBreakerState.CLOSED;
            consecutiveFailures = 0;
            resetProbes();
            rejectedCalls = 0;
            lastFailureAt = null;
        } finally {
            lock.unlock();
        }
    }

    // ========== 내부 구현 (호출자가 잠금을 보유) ==========

    private void advanceIfTimeoutElapsed() {
        if (state == CircuitBreakerState.OPEN
            && !clock.instant().isBefore(lastFailureAt.plus(config.timeout()))) {
            state = CircuitBreakerState.HALF_OPEN;
            resetProbes();
            log.info("Circuit breaker OPEN -> HALF_OPEN after {}ms", config.timeout().toMillis());
        }
    }

    private void decideAfterProbes() {
        if (halfOpenCompleted < config.halfOpenMaxCalls()) {
            return;
        }
        double ratio = (double) halfOpenSuccesses / halfOpenCompleted;
        if (ratio >= config.successThreshold()) {
            state = CircuitBreakerState.CLOSED;
            consecutiveFailures = 0;
            resetProbes();
            log.info("Circuit breaker HALF_OPEN -> CLOSED (success ratio {})", ratio);
        } else {
            open("half-open success ratio " + ratio + " below " + config.successThreshold());
        }
    }

    private void open(String reason) {
        CircuitBreakerState previous = state;
        state = CircuitBreakerState.OPEN;
        consecutiveFailures = 0;
        resetProbes();
        log.warn("Circuit breaker {} -> OPEN: {}", previous, reason);
    }

    private void resetProbes() {
        trialCalls.clear();
        halfOpenAdmitted = 0;
        halfOpenInFlight = 0;
        halfOpenCompleted = 0;
        halfOpenSuccesses = 0;
    }

    private static String describe(Throwable throwable) {
        return throwable == null ? "unknown" : throwable.getClass().getSimpleName() + ": " + throwable.getMessage();
    }
}
