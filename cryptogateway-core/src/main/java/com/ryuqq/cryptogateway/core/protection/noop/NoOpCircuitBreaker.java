package com.ryuqq.cryptogateway.core.protection.noop;

import com.ryuqq.cryptogateway.core.model.CallId;
import com.ryuqq.cryptogateway.core.protection.CircuitBreaker;
import com.ryuqq.cryptogateway.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.cryptogateway.core.protection.CircuitBreakerState;

/**
 * 차단하지 않는 브레이커.
 *
 * <p>모든 원격 호출을 통과시키고 결과를 기록하지 않습니다. 백엔드 장애 시에도 호출마다
 * 연결과 타임아웃을 그대로 겪게 되므로 단위 테스트나 브레이커를 외부에서 운용하는 배포에서만 씁니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    private static final CircuitBreakerSnapshot ALWAYS_CLOSED = CircuitBreakerSnapshot.closed();

    @Override
    public boolean tryAcquire(CallId callId) {
        return true;
    }

    @Override
    public void recordSuccess(CallId callId) {
    }

    @Override
    public void recordFailure(CallId callId, Throwable throwable) {
    }

    @Override
    public void releasePermit(CallId callId) {
    }

    @Override
    public CircuitBreakerState getState() {
        return ALWAYS_CLOSED.state();
    }

    @Override
    public CircuitBreakerSnapshot snapshot() {
        return ALWAYS_CLOSED;
    }

    @Override
    public void reset() {
    }
}
