package com.ryuqq.cryptogateway.core.protection;

import com.ryuqq.cryptogateway.core.model.CallId;

/**
 * Circuit Breaker SPI.
 *
 * <p>원격 백엔드 호출의 실패를 추적하고, 임계값에 도달하면 빠르게 실패(Fail-Fast)하여
 * 장애가 난 백엔드로 요청이 몰리는 것을 막습니다.</p>
 *
 * <p><strong>Circuit Breaker 패턴:</strong></p>
 * <ul>
 *   <li>CLOSED: 정상 동작, 연속 실패 추적</li>
 *   <li>OPEN: 요청 차단, 빠른 실패</li>
 *   <li>HALF_OPEN: 제한된 요청으로 복구 테스트</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CallId callId = CallId.next("signHash");
 *
 * if (!cb.tryAcquire(callId)) {
 *     throw new CircuitOpenException("Circuit breaker is OPEN");
 * }
 *
 * PooledConnection connection;
 * try {
 *     connection = pool.acquire();
 * } catch (PoolExhaustedException e) {
 *     cb.releasePermit(callId);   // 호출하지 않았으므로 성공도 실패도 아님
 *     throw e;
 * }
 *
 * try {
 *     byte[] signature = connection.channel().sign(request);
 *     cb.recordSuccess(callId);
 *     return signature;
 * } catch (TransportException e) {
 *     cb.recordFailure(callId, e);
 *     throw e;
 * }
 * }</pre>
 *
 * <p><strong>Thread Safety:</strong> 구현체는 여러 스레드에서 동시에 호출될 수 있어야 합니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * Circuit Breaker 통과 허용 여부 확인.
     *
     * <ul>
     *   <li>CLOSED: 항상 true 반환</li>
     *   <li>OPEN: timeout이 지나지 않았으면 false, 지났으면 HALF_OPEN으로 전이 후 판단</li>
     *   <li>HALF_OPEN: halfOpenMaxCalls개까지만 true</li>
     * </ul>
     *
     * @param callId 호출 ID (통계 및 로깅용)
     * @return true: 요청 통과 허용, false: 요청 차단
     */
    boolean tryAcquire(CallId callId);

    /**
     * 실행 성공 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패 카운터 초기화</li>
     *   <li>HALF_OPEN: 성공 카운터 증가, 탐색 호출이 모두 끝나면 성공 비율로 CLOSED/OPEN 결정</li>
     * </ul>
     *
     * @param callId 호출 ID
     */
    void recordSuccess(CallId callId);

    /**
     * 실행 실패 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패 카운터 증가, failureThreshold 도달 시 OPEN으로 전이</li>
     *   <li>HALF_OPEN: 즉시 OPEN으로 전이</li>
     * </ul>
     *
     * @param callId 호출 ID
     * @param throwable 발생한 예외
     */
    void recordFailure(CallId callId, Throwable throwable);

    /**
     * 사용하지 않은 통과 허가 반환.
     *
     * <p>tryAcquire가 true를 반환했지만 로컬 사유(예: 풀 고갈)로 원격 호출을 시도하지 않은 경우
     * 호출합니다. 성공/실패 어느 쪽으로도 집계되지 않으며, HALF_OPEN에서는 탐색 슬롯이 반환됩니다.</p>
     *
     * @param callId 호출 ID
     */
    void releasePermit(CallId callId);

    /**
     * 현재 Circuit Breaker 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 진단용 상태/카운터 스냅샷.
     *
     * @return 스냅샷
     */
    CircuitBreakerSnapshot snapshot();

    /**
     * Circuit Breaker를 CLOSED 상태로 강제 리셋.
     *
     * <p>모든 카운터를 초기화합니다. 수동 복구 또는 테스트 목적으로 사용됩니다.</p>
     */
    void reset();
}
