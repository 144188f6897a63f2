package com.ryuqq.cryptogateway.application.gateway;

import com.ryuqq.cryptogateway.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.cryptogateway.core.spi.PoolStats;

/**
 * 게이트웨이 진단 정보.
 *
 * @param totalRequests 원격 호출 시도 수
 * @param successfulRequests 성공한 원격 호출 수
 * @param failedRequests 실패한 원격 호출 수 (백엔드 거부 포함)
 * @param circuitBreakerRejects 브레이커가 차단한 호출 수
 * @param pool 커넥션 풀 통계
 * @param circuitBreaker 브레이커 상태
 * @param liveHandles 살아 있는 핸들 수
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public record GatewayStats(
    long totalRequests,
    long successfulRequests,
    long failedRequests,
    long circuitBreakerRejects,
    PoolStats pool,
    CircuitBreakerSnapshot circuitBreaker,
    int liveHandles
) {
}
