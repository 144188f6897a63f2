package com.ryuqq.cryptogateway.core.spi;

/**
 * 커넥션 풀 통계.
 *
 * @param total 현재 살아 있는 연결 수 (idle + inUse)
 * @param idle 유휴 연결 수
 * @param inUse 대여 중인 연결 수
 * @param created 누적 생성 수
 * @param disposed 누적 폐기 수
 * @param exhausted 누적 풀 고갈 횟수
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public record PoolStats(int total, int idle, int inUse, long created, long disposed, long exhausted) {
}
