package com.ryuqq.cryptogateway.core.spi;

/**
 * 백엔드 커넥션 풀 SPI.
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>동시에 존재하는 연결 수는 maxConnections를 넘지 않습니다.</li>
 *   <li>하나의 연결은 동시에 두 호출자에게 대여되지 않습니다.</li>
 *   <li>여유 연결이 없고 상한에 도달했으면 connectTimeout까지 대기 후
 *       {@link com.ryuqq.cryptogateway.core.error.PoolExhaustedException}으로 실패합니다.</li>
 *   <li>대여되지 않은 연결을 release하면 {@link IllegalStateException}입니다.</li>
 * </ul>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public interface ConnectionPool extends AutoCloseable {

    /**
     * 연결 대여.
     *
     * @return 독점 사용 가능한 연결
     * @throws com.ryuqq.cryptogateway.core.error.PoolExhaustedException connectTimeout 내에 연결을 얻지 못한 경우
     * @throws com.ryuqq.cryptogateway.core.error.BackendConnectException 새 채널 생성에 실패한 경우
     */
    PooledConnection acquire();

    /**
     * 연결 반납.
     *
     * @param connection 대여했던 연결
     * @throws IllegalStateException 대여 중이 아닌 연결인 경우
     */
    void release(PooledConnection connection);

    /**
     * 대여 중인 연결을 영구 폐기.
     *
     * <p>타임아웃으로 상태를 알 수 없는 연결에 사용합니다. 유휴 목록으로 돌아가지 않습니다.</p>
     *
     * @param connection 대여했던 연결
     * @throws IllegalStateException 대여 중이 아닌 연결인 경우
     */
    void invalidate(PooledConnection connection);

    /**
     * idleTimeout을 넘긴 유휴 연결 정리.
     *
     * @return 폐기한 연결 수
     */
    int sweepIdle();

    PoolStats stats();

    ConnectionPoolConfig config();

    /**
     * 유휴 연결을 모두 폐기하고 이후 acquire를 거부합니다.
     */
    @Override
    void close();
}
