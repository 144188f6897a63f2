package com.ryuqq.cryptogateway.application.invoke;

import com.ryuqq.cryptogateway.core.error.BackendConnectException;
import com.ryuqq.cryptogateway.core.error.BackendErrorCode;
import com.ryuqq.cryptogateway.core.error.BackendRejectedException;
import com.ryuqq.cryptogateway.core.error.CircuitOpenException;
import com.ryuqq.cryptogateway.core.error.ErrorKind;
import com.ryuqq.cryptogateway.core.error.GatewayException;
import com.ryuqq.cryptogateway.core.error.HostStatus;
import com.ryuqq.cryptogateway.core.error.PoolExhaustedException;
import com.ryuqq.cryptogateway.core.error.TransportException;
import com.ryuqq.cryptogateway.core.error.TransportStatus;
import com.ryuqq.cryptogateway.core.model.CallId;
import com.ryuqq.cryptogateway.core.protection.CircuitBreaker;
import com.ryuqq.cryptogateway.core.protection.CircuitBreakerState;
import com.ryuqq.cryptogateway.core.spi.BackendChannel;
import com.ryuqq.cryptogateway.core.spi.ConnectionPool;
import com.ryuqq.cryptogateway.core.spi.ConnectionPoolConfig;
import com.ryuqq.cryptogateway.core.spi.PooledConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

/**
 * RemoteInvoker 유닛 테스트.
 *
 * <p>결과 분류별로 브레이커, 커넥션 풀, 카운터가 어떻게 갱신되는지 검증합니다:</p>
 * <ul>
 *   <li>성공 → recordSuccess + release</li>
 *   <li>브레이커 OPEN → 네트워크 시도 없이 CIRCUIT_OPEN</li>
 *   <li>풀 고갈 → releasePermit (성공도 실패도 아님)</li>
 *   <li>타임아웃 → invalidate + recordFailure + DEADLINE_EXCEEDED</li>
 *   <li>백엔드 거부 → recordSuccess + release (전송은 정상)</li>
 * </ul>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class RemoteInvokerTest {

    @Mock
    private ConnectionPool pool;

    @Mock
    private CircuitBreaker circuitBreaker;

    @Mock
    private PooledConnection connection;

    @Mock
    private BackendChannel channel;

    private RemoteInvoker invoker;

    @BeforeEach
    void setUp() {
        when(pool.config()).thenReturn(new ConnectionPoolConfig().withRequestTimeout(Duration.ofMillis(200)));
        lenient().when(connection.channel()).thenReturn(channel);
        lenient().when(connection.id()).thenReturn(1L);
        invoker = new RemoteInvoker(pool, circuitBreaker, RetryPolicy.none());
    }

    @AfterEach
    void tearDown() {
        invoker.close();
    }

    // ============================================================
    // 1. 성공
    // ============================================================

    @Test
    void invoke_성공하면_recordSuccess_후_연결_반납() {
        // given
        when(circuitBreaker.tryAcquire(any(CallId.class))).thenReturn(true);
        when(pool.acquire()).thenReturn(connection);
        when(channel.generateRandom(4)).thenReturn(new byte[]{1, 2, 3, 4});

        // when
        byte[] result = invoker.invoke("generateRandom", ch -> ch.generateRandom(4));

        // then
        assertThat(result).containsExactly(1, 2, 3, 4);
        verify(circuitBreaker).recordSuccess(any(CallId.class));
        verify(pool).release(connection);
        verify(pool, never()).invalidate(any());
        assertThat(invoker.totalRequests()).isEqualTo(1);
        assertThat(invoker.successfulRequests()).isEqualTo(1);
        assertThat(invoker.failedRequests()).isZero();
    }

    // ============================================================
    // 2. 브레이커 차단
    // ============================================================

    @Test
    void invoke_브레이커가_차단하면_네트워크_시도_없이_CIRCUIT_OPEN() {
        // given
        when(circuitBreaker.tryAcquire(any(CallId.class))).thenReturn(false);
        when(circuitBreaker.getState()).thenReturn(CircuitBreakerState.OPEN);

        // when & then
        assertThatThrownBy(() -> invoker.invoke("sign", ch -> ch.generateRandom(1)))
            .isInstanceOf(CircuitOpenException.class)
            .hasMessageContaining("backend marked unavailable")
            .satisfies(e -> assertThat(((GatewayException) e).hostStatus()).isEqualTo(HostStatus.DEVICE_NOT_READY));

        verify(pool, never()).acquire();
        verify(circuitBreaker, never()).recordFailure(any(), any());
        verify(circuitBreaker, never()).recordSuccess(any());
        assertThat(invoker.circuitBreakerRejects()).isEqualTo(1);
        assertThat(invoker.failedRequests()).isEqualTo(1);
    }

    // ============================================================
    // 3. 커넥션 획득 실패
    // ============================================================

    @Test
    void invoke_풀_고갈이면_허가만_반환하고_실패로_기록하지_않음() {
        // given
        when(circuitBreaker.tryAcquire(any(CallId.class))).thenReturn(true);
        when(pool.acquire()).thenThrow(new PoolExhaustedException(3, Duration.ofMillis(50)));

        // when & then
        assertThatThrownBy(() -> invoker.invoke("getKey", ch -> ch.getKey("k")))
            .isInstanceOf(PoolExhaustedException.class);

        verify(circuitBreaker).releasePermit(any(CallId.class));
        verify(circuitBreaker, never()).recordFailure(any(), any());
    }

    @Test
    void invoke_연결_실패는_브레이커_실패로_기록() {
        // given
        BackendConnectException failure = new BackendConnectException("localhost:50051", "refused", null);
        when(circuitBreaker.tryAcquire(any(CallId.class))).thenReturn(true);
        when(pool.acquire()).thenThrow(failure);

        // when & then
        assertThatThrownBy(() -> invoker.invoke("getKey", ch -> ch.getKey("k")))
            .isSameAs(failure);

        verify(circuitBreaker).recordFailure(any(CallId.class), eq(failure));
    }

    // ============================================================
    // 4. 타임아웃
    // ============================================================

    @Test
    void invoke_requestTimeout_초과시_연결_폐기_및_DEADLINE_EXCEEDED() {
        // given
        when(circuitBreaker.tryAcquire(any(CallId.class))).thenReturn(true);
        when(pool.acquire()).thenReturn(connection);
        when(channel.generateRandom(anyInt())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return new byte[0];
        });

        // when & then
        assertThatThrownBy(() -> invoker.invoke("generateRandom", ch -> ch.generateRandom(8)))
            .isInstanceOf(TransportException.class)
            .satisfies(e -> {
                TransportException transport = (TransportException) e;
                assertThat(transport.kind()).isEqualTo(ErrorKind.DEADLINE_EXCEEDED);
                assertThat(transport.hostStatus()).isEqualTo(HostStatus.TIMEOUT);
            });

        verify(pool).invalidate(connection);
        verify(pool, never()).release(any());
        verify(circuitBreaker).recordFailure(any(CallId.class), any(TransportException.class));
    }

    // ============================================================
    // 5. 원격 실패 분류
    // ============================================================

    @Test
    void invoke_백엔드_거부는_브레이커_성공이고_연결은_재사용() {
        // given
        BackendRejectedException rejected = new BackendRejectedException(BackendErrorCode.KEY_NOT_FOUND, "missing");
        when(circuitBreaker.tryAcquire(any(CallId.class))).thenReturn(true);
        when(pool.acquire()).thenReturn(connection);
        when(channel.getKey("k")).thenThrow(rejected);

        // when & then
        assertThatThrownBy(() -> invoker.invoke("getKey", ch -> ch.getKey("k")))
            .isSameAs(rejected);

        verify(circuitBreaker).recordSuccess(any(CallId.class));
        verify(pool).release(connection);
        assertThat(invoker.failedRequests()).isEqualTo(1);
    }

    @Test
    void invoke_전송_실패시_채널이_비정상이면_연결_폐기() {
        // given
        when(circuitBreaker.tryAcquire(any(CallId.class))).thenReturn(true);
        when(pool.acquire()).thenReturn(connection);
        when(channel.getKey("k")).thenThrow(new TransportException(TransportStatus.UNAVAILABLE, "connection reset"));
        when(channel.isHealthy()).thenReturn(false);

        // when & then
        assertThatThrownBy(() -> invoker.invoke("getKey", ch -> ch.getKey("k")))
            .isInstanceOf(TransportException.class)
            .satisfies(e -> assertThat(((TransportException) e).hostStatus()).isEqualTo(HostStatus.DEVICE_NOT_READY));

        verify(circuitBreaker).recordFailure(any(CallId.class), any(TransportException.class));
        verify(pool).invalidate(connection);
    }

    @Test
    void invoke_전송_실패시_채널이_정상이면_연결_반납() {
        // given
        when(circuitBreaker.tryAcquire(any(CallId.class))).thenReturn(true);
        when(pool.acquire()).thenReturn(connection);
        when(channel.getKey("k")).thenThrow(new TransportException(TransportStatus.INTERNAL, "server bug"));
        when(channel.isHealthy()).thenReturn(true);

        // when & then
        assertThatThrownBy(() -> invoker.invoke("getKey", ch -> ch.getKey("k")))
            .isInstanceOf(TransportException.class);

        verify(pool).release(connection);
        verify(pool, never()).invalidate(any());
    }

    @Test
    void invoke_전송_실패후_상태_확인이_예외를_던지면_연결_폐기() {
        // given
        when(circuitBreaker.tryAcquire(any(CallId.class))).thenReturn(true);
        when(pool.acquire()).thenReturn(connection);
        when(channel.generateRandom(16)).thenThrow(new TransportException(TransportStatus.UNAVAILABLE, "connection reset"));
        when(channel.isHealthy()).thenThrow(new IllegalStateException("channel already shut down"));

        // when & then
        assertThatThrownBy(() -> invoker.invoke("generateRandom", ch -> ch.generateRandom(16)))
            .isInstanceOf(TransportException.class)
            .satisfies(e -> assertThat(((TransportException) e).status()).isEqualTo(TransportStatus.UNAVAILABLE));

        verify(circuitBreaker).recordFailure(any(CallId.class), any(TransportException.class));
        verify(pool).invalidate(connection);
        verify(pool, never()).release(any());
        assertThat(invoker.failedRequests()).isEqualTo(1);
    }

    @Test
    void invoke_예상하지_못한_예외는_INTERNAL_ERROR로_래핑() {
        // given
        when(circuitBreaker.tryAcquire(any(CallId.class))).thenReturn(true);
        when(pool.acquire()).thenReturn(connection);
        when(channel.generateRandom(1)).thenThrow(new IllegalStateException("boom"));

        // when & then
        assertThatThrownBy(() -> invoker.invoke("generateRandom", ch -> ch.generateRandom(1)))
            .isInstanceOf(GatewayException.class)
            .satisfies(e -> {
                GatewayException gateway = (GatewayException) e;
                assertThat(gateway.kind()).isEqualTo(ErrorKind.INTERNAL_ERROR);
                assertThat(gateway.hostStatus()).isEqualTo(HostStatus.FAIL);
                assertThat(gateway.getCause()).isInstanceOf(IllegalStateException.class);
            });

        verify(pool).invalidate(connection);
        verify(circuitBreaker).recordFailure(any(CallId.class), any(IllegalStateException.class));
    }

    // ============================================================
    // 6. 재시도
    // ============================================================

    @Test
    void invoke_재시도_정책이_허용하면_전송_실패_후_다시_시도() {
        // given
        invoker.close();
        RetryPolicy retry = RetryPolicy.of(3, ErrorKind.TRANSPORT_ERROR)
            .withBackoff(new BackoffCalculator(1, 5, 0.0));
        invoker = new RemoteInvoker(pool, circuitBreaker, retry);

        AtomicInteger attempts = new AtomicInteger();
        when(circuitBreaker.tryAcquire(any(CallId.class))).thenReturn(true);
        when(pool.acquire()).thenReturn(connection);
        when(channel.isHealthy()).thenReturn(true);
        when(channel.generateRandom(2)).thenAnswer(invocation -> {
            if (attempts.incrementAndGet() < 3) {
                throw new TransportException(TransportStatus.UNAVAILABLE, "flaky");
            }
            return new byte[]{7, 7};
        });

        // when
        byte[] result = invoker.invoke("generateRandom", ch -> ch.generateRandom(2));

        // then
        assertThat(result).containsExactly(7, 7);
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(invoker.totalRequests()).isEqualTo(3);
        assertThat(invoker.successfulRequests()).isEqualTo(1);
    }

    @Test
    void invoke_CIRCUIT_OPEN은_재시도하지_않음() {
        // given
        invoker.close();
        RetryPolicy retry = RetryPolicy.of(5, ErrorKind.CIRCUIT_OPEN, ErrorKind.TRANSPORT_ERROR)
            .withBackoff(new BackoffCalculator(1, 5, 0.0));
        invoker = new RemoteInvoker(pool, circuitBreaker, retry);
        when(circuitBreaker.tryAcquire(any(CallId.class))).thenReturn(false);
        when(circuitBreaker.getState()).thenReturn(CircuitBreakerState.HALF_OPEN);

        // when & then
        assertThatThrownBy(() -> invoker.invoke("sign", ch -> ch.generateRandom(1)))
            .isInstanceOf(CircuitOpenException.class);

        verify(circuitBreaker, times(1)).tryAcquire(any(CallId.class));
    }
}
