package com.ryuqq.cryptogateway.adapter.resilience;

import com.ryuqq.cryptogateway.core.error.BackendConnectException;
import com.ryuqq.cryptogateway.core.error.PoolExhaustedException;
import com.ryuqq.cryptogateway.core.spi.BackendChannel;
import com.ryuqq.cryptogateway.core.spi.BackendConnector;
import com.ryuqq.cryptogateway.core.spi.ConnectionPoolConfig;
import com.ryuqq.cryptogateway.core.spi.PoolStats;
import com.ryuqq.cryptogateway.core.spi.PooledConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * BoundedConnectionPool 테스트.
 *
 * <p>상한, 대기, 재사용, 폐기, 유휴 정리를 검증합니다. 백그라운드 sweeper는 끄고
 * {@link TestClock}으로 sweepIdle을 직접 구동합니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class BoundedConnectionPoolTest {

    @Mock
    private BackendConnector connector;

    private final List<BackendChannel> opened = new ArrayList<>();
    private TestClock clock;
    private BoundedConnectionPool pool;

    @BeforeEach
    void setUp() {
        clock = new TestClock(Instant.parse("2026-01-01T00:00:00Z"));
        lenient().when(connector.target()).thenReturn("backend.test:50051");
        lenient().when(connector.connect(any())).thenAnswer(invocation -> newChannel(new AtomicBoolean(true)));
        pool = newPool(new ConnectionPoolConfig().withMaxConnections(3).withConnectTimeout(Duration.ofMillis(200)));
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    // ============================================================
    // 1. 대여 / 반납
    // ============================================================

    @Test
    void acquire_Empty_OpensNewConnection() {
        // when
        PooledConnection connection = pool.acquire();

        // then
        assertThat(connection.channel()).isSameAs(opened.get(0));
        assertThat(connection.createdAt()).isEqualTo(clock.instant());
        assertThat(pool.stats()).isEqualTo(new PoolStats(1, 0, 1, 1, 0, 0));
    }

    @Test
    void acquire_AfterRelease_ReusesIdleConnection() {
        // given
        PooledConnection first = pool.acquire();
        clock.advance(Duration.ofSeconds(2));
        pool.release(first);

        // when
        PooledConnection second = pool.acquire();

        // then
        assertThat(second.id()).isEqualTo(first.id());
        assertThat(second.lastUsedAt()).isEqualTo(clock.instant());
        verify(connector, times(1)).connect(any());
    }

    @Test
    void release_Twice_ThrowsIllegalState() {
        // given
        PooledConnection connection = pool.acquire();
        pool.release(connection);

        // when & then
        assertThatThrownBy(() -> pool.release(connection))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("not checked out");
    }

    @Test
    void release_ForeignConnection_ThrowsIllegalState() {
        // given
        PooledConnection foreign = mock(PooledConnection.class);

        // when & then
        assertThatThrownBy(() -> pool.release(foreign))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void release_UnhealthyChannel_DisposesInsteadOfPooling() {
        // given
        AtomicBoolean healthy = new AtomicBoolean(true);
        doAnswer(invocation -> newChannel(healthy)).when(connector).connect(any());
        PooledConnection connection = pool.acquire();
        healthy.set(false);

        // when
        pool.release(connection);

        // then
        verify(connection.channel()).close();
        assertThat(pool.stats().idle()).isZero();
        assertThat(pool.stats().disposed()).isEqualTo(1);
    }

    // ============================================================
    // 2. 상한과 고갈
    // ============================================================

    @Test
    void acquire_AllConnectionsInUse_ThrowsPoolExhaustedAfterConnectTimeout() {
        // given
        pool.acquire();
        pool.acquire();
        pool.acquire();
        long start = System.nanoTime();

        // when & then
        assertThatThrownBy(() -> pool.acquire())
            .isInstanceOf(PoolExhaustedException.class);
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(150));

        PoolStats stats = pool.stats();
        assertThat(stats.inUse()).isEqualTo(3);
        assertThat(stats.exhausted()).isEqualTo(1);
        verify(connector, times(3)).connect(any());
    }

    @Test
    void acquire_WaitingCaller_ReceivesReleasedConnection() throws Exception {
        // given
        pool.close();
        pool = newPool(new ConnectionPoolConfig().withMaxConnections(1).withConnectTimeout(Duration.ofSeconds(5)));
        PooledConnection held = pool.acquire();

        // when
        CompletableFuture<PooledConnection> waiter = CompletableFuture.supplyAsync(() -> pool.acquire());
        Thread.sleep(100);
        assertThat(waiter).isNotDone();
        pool.release(held);

        // then
        PooledConnection received = waiter.get(2, TimeUnit.SECONDS);
        assertThat(received.id()).isEqualTo(held.id());
        verify(connector, times(1)).connect(any());
    }

    @Test
    void invalidate_FreesSlotAndClosesChannel() {
        // given
        PooledConnection a = pool.acquire();
        pool.acquire();
        pool.acquire();

        // when
        pool.invalidate(a);
        PooledConnection replacement = pool.acquire();

        // then
        verify(a.channel()).close();
        assertThat(replacement.id()).isNotEqualTo(a.id());
        assertThat(pool.stats()).isEqualTo(new PoolStats(3, 0, 3, 4, 1, 0));
    }

    @Test
    void acquire_ConnectFailure_ThrowsBackendConnectAndReleasesReservation() {
        // given
        doThrow(new IllegalStateException("refused"))
            .doAnswer(invocation -> newChannel(new AtomicBoolean(true)))
            .when(connector).connect(any());

        // when & then
        assertThatThrownBy(() -> pool.acquire())
            .isInstanceOf(BackendConnectException.class)
            .hasCauseInstanceOf(IllegalStateException.class);

        assertThat(pool.stats().total()).isZero();
        assertThat(pool.acquire()).isNotNull();
    }

    @Test
    void acquire_UnhealthyIdleConnection_IsDiscardedAndReplaced() {
        // given
        AtomicBoolean healthy = new AtomicBoolean(true);
        doAnswer(invocation -> newChannel(healthy))
            .doAnswer(invocation -> newChannel(new AtomicBoolean(true)))
            .when(connector).connect(any());
        PooledConnection stale = pool.acquire();
        pool.release(stale);
        healthy.set(false);

        // when
        PooledConnection fresh = pool.acquire();

        // then
        assertThat(fresh.id()).isNotEqualTo(stale.id());
        verify(stale.channel()).close();
        assertThat(pool.stats().disposed()).isEqualTo(1);
    }

    // ============================================================
    // 3. 유휴 정리
    // ============================================================

    @Test
    void sweepIdle_ClosesConnectionsPastIdleTimeout() {
        // given
        PooledConnection old = pool.acquire();
        PooledConnection recent = pool.acquire();
        pool.release(old);
        clock.advance(Duration.ofSeconds(20));
        pool.release(recent);
        clock.advance(Duration.ofSeconds(10));

        // when
        int swept = pool.sweepIdle();

        // then
        assertThat(swept).isEqualTo(1);
        verify(old.channel()).close();
        verify(recent.channel(), never()).close();
        assertThat(pool.stats().idle()).isEqualTo(1);
    }

    @Test
    void sweepIdle_NothingExpired_ReturnsZero() {
        pool.release(pool.acquire());
        clock.advance(Duration.ofSeconds(29));

        assertThat(pool.sweepIdle()).isZero();
    }

    // ============================================================
    // 4. 종료
    // ============================================================

    @Test
    void close_ClosesIdleAndRejectsFurtherAcquire() {
        // given
        PooledConnection idle = pool.acquire();
        PooledConnection busy = pool.acquire();
        pool.release(idle);

        // when
        pool.close();

        // then
        verify(idle.channel()).close();
        assertThatThrownBy(() -> pool.acquire())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("closed");

        pool.release(busy);
        verify(busy.channel()).close();
    }

    // ============================================================
    // 5. 동시성
    // ============================================================

    @Test
    void concurrentCallers_NeverExceedMaxConnections() throws Exception {
        // given
        pool.close();
        pool = newPool(new ConnectionPoolConfig().withMaxConnections(3).withConnectTimeout(Duration.ofSeconds(5)));
        int threads = 10;
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        List<CompletableFuture<Void>> futures = new ArrayList<>();

        // when
        for (int t = 0; t < threads; t++) {
            futures.add(CompletableFuture.runAsync(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < 20; i++) {
                    PooledConnection c = pool.acquire();
                    int now = concurrent.incrementAndGet();
                    peak.accumulateAndGet(now, Math::max);
                    concurrent.decrementAndGet();
                    pool.release(c);
                }
            }, executor));
        }
        start.countDown();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);
        executor.shutdown();

        // then
        assertThat(peak.get()).isLessThanOrEqualTo(3);
        assertThat(pool.stats().created()).isLessThanOrEqualTo(3);
        assertThat(pool.stats().inUse()).isZero();
    }

    // ========== 헬퍼 ==========

    private BoundedConnectionPool newPool(ConnectionPoolConfig config) {
        return new BoundedConnectionPool(connector, config, clock, false);
    }

    private BackendChannel newChannel(AtomicBoolean healthy) {
        BackendChannel channel = mock(BackendChannel.class);
        lenient().when(channel.isHealthy()).thenAnswer(invocation -> healthy.get());
        synchronized (opened) {
            opened.add(channel);
        }
        return channel;
    }
}
