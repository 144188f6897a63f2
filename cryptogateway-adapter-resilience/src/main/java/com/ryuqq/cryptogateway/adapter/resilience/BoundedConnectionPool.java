package com.ryuqq.cryptogateway.adapter.resilience;

import com.ryuqq.cryptogateway.core.error.BackendConnectException;
import com.ryuqq.cryptogateway.core.error.PoolExhaustedException;
import com.ryuqq.cryptogateway.core.spi.BackendChannel;
import com.ryuqq.cryptogateway.core.spi.BackendConnector;
import com.ryuqq.cryptogateway.core.spi.ConnectionPool;
import com.ryuqq.cryptogateway.core.spi.ConnectionPoolConfig;
import com.ryuqq.cryptogateway.core.spi.PoolStats;
import com.ryuqq.cryptogateway.core.spi.PooledConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 상한이 있는 백엔드 연결 풀.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>유휴 연결은 LIFO로 재사용합니다. 최근에 쓰인 연결이 살아 있을 확률이 높습니다.</li>
 *   <li>유휴 연결이 없고 (대여 중 + 유휴 + 생성 중) &lt; maxConnections이면 자리를 예약하고
 *       잠금 밖에서 새 채널을 엽니다.</li>
 *   <li>상한에 도달했으면 반납을 기다리고, connectTimeout이 지나면
 *       {@link PoolExhaustedException}을 던집니다.</li>
 *   <li>대여 시 건강하지 않은 유휴 연결은 폐기하고 다음 후보를 봅니다.</li>
 *   <li>백그라운드 sweeper가 idleSweepInterval마다 idleTimeout을 넘긴 유휴 연결을 닫습니다.</li>
 * </ul>
 *
 * <p>채널 close는 항상 잠금 밖에서 수행합니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public final class BoundedConnectionPool implements ConnectionPool {

    private static final Logger log = LoggerFactory.getLogger(BoundedConnectionPool.class);

    private static final long SWEEPER_TERMINATION_TIMEOUT_SECONDS = 5;

    private final BackendConnector connector;
    private final ConnectionPoolConfig config;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private final Deque<PooledChannel> idle = new ArrayDeque<>();
    private final Set<PooledChannel> inUse = Collections.newSetFromMap(new IdentityHashMap<>());
    private final AtomicLong ids = new AtomicLong();

    private int pending;
    private long created;
    private long disposed;
    private long exhausted;
    private boolean closed;

    private final ScheduledExecutorService sweeper;

    public BoundedConnectionPool(BackendConnector connector, ConnectionPoolConfig config) {
        this(connector, config, Clock.systemUTC(), true);
    }

    /**
     * 생성자.
     *
     * @param connector 새 채널을 여는 커넥터
     * @param config 풀 설정
     * @param clock 유휴 시간 판정용 시계
     * @param backgroundSweep true면 idleSweepInterval 주기의 sweeper 스레드를 시작
     */
    public BoundedConnectionPool(BackendConnector connector, ConnectionPoolConfig config,
                                 Clock clock, boolean backgroundSweep) {
        if (connector == null) {
            throw new IllegalArgumentException("connector cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.connector = connector;
        this.config = config;
        this.clock = clock;

        if (backgroundSweep) {
            this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "cryptogateway-pool-sweeper");
                t.setDaemon(true);
                return t;
            });
            long intervalMs = config.idleSweepInterval().toMillis();
            sweeper.scheduleWithFixedDelay(this::sweepQuietly, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        } else {
            this.sweeper = null;
        }

        log.info("BoundedConnectionPool created: target={}, maxConnections={}, idleTimeout={}ms",
            connector.target(), config.maxConnections(), config.idleTimeout().toMillis());
    }

    // ========== 대여 / 반납 ==========

    @Override
    public PooledConnection acquire() {
        List<BackendChannel> toClose = new ArrayList<>();
        try {
            lock.lock();
            try {
                long remaining = config.connectTimeout().toNanos();
                while (true) {
                    if (closed) {
                        throw new IllegalStateException("Connection pool is closed");
                    }
                    PooledChannel candidate = idle.pollFirst();
                    if (candidate != null) {
                        if (isHealthy(candidate)) {
                            inUse.add(candidate);
                            return candidate;
                        }
                        disposed++;
                        toClose.add(candidate.channel());
                        log.debug("Discarded unhealthy idle connection #{}", candidate.id());
                        continue;
                    }
                    if (inUse.size() + pending < config.maxConnections()) {
                        pending++;
                        break;
                    }
                    if (remaining <= 0L) {
                        exhausted++;
                        log.warn("Connection pool exhausted: maxConnections={}, waited={}ms",
                            config.maxConnections(), config.connectTimeout().toMillis());
                        throw new PoolExhaustedException(config.maxConnections(), config.connectTimeout());
                    }
                    remaining = available.awaitNanos(remaining);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PoolExhaustedException("Interrupted while waiting for a backend connection");
            } finally {
                lock.unlock();
            }
        } finally {
            closeAll(toClose);
        }

        return connectReserved();
    }

    @Override
    public void release(PooledConnection connection) {
        PooledChannel pooled = checkedOut(connection);
        BackendChannel toClose = null;
        lock.lock();
        try {
            if (!inUse.remove(pooled)) {
                throw new IllegalStateException("Connection #" + connection.id() + " is not checked out from this pool");
            }
            pooled.touch(clock.instant());
            if (closed || !isHealthy(pooled)) {
                disposed++;
                toClose = pooled.channel();
            } else {
                idle.addFirst(pooled);
            }
            available.signal();
        } finally {
            lock.unlock();
        }
        if (toClose != null) {
            log.debug("Disposed connection #{} on release", connection.id());
            closeQuietly(toClose);
        }
    }

    @Override
    public void invalidate(PooledConnection connection) {
        PooledChannel pooled = checkedOut(connection);
        lock.lock();
        try {
            if (!inUse.remove(pooled)) {
                throw new IllegalStateException("Connection #" + connection.id() + " is not checked out from this pool");
            }
            disposed++;
            available.signal();
        } finally {
            lock.unlock();
        }
        log.debug("Invalidated connection #{}", connection.id());
        closeQuietly(pooled.channel());
    }

    // ========== 유휴 정리 ==========

    @Override
    public int sweepIdle() {
        List<BackendChannel> toClose = new ArrayList<>();
        lock.lock();
        try {
            Instant now = clock.instant();
            Iterator<PooledChannel> it = idle.iterator();
            while (it.hasNext()) {
                PooledChannel candidate = it.next();
                if (!candidate.lastUsedAt().plus(config.idleTimeout()).isAfter(now)) {
                    it.remove();
                    disposed++;
                    toClose.add(candidate.channel());
                }
            }
        } finally {
            lock.unlock();
        }
        if (!toClose.isEmpty()) {
            log.debug("Swept {} idle connection(s)", toClose.size());
        }
        closeAll(toClose);
        return toClose.size();
    }

    private void sweepQuietly() {
        try {
            sweepIdle();
        } catch (RuntimeException e) {
            log.error("Idle sweep failed", e);
        }
    }

    // ========== 조회 ==========

    @Override
    public PoolStats stats() {
        lock.lock();
        try {
            return new PoolStats(inUse.size() + idle.size(), idle.size(), inUse.size(), created, disposed, exhausted);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ConnectionPoolConfig config() {
        return config;
    }

    // ========== 종료 ==========

    /**
     * 풀 종료.
     *
     * <p>유휴 연결은 즉시 닫고, 대여 중인 연결은 반납 시점에 닫습니다.
     * 대기 중인 acquire는 {@link IllegalStateException}으로 깨어납니다.</p>
     */
    @Override
    public void close() {
        List<BackendChannel> toClose = new ArrayList<>();
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            PooledChannel candidate;
            while ((candidate = idle.pollFirst()) != null) {
                disposed++;
                toClose.add(candidate.channel());
            }
            available.signalAll();
        } finally {
            lock.unlock();
        }
        closeAll(toClose);

        if (sweeper != null) {
            sweeper.shutdown();
            try {
                if (!sweeper.awaitTermination(SWEEPER_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    sweeper.shutdownNow();
                }
            } catch (InterruptedException e) {
                sweeper.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("BoundedConnectionPool closed: target={}", connector.target());
    }

    // ========== 내부 구현 ==========

    private PooledConnection connectReserved() {
        BackendChannel channel;
        try {
            channel = connector.connect(config.connectTimeout());
        } catch (RuntimeException e) {
            unreserve();
            if (e instanceof BackendConnectException) {
                throw e;
            }
            throw new BackendConnectException(connector.target(), "Failed to open backend channel", e);
        }

        Instant now = clock.instant();
        PooledChannel pooled = new PooledChannel(ids.incrementAndGet(), channel, now);
        boolean closedMeanwhile;
        lock.lock();
        try {
            pending--;
            created++;
            closedMeanwhile = closed;
            if (closedMeanwhile) {
                disposed++;
            } else {
                inUse.add(pooled);
            }
            available.signal();
        } finally {
            lock.unlock();
        }
        if (closedMeanwhile) {
            closeQuietly(channel);
            throw new IllegalStateException("Connection pool is closed");
        }
        log.debug("Opened connection #{} to {}", pooled.id(), connector.target());
        return pooled;
    }

    private void unreserve() {
        lock.lock();
        try {
            pending--;
            available.signal();
        } finally {
            lock.unlock();
        }
    }

    private static PooledChannel checkedOut(PooledConnection connection) {
        if (connection == null) {
            throw new IllegalArgumentException("connection cannot be null");
        }
        if (!(connection instanceof PooledChannel pooled)) {
            throw new IllegalStateException("Connection #" + connection.id() + " is not checked out from this pool");
        }
        return pooled;
    }

    private static boolean isHealthy(PooledChannel pooled) {
        try {
            return pooled.channel().isHealthy();
        } catch (RuntimeException e) {
            log.debug("Health check failed for connection #{}: {}", pooled.id(), e.getMessage());
            return false;
        }
    }

    private static void closeAll(List<BackendChannel> channels) {
        for (BackendChannel channel : channels) {
            closeQuietly(channel);
        }
    }

    private static void closeQuietly(BackendChannel channel) {
        try {
            channel.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close backend channel: {}", e.getMessage());
        }
    }

    /**
     * 풀이 관리하는 연결.
     */
    private static final class PooledChannel implements PooledConnection {

        private final long id;
        private final BackendChannel channel;
        private final Instant createdAt;
        private volatile Instant lastUsedAt;

        private PooledChannel(long id, BackendChannel channel, Instant createdAt) {
            this.id = id;
            this.channel = channel;
            this.createdAt = createdAt;
            this.lastUsedAt = createdAt;
        }

        private void touch(Instant now) {
            this.lastUsedAt = now;
        }

        @Override
        public long id() {
            return id;
        }

        @Override
        public BackendChannel channel() {
            return channel;
        }

        @Override
        public Instant createdAt() {
            return createdAt;
        }

        @Override
        public Instant lastUsedAt() {
            return lastUsedAt;
        }

        @Override
        public String toString() {
            return "PooledChannel{id=" + id + ", lastUsedAt=" + lastUsedAt + '}';
        }
    }
}
