package com.ryuqq.cryptogateway.application.invoke;

import com.ryuqq.cryptogateway.core.error.BackendConnectException;
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
import com.ryuqq.cryptogateway.core.spi.ConnectionPool;
import com.ryuqq.cryptogateway.core.spi.PooledConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 보호된 원격 호출 실행기.
 *
 * <p>모든 백엔드 호출은 이 클래스를 거칩니다.</p>
 *
 * <p><strong>실행 순서:</strong></p>
 * <ol>
 *   <li>Circuit Breaker 확인 → 차단 시 CIRCUIT_OPEN (네트워크 시도 없음, 카운터 변화 없음)</li>
 *   <li>풀에서 연결 획득 → 고갈 시 POOL_EXHAUSTED (허가 반환), 연결 실패 시 CONNECT_ERROR (브레이커 실패)</li>
 *   <li>호출 실행 스레드에서 원격 호출, requestTimeout까지 대기</li>
 *   <li>결과 분류:
 *     <ul>
 *       <li>성공 / 백엔드 거부 → 브레이커 성공, 연결 반납</li>
 *       <li>전송 실패 → 브레이커 실패, 채널이 비정상이면 연결 폐기</li>
 *       <li>타임아웃 → 호출 취소, 연결 폐기, 브레이커 실패, DEADLINE_EXCEEDED</li>
 *     </ul>
 *   </li>
 *   <li>{@link RetryPolicy}가 허용하면 백오프 후 1단계부터 재시도</li>
 * </ol>
 *
 * <p><strong>Thread Safety:</strong> 여러 호스트 스레드가 동시에 {@link #invoke}를 호출할 수 있습니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public final class RemoteInvoker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RemoteInvoker.class);

    private final ConnectionPool pool;
    private final CircuitBreaker circuitBreaker;
    private final RetryPolicy retryPolicy;
    private final ExecutorService callExecutor;
    private final Duration requestTimeout;

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong successfulRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();
    private final AtomicLong circuitBreakerRejects = new AtomicLong();

    /**
     * 생성자 (기본 호출 실행 스레드 풀).
     *
     * @param pool 커넥션 풀
     * @param circuitBreaker 서킷 브레이커
     * @param retryPolicy 재시도 정책
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public RemoteInvoker(ConnectionPool pool, CircuitBreaker circuitBreaker, RetryPolicy retryPolicy) {
        this(pool, circuitBreaker, retryPolicy, Executors.newCachedThreadPool(new CallThreadFactory()));
    }

    /**
     * 생성자 (호출 실행 스레드 풀 지정).
     *
     * @param pool 커넥션 풀
     * @param circuitBreaker 서킷 브레이커
     * @param retryPolicy 재시도 정책
     * @param callExecutor 원격 호출을 실행할 스레드 풀 (close 시 종료됨)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public RemoteInvoker(ConnectionPool pool, CircuitBreaker circuitBreaker, RetryPolicy retryPolicy,
                         ExecutorService callExecutor) {
        if (pool == null) {
            throw new IllegalArgumentException("pool cannot be null");
        }
        if (circuitBreaker == null) {
            throw new IllegalArgumentException("circuitBreaker cannot be null");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (callExecutor == null) {
            throw new IllegalArgumentException("callExecutor cannot be null");
        }
        this.pool = pool;
        this.circuitBreaker = circuitBreaker;
        this.retryPolicy = retryPolicy;
        this.callExecutor = callExecutor;
        this.requestTimeout = pool.config().requestTimeout();
    }

    /**
     * 원격 호출 실행.
     *
     * @param operation 동작 이름 (로그 및 CallId 접두사)
     * @param call 원격 호출
     * @param <T> 결과 타입
     * @return 호출 결과
     * @throws GatewayException 호출이 실패한 경우 (재시도 후 마지막 실패)
     */
    public <T> T invoke(String operation, RemoteCall<T> call) {
        int attempt = 1;
        while (true) {
            try {
                return invokeOnce(operation, call);
            } catch (GatewayException e) {
                if (!retryPolicy.shouldRetry(e, attempt)) {
                    throw e;
                }
                long delayMs = retryPolicy.backoff().calculate(attempt);
                log.warn("{} attempt {} failed with {}; retrying in {}ms", operation, attempt, e.kind(), delayMs);
                sleep(delayMs);
                attempt++;
            }
        }
    }

    private <T> T invokeOnce(String operation, RemoteCall<T> call) {
        CallId callId = CallId.next(operation);
        totalRequests.incrementAndGet();

        // 1. Circuit Breaker
        if (!circuitBreaker.tryAcquire(callId)) {
            circuitBreakerRejects.incrementAndGet();
            failedRequests.incrementAndGet();
            CircuitBreakerState state = circuitBreaker.getState();
            throw new CircuitOpenException("Circuit breaker is " + state + " (" + state.rejectionReason()
                + "); " + operation + " was not sent to the backend");
        }

        // 2. Connection
        PooledConnection connection;
        try {
            connection = pool.acquire();
        } catch (BackendConnectException e) {
            circuitBreaker.recordFailure(callId, e);
            failedRequests.incrementAndGet();
            log.warn("{} could not connect: {}", callId.getValue(), e.getMessage());
            throw e;
        } catch (PoolExhaustedException e) {
            circuitBreaker.releasePermit(callId);
            failedRequests.incrementAndGet();
            throw e;
        } catch (RuntimeException e) {
            circuitBreaker.releasePermit(callId);
            failedRequests.incrementAndGet();
            throw e;
        }

        // 3. Remote call bounded by requestTimeout
        Future<T> future;
        try {
            future = callExecutor.submit(() -> call.call(connection.channel()));
        } catch (RejectedExecutionException e) {
            pool.release(connection);
            circuitBreaker.releasePermit(callId);
            failedRequests.incrementAndGet();
            throw new GatewayException(ErrorKind.INTERNAL_ERROR, HostStatus.FAIL,
                "Gateway is shut down", null, e);
        }

        try {
            T result = future.get(requestTimeout.toNanos(), TimeUnit.NANOSECONDS);
            circuitBreaker.recordSuccess(callId);
            pool.release(connection);
            successfulRequests.incrementAndGet();
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            pool.invalidate(connection);
            TransportException timeout = new TransportException(TransportStatus.DEADLINE_EXCEEDED,
                operation + " exceeded requestTimeout of " + requestTimeout.toMillis() + "ms", e);
            circuitBreaker.recordFailure(callId, timeout);
            failedRequests.incrementAndGet();
            log.warn("{} timed out after {}ms; connection {} invalidated",
                callId.getValue(), requestTimeout.toMillis(), connection.id());
            throw timeout;
        } catch (ExecutionException e) {
            failedRequests.incrementAndGet();
            throw classifyFailure(callId, connection, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            pool.invalidate(connection);
            circuitBreaker.releasePermit(callId);
            failedRequests.incrementAndGet();
            throw new GatewayException(ErrorKind.INTERNAL_ERROR, HostStatus.FAIL,
                operation + " was interrupted", null, e);
        }
    }

    /**
     * 원격 호출 실패 분류.
     *
     * <p>백엔드가 도메인 오류로 응답한 경우는 전송이 정상이므로 브레이커에 성공으로 기록합니다.</p>
     */
    private GatewayException classifyFailure(CallId callId, PooledConnection connection, Throwable cause) {
        if (cause instanceof BackendRejectedException rejected) {
            circuitBreaker.recordSuccess(callId);
            pool.release(connection);
            log.debug("{} rejected by backend: {}", callId.getValue(), rejected.reason());
            return rejected;
        }
        if (cause instanceof TransportException transport) {
            circuitBreaker.recordFailure(callId, transport);
            if (isHealthy(connection)) {
                pool.release(connection);
            } else {
                pool.invalidate(connection);
            }
            log.warn("{} transport failure {}: {}", callId.getValue(), transport.status(), transport.getMessage());
            return transport;
        }
        circuitBreaker.recordFailure(callId, cause);
        pool.invalidate(connection);
        if (cause instanceof GatewayException gatewayException) {
            return gatewayException;
        }
        log.error("{} failed unexpectedly", callId.getValue(), cause);
        return new GatewayException(ErrorKind.INTERNAL_ERROR, HostStatus.FAIL,
            "Unexpected backend call failure: " + cause, null, cause);
    }

    private static boolean isHealthy(PooledConnection connection) {
        try {
            return connection.channel().isHealthy();
        } catch (RuntimeException e) {
            log.debug("Health check failed for connection {}: {}", connection.id(), e.getMessage());
            return false;
        }
    }

    public ConnectionPool pool() {
        return pool;
    }

    public CircuitBreaker circuitBreaker() {
        return circuitBreaker;
    }

    public long totalRequests() {
        return totalRequests.get();
    }

    public long successfulRequests() {
        return successfulRequests.get();
    }

    public long failedRequests() {
        return failedRequests.get();
    }

    public long circuitBreakerRejects() {
        return circuitBreakerRejects.get();
    }

    /**
     * 호출 실행 스레드 풀을 종료합니다. 풀은 닫지 않습니다.
     */
    @Override
    public void close() {
        callExecutor.shutdownNow();
    }

    /**
     * 재시도 대기.
     *
     * <p>InterruptedException 발생 시 현재 스레드의 인터럽트 플래그를 복원하고
     * GatewayException으로 래핑하여 던집니다.</p>
     */
    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException(ErrorKind.INTERNAL_ERROR, HostStatus.FAIL, "Retry backoff interrupted", null, e);
        }
    }

    private static final class CallThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "cryptogateway-call-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
