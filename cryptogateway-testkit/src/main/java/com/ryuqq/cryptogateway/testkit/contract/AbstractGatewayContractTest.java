package com.ryuqq.cryptogateway.testkit.contract;

import com.ryuqq.cryptogateway.adapter.inmemory.InMemoryBackendConnector;
import com.ryuqq.cryptogateway.adapter.inmemory.InMemoryCryptoBackend;
import com.ryuqq.cryptogateway.adapter.resilience.BoundedConnectionPool;
import com.ryuqq.cryptogateway.adapter.resilience.CountingCircuitBreaker;
import com.ryuqq.cryptogateway.application.gateway.CallContext;
import com.ryuqq.cryptogateway.application.gateway.CryptoBackendGateway;
import com.ryuqq.cryptogateway.application.gateway.GatewayConfig;
import com.ryuqq.cryptogateway.core.error.ErrorKind;
import com.ryuqq.cryptogateway.core.error.HostStatus;
import com.ryuqq.cryptogateway.core.model.AcquireFlags;
import com.ryuqq.cryptogateway.core.outcome.Fail;
import com.ryuqq.cryptogateway.core.outcome.Ok;
import com.ryuqq.cryptogateway.core.outcome.Outcome;
import com.ryuqq.cryptogateway.core.protection.CircuitBreakerConfig;
import com.ryuqq.cryptogateway.core.spi.ConnectionPoolConfig;
import com.ryuqq.cryptogateway.testkit.fault.FaultInjectingConnector;
import com.ryuqq.cryptogateway.testkit.fault.ManualClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 게이트웨이 계약 테스트의 공통 기반.
 *
 * <p>실제 구성 요소를 조립합니다: {@link InMemoryCryptoBackend} → {@link FaultInjectingConnector} →
 * {@link BoundedConnectionPool} → {@link CountingCircuitBreaker} → {@link CryptoBackendGateway}.
 * 풀과 브레이커는 {@link ManualClock}을 공유하고, 풀의 백그라운드 sweeper는 끕니다.</p>
 *
 * <p>하위 클래스는 {@link #poolConfig()}, {@link #breakerConfig()}, {@link #gatewayConfig()}를
 * 재정의해 시나리오에 맞는 설정을 씁니다.</p>
 *
 * <pre>
 * class MyContractTest extends AbstractGatewayContractTest {
 *     {@literal @}Test
 *     void scenario() {
 *         long hProv = acquireProvider("alice");
 *         assertFailure(gateway.destroyKey(ctx, hProv, 0xDEADL), ErrorKind.INVALID_HANDLE);
 *     }
 * }
 * </pre>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public abstract class AbstractGatewayContractTest {

    protected ManualClock clock;
    protected InMemoryCryptoBackend backend;
    protected FaultInjectingConnector connector;
    protected BoundedConnectionPool pool;
    protected CountingCircuitBreaker circuitBreaker;
    protected CryptoBackendGateway gateway;
    protected CallContext ctx;

    @BeforeEach
    void setUpGateway() {
        clock = new ManualClock();
        backend = new InMemoryCryptoBackend(clock);
        connector = new FaultInjectingConnector(new InMemoryBackendConnector(backend));
        pool = new BoundedConnectionPool(connector, poolConfig(), clock, false);
        circuitBreaker = new CountingCircuitBreaker(breakerConfig(), clock);
        gateway = new CryptoBackendGateway(pool, circuitBreaker, gatewayConfig());
        ctx = CallContext.create();
    }

    @AfterEach
    void tearDownGateway() {
        if (connector != null) {
            connector.heal();
        }
        if (gateway != null) {
            gateway.close();
        }
    }

    // ========== 설정 (재정의 가능) ==========

    protected ConnectionPoolConfig poolConfig() {
        return new ConnectionPoolConfig()
            .withMaxConnections(3)
            .withConnectTimeout(Duration.ofMillis(500))
            .withRequestTimeout(Duration.ofSeconds(5));
    }

    protected CircuitBreakerConfig breakerConfig() {
        return new CircuitBreakerConfig();
    }

    protected GatewayConfig gatewayConfig() {
        return new GatewayConfig();
    }

    // ========== 헬퍼 ==========

    /**
     * 컨테이너를 열고 provider 핸들을 반환합니다.
     */
    protected long acquireProvider(String container) {
        return assertSuccess(gateway.acquireContext(ctx, container, AcquireFlags.none()));
    }

    protected long acquireVerifyContext() {
        return assertSuccess(gateway.acquireContext(ctx, null, AcquireFlags.of(AcquireFlags.VERIFY_CONTEXT)));
    }

    /**
     * 성공을 확인하고 값을 꺼냅니다. CallContext에 오류가 남아 있으면 실패합니다.
     */
    protected <T> T assertSuccess(Outcome<T> outcome) {
        if (outcome instanceof Fail<T> failure) {
            fail("Expected success but got " + failure.error().describe());
        }
        assertTrue(ctx.lastError().isEmpty(), "CallContext should be clear after a successful call");
        return ((Ok<T>) outcome).value();
    }

    /**
     * 실패 종류를 확인합니다. CallContext 마지막 오류도 같은 내용이어야 합니다.
     */
    protected void assertFailure(Outcome<?> outcome, ErrorKind expectedKind) {
        assertTrue(outcome.isFail(), "Expected failure " + expectedKind + " but call succeeded");
        Fail<?> failure = (Fail<?>) outcome;
        assertEquals(expectedKind, failure.error().kind(),
            String.format("Expected %s but was %s", expectedKind, failure.error().describe()));
        assertEquals(failure.error(), ctx.lastError().orElse(null), "CallContext should hold the same error");
    }

    protected void assertFailure(Outcome<?> outcome, ErrorKind expectedKind, HostStatus expectedStatus) {
        assertFailure(outcome, expectedKind);
        assertEquals(expectedStatus, outcome.hostStatus(),
            String.format("Expected host status %s but was %s", expectedStatus, outcome.hostStatus()));
    }

    protected static int keyFlags(int keySizeBits, int options) {
        return (keySizeBits << 16) | options;
    }

    protected void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Sleep interrupted", e);
        }
    }
}
