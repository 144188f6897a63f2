/**
 * Backend Gateway 패키지.
 *
 * <p>호스트 동사를 구현하는 {@link com.ryuqq.cryptogateway.application.gateway.BackendGateway}와
 * 호출별 마지막 오류를 담는 {@link com.ryuqq.cryptogateway.application.gateway.CallContext}를 제공합니다.</p>
 *
 * <p><strong>구성 예시:</strong></p>
 * <pre>
 * ConnectionPool pool = new BoundedConnectionPool(connector, new ConnectionPoolConfig());
 * CircuitBreaker breaker = new CountingCircuitBreaker(new CircuitBreakerConfig());
 * BackendGateway gateway = new CryptoBackendGateway(pool, breaker, new GatewayConfig());
 * </pre>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
package com.ryuqq.cryptogateway.application.gateway;
