/**
 * Resilience adapters: bounded backend connection pool and counting circuit breaker.
 *
 * <p>Both implementations are thread-safe and take a {@link java.time.Clock} so that idle expiry
 * and breaker timeouts can be driven deterministically in tests.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
package com.ryuqq.cryptogateway.adapter.resilience;
