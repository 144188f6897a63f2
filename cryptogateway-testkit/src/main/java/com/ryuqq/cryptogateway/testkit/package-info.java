/**
 * Testkit for the gateway: fault injection, a manual clock, and the contract test base class.
 *
 * <p>{@link com.ryuqq.cryptogateway.testkit.contract.AbstractGatewayContractTest} wires the real pool,
 * breaker and gateway over the in-memory backend so that end-to-end scenarios run without a network.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
package com.ryuqq.cryptogateway.testkit;
