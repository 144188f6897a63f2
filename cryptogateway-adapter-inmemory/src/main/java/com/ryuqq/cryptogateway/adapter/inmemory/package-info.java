/**
 * In-memory reference backend.
 *
 * <p>{@link com.ryuqq.cryptogateway.adapter.inmemory.InMemoryCryptoBackend} holds keys in process and
 * performs the crypto with the JDK providers. It is used by unit and contract tests and for local
 * development without a running backend service.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
package com.ryuqq.cryptogateway.adapter.inmemory;
