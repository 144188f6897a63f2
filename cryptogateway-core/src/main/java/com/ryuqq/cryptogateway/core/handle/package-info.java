/**
 * Opaque handle table.
 *
 * <p>Maps host-visible integer handles to providers, keys and hashes, tracks provider ownership and
 * grants per-handle exclusive leases.</p>
 *
 * @since 1.0.0
 * @author CryptoGateway Team
 */
package com.ryuqq.cryptogateway.core.handle;
