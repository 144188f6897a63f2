/**
 * Gateway operation outcome package.
 *
 * <p>This package defines the sealed result type returned by every host verb.</p>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.cryptogateway.core.outcome.Ok} - Success carrying the verb's value</li>
 *   <li>{@link com.ryuqq.cryptogateway.core.outcome.Fail} - Failure carrying an
 *       {@link com.ryuqq.cryptogateway.core.error.ErrorContext}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author CryptoGateway Team
 */
package com.ryuqq.cryptogateway.core.outcome;
