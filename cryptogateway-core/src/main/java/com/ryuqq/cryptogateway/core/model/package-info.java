/**
 * Core domain model package.
 *
 * <p>Objects managed by the handle table and the value types the host passes in.</p>
 *
 * <h2>Managed Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.cryptogateway.core.model.ProviderContext} - Session over a key container</li>
 *   <li>{@link com.ryuqq.cryptogateway.core.model.KeyObject} - Backend key reference and metadata</li>
 *   <li>{@link com.ryuqq.cryptogateway.core.model.HashObject} - Buffered hash input and cached results</li>
 * </ul>
 *
 * <h2>Host Value Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.cryptogateway.core.model.AlgorithmId}, {@link com.ryuqq.cryptogateway.core.model.KeySpec}</li>
 *   <li>{@link com.ryuqq.cryptogateway.core.model.AcquireFlags}, {@link com.ryuqq.cryptogateway.core.model.KeyFlags}</li>
 *   <li>{@link com.ryuqq.cryptogateway.core.model.KeyParam}, {@link com.ryuqq.cryptogateway.core.model.HashParam},
 *       {@link com.ryuqq.cryptogateway.core.model.ProvParam}</li>
 *   <li>{@link com.ryuqq.cryptogateway.core.model.OutputBuffer} - Size-query aware output buffer</li>
 *   <li>{@link com.ryuqq.cryptogateway.core.model.KeyBlob} - PUBLICKEYBLOB codec</li>
 * </ul>
 *
 * @since 1.0.0
 * @author CryptoGateway Team
 */
package com.ryuqq.cryptogateway.core.model;
