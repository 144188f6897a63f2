/**
 * gRPC transport to the remote crypto backend.
 *
 * <p>Service and message classes are generated from {@code src/main/proto/crypto_backend.proto}
 * into {@code com.ryuqq.cryptogateway.adapter.grpc.proto}.</p>
 *
 * <pre>
 * BackendConnector connector = new GrpcBackendConnector(
 *     new GrpcEndpointConfig().withTarget("backend.internal:50051").withCaCert(Path.of("ca.pem")));
 * ConnectionPool pool = new BoundedConnectionPool(connector, new ConnectionPoolConfig());
 * </pre>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
package com.ryuqq.cryptogateway.adapter.grpc;
