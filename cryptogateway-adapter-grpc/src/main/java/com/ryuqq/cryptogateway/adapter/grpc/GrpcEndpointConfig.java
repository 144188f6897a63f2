package com.ryuqq.cryptogateway.adapter.grpc;

import java.nio.file.Path;

/**
 * gRPC 백엔드 엔드포인트 설정.
 *
 * <p>tls=true이고 인증서 경로가 모두 null이면 JVM 기본 신뢰 저장소로 서버만 검증합니다.
 * clientCertPath와 clientKeyPath를 함께 주면 mTLS로 동작합니다.</p>
 *
 * @param target gRPC 대상 (예: "backend.internal:50051")
 * @param tls TLS 사용 여부
 * @param clientCertPath 클라이언트 인증서 PEM (mTLS, 선택)
 * @param clientKeyPath 클라이언트 개인키 PEM (mTLS, 선택)
 * @param caCertPath 서버 검증용 CA 인증서 PEM (선택)
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public record GrpcEndpointConfig(
    String target,
    boolean tls,
    Path clientCertPath,
    Path clientKeyPath,
    Path caCertPath
) {

    public static final String DEFAULT_TARGET = "localhost:50051";

    /**
     * 기본 설정: localhost:50051, TLS 사용, 시스템 신뢰 저장소.
     */
    public GrpcEndpointConfig() {
        this(DEFAULT_TARGET, true, null, null, null);
    }

    public GrpcEndpointConfig {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target cannot be null or blank");
        }
        if ((clientCertPath == null) != (clientKeyPath == null)) {
            throw new IllegalArgumentException("clientCertPath and clientKeyPath must be set together");
        }
        if (!tls && (clientCertPath != null || caCertPath != null)) {
            throw new IllegalArgumentException("certificate paths require tls=true");
        }
    }

    /**
     * 평문 연결 설정. 로컬 개발용.
     */
    public static GrpcEndpointConfig plaintext(String target) {
        return new GrpcEndpointConfig(target, false, null, null, null);
    }

    public boolean isMutualTls() {
        return tls && clientCertPath != null;
    }

    public GrpcEndpointConfig withTarget(String target) {
        return new GrpcEndpointConfig(target, tls, clientCertPath, clientKeyPath, caCertPath);
    }

    public GrpcEndpointConfig withCaCert(Path caCertPath) {
        return new GrpcEndpointConfig(target, tls, clientCertPath, clientKeyPath, caCertPath);
    }

    public GrpcEndpointConfig withClientCertificate(Path clientCertPath, Path clientKeyPath) {
        return new GrpcEndpointConfig(target, tls, clientCertPath, clientKeyPath, caCertPath);
    }
}
