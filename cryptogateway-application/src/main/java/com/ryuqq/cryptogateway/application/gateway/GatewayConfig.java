package com.ryuqq.cryptogateway.application.gateway;

import com.ryuqq.cryptogateway.application.invoke.RetryPolicy;

/**
 * Backend Gateway 설정.
 *
 * <p>QueueWorkerConfig와 같은 방식으로 compact constructor에서 검증하고
 * {@code with*} 메서드로 일부만 바꾼 사본을 만듭니다.</p>
 *
 * @param providerName PP_NAME 응답 값
 * @param providerVersion PP_VERSION 응답 값 (상위 바이트 major, 하위 바이트 minor)
 * @param providerType PP_PROVTYPE 응답 값
 * @param implementationType PP_IMPTYPE 응답 값
 * @param defaultContainer 컨테이너 이름 없이 acquireContext 했을 때 사용할 컨테이너
 * @param maxHashInputBytes 해시 객체 하나가 버퍼링할 수 있는 최대 입력 크기 ({@link #MAX_HASH_INPUT_BYTES} 이하)
 * @param retryPolicy 원격 호출 재시도 정책
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public record GatewayConfig(
    String providerName,
    int providerVersion,
    int providerType,
    int implementationType,
    String defaultContainer,
    long maxHashInputBytes,
    RetryPolicy retryPolicy
) {

    public static final String DEFAULT_PROVIDER_NAME = "CryptoGateway Remote Provider";
    public static final int DEFAULT_PROVIDER_VERSION = 0x0100;
    public static final int PROV_RSA_FULL = 1;
    public static final int IMPL_TYPE_HARDWARE = 1;
    public static final String DEFAULT_CONTAINER = "default";
    public static final long DEFAULT_MAX_HASH_INPUT_BYTES = 64L * 1024 * 1024;
    /** 해시 입력은 바이트 배열 하나에 버퍼링되므로 JVM 배열 크기 한계를 넘을 수 없습니다. */
    public static final long MAX_HASH_INPUT_BYTES = Integer.MAX_VALUE - 8;

    public GatewayConfig {
        if (providerName == null || providerName.isBlank()) {
            throw new IllegalArgumentException("providerName cannot be null or blank");
        }
        if (providerVersion < 0) {
            throw new IllegalArgumentException("providerVersion must be non-negative (current: " + providerVersion + ")");
        }
        if (providerType <= 0) {
            throw new IllegalArgumentException("providerType must be positive (current: " + providerType + ")");
        }
        if (implementationType <= 0) {
            throw new IllegalArgumentException(
                "implementationType must be positive (current: " + implementationType + ")");
        }
        if (defaultContainer == null || defaultContainer.isBlank() || defaultContainer.contains("/")) {
            throw new IllegalArgumentException("defaultContainer must be a non-blank name without '/'");
        }
        if (maxHashInputBytes <= 0) {
            throw new IllegalArgumentException(
                "maxHashInputBytes must be positive (current: " + maxHashInputBytes + ")");
        }
        if (maxHashInputBytes > MAX_HASH_INPUT_BYTES) {
            throw new IllegalArgumentException(
                "maxHashInputBytes must be <= " + MAX_HASH_INPUT_BYTES + " (current: " + maxHashInputBytes + ")");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
    }

    /**
     * 기본 설정.
     */
    public GatewayConfig() {
        this(DEFAULT_PROVIDER_NAME, DEFAULT_PROVIDER_VERSION, PROV_RSA_FULL, IMPL_TYPE_HARDWARE,
            DEFAULT_CONTAINER, DEFAULT_MAX_HASH_INPUT_BYTES, RetryPolicy.none());
    }

    public GatewayConfig withProviderName(String providerName) {
        return new GatewayConfig(providerName, providerVersion, providerType, implementationType,
            defaultContainer, maxHashInputBytes, retryPolicy);
    }

    public GatewayConfig withDefaultContainer(String defaultContainer) {
        return new GatewayConfig(providerName, providerVersion, providerType, implementationType,
            defaultContainer, maxHashInputBytes, retryPolicy);
    }

    public GatewayConfig withMaxHashInputBytes(long maxHashInputBytes) {
        return new GatewayConfig(providerName, providerVersion, providerType, implementationType,
            defaultContainer, maxHashInputBytes, retryPolicy);
    }

    public GatewayConfig withRetryPolicy(RetryPolicy retryPolicy) {
        return new GatewayConfig(providerName, providerVersion, providerType, implementationType,
            defaultContainer, maxHashInputBytes, retryPolicy);
    }
}
