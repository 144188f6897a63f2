package com.ryuqq.cryptogateway.core.model;

/**
 * 핸들 테이블이 관리하는 객체.
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public sealed interface ManagedObject permits ProviderContext, KeyObject, HashObject {

    /**
     * 객체 종류.
     *
     * @return 핸들 종류
     */
    HandleKind kind();
}
