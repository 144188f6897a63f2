package com.ryuqq.cryptogateway.core.model;

/**
 * 핸들이 가리키는 객체의 종류.
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public enum HandleKind {

    /** 프로바이더 컨텍스트. 키/해시의 부모. */
    PROVIDER,

    /** 키 객체. */
    KEY,

    /** 해시 객체. */
    HASH
}
