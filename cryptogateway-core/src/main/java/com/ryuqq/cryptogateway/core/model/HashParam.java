package com.ryuqq.cryptogateway.core.model;

import java.util.Optional;

/**
 * 해시 파라미터 (HP_*).
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public enum HashParam {

    ALGID(1),
    HASHVAL(2),
    HASHSIZE(4);

    private final int code;

    HashParam(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<HashParam> fromCode(int code) {
        for (HashParam param : values()) {
            if (param.code == code) {
                return Optional.of(param);
            }
        }
        return Optional.empty();
    }
}
