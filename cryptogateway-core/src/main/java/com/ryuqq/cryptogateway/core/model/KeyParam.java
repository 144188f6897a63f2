package com.ryuqq.cryptogateway.core.model;

import java.util.Optional;

/**
 * 키 파라미터 (KP_*).
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public enum KeyParam {

    PERMISSIONS(6),
    ALGID(7),
    KEYLEN(9);

    private final int code;

    KeyParam(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<KeyParam> fromCode(int code) {
        for (KeyParam param : values()) {
            if (param.code == code) {
                return Optional.of(param);
            }
        }
        return Optional.empty();
    }
}
