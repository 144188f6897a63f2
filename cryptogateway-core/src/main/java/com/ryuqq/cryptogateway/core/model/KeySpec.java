package com.ryuqq.cryptogateway.core.model;

import java.util.Optional;

/**
 * 컨테이너 내 키 슬롯 (AT_KEYEXCHANGE / AT_SIGNATURE).
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public enum KeySpec {

    EXCHANGE(1),
    SIGNATURE(2);

    private final int code;

    KeySpec(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<KeySpec> fromCode(int code) {
        for (KeySpec spec : values()) {
            if (spec.code == code) {
                return Optional.of(spec);
            }
        }
        return Optional.empty();
    }
}
