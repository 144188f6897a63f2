package com.ryuqq.cryptogateway.core.model;

import java.util.Optional;

/**
 * 프로바이더 파라미터 (PP_*).
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public enum ProvParam {

    CLIENT_HWND(1),
    IMPTYPE(3),
    NAME(4),
    VERSION(5),
    CONTAINER(6),
    PROVTYPE(16),
    UNIQUE_CONTAINER(36);

    private final int code;

    ProvParam(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<ProvParam> fromCode(int code) {
        for (ProvParam param : values()) {
            if (param.code == code) {
                return Optional.of(param);
            }
        }
        return Optional.empty();
    }
}
