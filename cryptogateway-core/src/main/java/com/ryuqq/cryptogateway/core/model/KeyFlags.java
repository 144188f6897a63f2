package com.ryuqq.cryptogateway.core.model;

/**
 * 키 생성/가져오기 플래그 해석.
 *
 * <p>하위 16비트는 옵션 비트, 상위 16비트는 키 비트 수입니다 (0이면 알고리즘 기본값).</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public final class KeyFlags {

    public static final int EXPORTABLE = 0x00000001;
    public static final int USER_PROTECTED = 0x00000002;

    private static final int KNOWN_OPTION_MASK = EXPORTABLE | USER_PROTECTED;

    private KeyFlags() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static int keySize(int flags) {
        return flags >>> 16;
    }

    public static boolean isExportable(int flags) {
        return (flags & EXPORTABLE) != 0;
    }

    public static boolean hasUnknownOptions(int flags) {
        return (flags & 0xFFFF & ~KNOWN_OPTION_MASK) != 0;
    }
}
