package com.ryuqq.cryptogateway.core.model;

/**
 * 컨텍스트 획득 플래그.
 *
 * @param value 원시 플래그 비트
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public record AcquireFlags(int value) {

    public static final int VERIFY_CONTEXT = 0xF0000000;
    public static final int NEW_KEYSET = 0x00000008;
    public static final int DELETE_KEYSET = 0x00000010;
    public static final int MACHINE_KEYSET = 0x00000020;
    public static final int SILENT = 0x00000040;

    private static final int KNOWN_MASK = VERIFY_CONTEXT | NEW_KEYSET | DELETE_KEYSET | MACHINE_KEYSET | SILENT;

    public static AcquireFlags none() {
        return new AcquireFlags(0);
    }

    public static AcquireFlags of(int value) {
        return new AcquireFlags(value);
    }

    public boolean has(int flag) {
        return (value & flag) == flag;
    }

    public boolean isVerifyContext() {
        return has(VERIFY_CONTEXT);
    }

    public boolean isNewKeyset() {
        return has(NEW_KEYSET);
    }

    public boolean isDeleteKeyset() {
        return has(DELETE_KEYSET);
    }

    /**
     * 정의되지 않은 비트가 설정되어 있는지 확인.
     *
     * @return 알 수 없는 비트가 있으면 true
     */
    public boolean hasUnknownBits() {
        return (value & ~KNOWN_MASK) != 0;
    }

    @Override
    public String toString() {
        return "AcquireFlags{0x" + Integer.toHexString(value) + '}';
    }
}
