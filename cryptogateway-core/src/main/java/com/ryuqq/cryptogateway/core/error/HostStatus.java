package com.ryuqq.cryptogateway.core.error;

/**
 * 호스트 상태 코드.
 *
 * <p>호스트 인터페이스(CSP 스타일 API)가 "last error"로 읽어가는 고정 어휘입니다.
 * 숫자 값은 호스트가 기대하는 Windows 오류 코드(ERROR_*, NTE_*)와 동일합니다.</p>
 *
 * <p><strong>주의:</strong> NTE_* 코드는 상위 비트가 설정된 HRESULT 형태이므로
 * {@code int}로 보관하면 음수가 됩니다. 부호 없는 값이 필요하면 {@link #unsignedCode()}를 사용합니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public enum HostStatus {

    SUCCESS(0, "The operation completed successfully"),
    INVALID_HANDLE(6, "The handle is invalid"),
    INVALID_PARAMETER(87, "The parameter is incorrect"),
    BUSY(170, "The requested resource is in use"),
    MORE_DATA(234, "More data is available"),
    TIMEOUT(1460, "This operation returned because the timeout period expired"),
    BAD_HASH(0x80090002, "Bad hash"),
    BAD_KEY(0x80090003, "Bad key"),
    BAD_LEN(0x80090004, "Bad length"),
    BAD_DATA(0x80090005, "Bad data"),
    BAD_SIGNATURE(0x80090006, "Invalid signature"),
    BAD_ALGID(0x80090008, "Invalid algorithm specified"),
    BAD_FLAGS(0x80090009, "Invalid flags specified"),
    BAD_TYPE(0x8009000A, "Invalid type specified"),
    BAD_KEY_STATE(0x8009000B, "Key not valid for use in specified state"),
    BAD_HASH_STATE(0x8009000C, "Hash not valid for use in specified state"),
    NO_KEY(0x8009000D, "Key does not exist"),
    NO_MEMORY(0x8009000E, "Insufficient memory available for the operation"),
    EXISTS(0x8009000F, "Object already exists"),
    PERM(0x80090010, "Access denied"),
    NOT_FOUND(0x80090011, "Object was not found"),
    BAD_KEYSET(0x80090016, "Keyset does not exist"),
    PROVIDER_DLL_FAIL(0x8009001D, "Provider DLL failed to initialize correctly"),
    FAIL(0x80090020, "An internal error occurred"),
    NOT_SUPPORTED(0x80090029, "The requested operation is not supported"),
    DEVICE_NOT_READY(0x80090030, "The device that is required by this cryptographic provider is not ready for use");

    private final int code;
    private final String description;

    HostStatus(int code, String description) {
        this.code = code;
        this.description = description;
    }

    /**
     * 호스트에 전달되는 원시 코드.
     *
     * @return 32비트 코드 (NTE_* 는 음수)
     */
    public int code() {
        return code;
    }

    /**
     * 부호 없는 32비트 코드.
     *
     * @return 0 ~ 0xFFFFFFFF 범위의 코드
     */
    public long unsignedCode() {
        return Integer.toUnsignedLong(code);
    }

    /**
     * 사람이 읽을 수 있는 설명.
     *
     * @return 설명 문자열 (non-blank)
     */
    public String describe() {
        return description;
    }

    /**
     * 성공 코드인지 확인.
     *
     * @return SUCCESS인 경우 true
     */
    public boolean isSuccess() {
        return this == SUCCESS;
    }

    /**
     * 원시 코드로 조회.
     *
     * <p>알 수 없는 코드는 {@link #FAIL}로 취급합니다.</p>
     *
     * @param code 원시 코드
     * @return 대응하는 HostStatus (없으면 FAIL)
     */
    public static HostStatus fromCode(int code) {
        for (HostStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        return FAIL;
    }

    @Override
    public String toString() {
        return name() + "(0x" + Long.toHexString(unsignedCode()).toUpperCase() + ")";
    }
}
