package com.ryuqq.cryptogateway.core.error;

/**
 * 백엔드 도메인 오류 코드.
 *
 * <p>원격 호출은 성공(전송 OK)했지만 백엔드가 요청을 거부한 경우의 사유입니다.
 * 값은 백엔드 프로토콜의 {@code ErrorCode} enum과 1:1로 대응합니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public enum BackendErrorCode {

    UNSPECIFIED(0),
    INVALID_REQUEST(1),
    KEY_NOT_FOUND(2),
    KEY_ALREADY_EXISTS(3),
    UNSUPPORTED_ALGORITHM(4),
    INVALID_KEY_SIZE(5),
    INVALID_SIGNATURE(6),
    INVALID_DATA(7),
    CRYPTO_OPERATION_FAILED(8),
    AUTHENTICATION_FAILED(9),
    AUTHORIZATION_FAILED(10),
    QUOTA_EXCEEDED(11),
    SERVICE_UNAVAILABLE(12),
    INTERNAL_ERROR(13);

    private final int value;

    BackendErrorCode(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    /**
     * 프로토콜 값으로 조회.
     *
     * @param value 프로토콜 값
     * @return 대응하는 코드, 알 수 없으면 {@link #UNSPECIFIED}
     */
    public static BackendErrorCode fromValue(int value) {
        for (BackendErrorCode code : values()) {
            if (code.value == value) {
                return code;
            }
        }
        return UNSPECIFIED;
    }
}
