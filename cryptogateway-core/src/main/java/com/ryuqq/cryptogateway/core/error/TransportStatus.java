package com.ryuqq.cryptogateway.core.error;

/**
 * 전송 계층(RPC) 상태.
 *
 * <p>원격 호출 자체의 성공/실패를 나타내며, 값 체계는 gRPC 상태 코드와 동일합니다.
 * 백엔드가 애플리케이션 수준에서 보고한 오류는 {@link BackendErrorCode}로 구분합니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public enum TransportStatus {

    OK(0),
    CANCELLED(1),
    UNKNOWN(2),
    INVALID_ARGUMENT(3),
    DEADLINE_EXCEEDED(4),
    NOT_FOUND(5),
    ALREADY_EXISTS(6),
    PERMISSION_DENIED(7),
    RESOURCE_EXHAUSTED(8),
    FAILED_PRECONDITION(9),
    ABORTED(10),
    OUT_OF_RANGE(11),
    UNIMPLEMENTED(12),
    INTERNAL(13),
    UNAVAILABLE(14),
    DATA_LOSS(15),
    UNAUTHENTICATED(16);

    private final int value;

    TransportStatus(int value) {
        this.value = value;
    }

    /**
     * 숫자 값.
     *
     * @return gRPC 상태 코드 값
     */
    public int value() {
        return value;
    }

    /**
     * 숫자 값으로 조회.
     *
     * @param value gRPC 상태 코드 값
     * @return 대응하는 상태, 범위를 벗어나면 {@link #UNKNOWN}
     */
    public static TransportStatus fromValue(int value) {
        for (TransportStatus status : values()) {
            if (status.value == value) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
