package com.ryuqq.cryptogateway.core.error;

/**
 * 호출자가 제공한 출력 버퍼가 결과를 담기에 작음.
 *
 * <p>호스트는 {@link #required()} 값으로 버퍼를 다시 할당해 재호출합니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public class InsufficientBufferException extends GatewayException {

    private final int required;
    private final int capacity;

    public InsufficientBufferException(int required, int capacity) {
        super(ErrorKind.INSUFFICIENT_BUFFER, HostStatus.MORE_DATA,
            "Output buffer too small: required " + required + " bytes, capacity " + capacity,
            "required=" + required, null);
        this.required = required;
        this.capacity = capacity;
    }

    public int required() {
        return required;
    }

    public int capacity() {
        return capacity;
    }
}
