package com.ryuqq.cryptogateway.core.error;

/**
 * 알 수 없거나, 폐기되었거나, 종류가 맞지 않거나, 소유 관계가 맞지 않는 핸들.
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public class InvalidHandleException extends GatewayException {

    private final long handle;

    public InvalidHandleException(long handle, String reason) {
        super(ErrorKind.INVALID_HANDLE, HostStatus.INVALID_HANDLE,
            "Invalid handle 0x" + Long.toHexString(handle) + ": " + reason, null, null);
        this.handle = handle;
    }

    public long handle() {
        return handle;
    }
}
