package com.ryuqq.cryptogateway.core.error;

/**
 * 동일 핸들에 대한 동시 작업 감지.
 *
 * <p>키/해시 핸들은 한 번에 하나의 작업만 사용할 수 있습니다. 두 번째 호출자는
 * 기다리지 않고 즉시 이 예외로 실패합니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public class HandleBusyException extends GatewayException {

    private final long handle;

    public HandleBusyException(long handle) {
        super(ErrorKind.HANDLE_BUSY, HostStatus.BUSY,
            "Handle 0x" + Long.toHexString(handle) + " is in use by another operation", null, null);
        this.handle = handle;
    }

    public long handle() {
        return handle;
    }
}
