package com.ryuqq.cryptogateway.core.handle;

import com.ryuqq.cryptogateway.core.model.ManagedObject;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 핸들 독점 사용권.
 *
 * <p>{@link HandleTable#lease}로 얻고 try-with-resources로 반납합니다.</p>
 *
 * <pre>{@code
 * try (HandleLease<HashObject> lease = table.lease(hHash, HandleKind.HASH, HashObject.class)) {
 *     lease.payload().append(data, limit);
 * }
 * }</pre>
 *
 * @param <T> 객체 타입
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public final class HandleLease<T extends ManagedObject> implements AutoCloseable {

    private final HandleTable table;
    private final long handle;
    private final T payload;
    private final AtomicBoolean flag;
    private boolean closed;

    HandleLease(HandleTable table, long handle, T payload, AtomicBoolean flag) {
        this.table = table;
        this.handle = handle;
        this.payload = payload;
        this.flag = flag;
    }

    public long handle() {
        return handle;
    }

    public T payload() {
        return payload;
    }

    /**
     * 리스 중인 핸들을 폐기.
     *
     * <p>리스는 계속 열린 상태로 남으며 close는 그대로 호출해도 됩니다.</p>
     *
     * @throws com.ryuqq.cryptogateway.core.error.InvalidHandleException 이미 cascade로 폐기된 경우
     */
    public void retire() {
        table.retireLeased(handle, flag);
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            flag.set(false);
        }
    }
}
