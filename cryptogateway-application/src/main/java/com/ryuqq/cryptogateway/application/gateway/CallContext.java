package com.ryuqq.cryptogateway.application.gateway;

import com.ryuqq.cryptogateway.core.error.ErrorContext;
import com.ryuqq.cryptogateway.core.error.HostStatus;

import java.util.Optional;

/**
 * 호스트 호출 단위의 마지막 오류 보관소.
 *
 * <p>호스트 API는 boolean만 반환하고 오류 코드는 별도로 조회하므로,
 * 게이트웨이는 실패할 때마다 이 컨텍스트에 {@link ErrorContext}를 기록합니다.
 * 모든 게이트웨이 호출은 시작 시 컨텍스트를 비우며, 마지막 기록이 우선합니다.</p>
 *
 * <p>호스트 어댑터는 {@link #current()}로 스레드별 인스턴스를 사용할 수 있습니다.
 * 하나의 인스턴스를 여러 스레드가 공유하는 것은 지원하지 않습니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public final class CallContext {

    private static final ThreadLocal<CallContext> CURRENT = ThreadLocal.withInitial(CallContext::new);

    private ErrorContext lastError;

    private CallContext() {
    }

    public static CallContext create() {
        return new CallContext();
    }

    /**
     * 현재 스레드의 컨텍스트.
     *
     * @return 스레드별 CallContext
     */
    public static CallContext current() {
        return CURRENT.get();
    }

    public Optional<ErrorContext> lastError() {
        return Optional.ofNullable(lastError);
    }

    /**
     * 호스트의 GetLastError에 해당하는 값.
     *
     * @return 마지막 오류의 상태 코드, 없으면 SUCCESS
     */
    public HostStatus lastHostStatus() {
        return lastError == null ? HostStatus.SUCCESS : lastError.hostStatus();
    }

    public void clear() {
        this.lastError = null;
    }

    void record(ErrorContext error) {
        this.lastError = error;
    }

    @Override
    public String toString() {
        return "CallContext{lastError=" + (lastError == null ? "none" : lastError.describe()) + '}';
    }
}
