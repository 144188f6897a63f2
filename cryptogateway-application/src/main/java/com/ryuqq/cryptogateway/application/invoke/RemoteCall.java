package com.ryuqq.cryptogateway.application.invoke;

import com.ryuqq.cryptogateway.core.spi.BackendChannel;

/**
 * 풀에서 빌린 채널 위에서 실행되는 원격 호출 하나.
 *
 * @param <T> 결과 타입
 * @author CryptoGateway Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RemoteCall<T> {

    T call(BackendChannel channel);
}
