package com.ryuqq.cryptogateway.core.spi;

import com.ryuqq.cryptogateway.core.error.BackendConnectException;

import java.time.Duration;

/**
 * 백엔드 채널 생성기.
 *
 * <p>커넥션 풀이 새 연결이 필요할 때 호출합니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public interface BackendConnector {

    /**
     * 새 채널 생성.
     *
     * @param connectTimeout 연결 대기 시간 상한
     * @return 사용 가능한 채널
     * @throws BackendConnectException 연결할 수 없는 경우
     */
    BackendChannel connect(Duration connectTimeout);

    /**
     * 연결 대상 설명 (로그용).
     *
     * @return 예: "localhost:50051"
     */
    String target();
}
