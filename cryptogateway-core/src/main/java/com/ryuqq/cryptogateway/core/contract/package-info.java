/**
 * 백엔드 호출 계약 패키지.
 *
 * <p>{@link com.ryuqq.cryptogateway.core.spi.BackendChannel}이 주고받는 요청/응답 값 타입입니다.
 * 전송 방식(gRPC, 인메모리)과 무관하며, 어댑터가 각자의 wire 형식으로 변환합니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
package com.ryuqq.cryptogateway.core.contract;
