/**
 * Protection SPI 패키지.
 *
 * <p>원격 백엔드 호출을 보호하는 Circuit Breaker 확장점을 정의합니다.
 * 게이트웨이는 모든 원격 호출을 다음 순서로 보호합니다:</p>
 * <pre>
 * 1. CircuitBreaker  → OPEN 상태 시 즉시 실패 (네트워크 호출 없음)
 * 2. ConnectionPool  → 연결 획득 (connectTimeout 내)
 * 3. 원격 호출       → requestTimeout 내
 * </pre>
 *
 * <h2>NoOp 구현</h2>
 *
 * <p>{@code noop} 하위 패키지의 {@link com.ryuqq.cryptogateway.core.protection.noop.NoOpCircuitBreaker}는
 * 모든 요청을 허용하고 아무 것도 기록하지 않습니다. 보호 없이 게이트웨이를 조립할 때 사용합니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 * @see com.ryuqq.cryptogateway.core.protection.CircuitBreaker
 */
package com.ryuqq.cryptogateway.core.protection;
