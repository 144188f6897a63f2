/**
 * SPI (Service Provider Interface) 패키지.
 *
 * <p>게이트웨이가 원격 백엔드에 접근하기 위한 확장점을 정의합니다.</p>
 *
 * <h2>SPI 목록</h2>
 * <ul>
 *   <li>{@link com.ryuqq.cryptogateway.core.spi.BackendConnector} - 채널 생성 (gRPC, 인메모리 등)</li>
 *   <li>{@link com.ryuqq.cryptogateway.core.spi.BackendChannel} - 백엔드 RPC 호출</li>
 *   <li>{@link com.ryuqq.cryptogateway.core.spi.ConnectionPool} - 채널 재사용 및 동시 연결 상한</li>
 * </ul>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
package com.ryuqq.cryptogateway.core.spi;
