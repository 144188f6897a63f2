/**
 * 오류 체계 패키지.
 *
 * <p>세 가지 오류 어휘와 그 사이의 변환을 정의합니다.</p>
 * <ul>
 *   <li>{@link com.ryuqq.cryptogateway.core.error.HostStatus} - 호스트 last error 코드</li>
 *   <li>{@link com.ryuqq.cryptogateway.core.error.TransportStatus} - RPC 상태 코드</li>
 *   <li>{@link com.ryuqq.cryptogateway.core.error.BackendErrorCode} - 백엔드 도메인 오류</li>
 * </ul>
 *
 * <p>게이트웨이 내부 실패는 {@link com.ryuqq.cryptogateway.core.error.GatewayException} 하위 예외로 전파되고,
 * 경계에서 {@link com.ryuqq.cryptogateway.core.error.ErrorContext}로 변환됩니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
package com.ryuqq.cryptogateway.core.error;
