/**
 * 원격 호출 실행 패키지.
 *
 * <p>{@link com.ryuqq.cryptogateway.application.invoke.RemoteInvoker}가 서킷 브레이커, 커넥션 풀,
 * 요청 타임아웃, 재시도를 하나의 호출 경로로 묶습니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
package com.ryuqq.cryptogateway.application.invoke;
