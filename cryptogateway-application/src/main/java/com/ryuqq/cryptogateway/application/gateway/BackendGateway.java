package com.ryuqq.cryptogateway.application.gateway;

import com.ryuqq.cryptogateway.core.model.AcquireFlags;
import com.ryuqq.cryptogateway.core.model.OutputBuffer;
import com.ryuqq.cryptogateway.core.outcome.Outcome;
import com.ryuqq.cryptogateway.core.protection.CircuitBreakerState;

/**
 * 호스트 동사(verb) 단위의 Backend Gateway.
 *
 * <p>CSP 스타일 호스트 API의 각 함수가 이 인터페이스의 메서드 하나에 대응합니다.
 * 모든 메서드는 동기식이며, 결과가 확정되기 전(성공, 실패, 타임아웃)에는 반환하지 않습니다.</p>
 *
 * <p><strong>공통 동작:</strong></p>
 * <ol>
 *   <li>{@link CallContext} 초기화</li>
 *   <li>핸들 검증 (알 수 없거나 폐기된 핸들 → INVALID_HANDLE)</li>
 *   <li>필요한 경우 서킷 브레이커, 커넥션 풀을 거친 원격 호출</li>
 *   <li>오류 번역 후 핸들 테이블 갱신</li>
 *   <li>{@link Outcome} 반환, 실패 시 CallContext에 마지막 오류 기록</li>
 * </ol>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CallContext ctx = CallContext.current();
 * Outcome&lt;Long&gt; prov = gateway.acquireContext(ctx, "orders", AcquireFlags.none());
 * if (prov.isFail()) {
 *     return ctx.lastHostStatus().code();
 * }
 * OutputBuffer out = OutputBuffer.sizeQuery();
 * gateway.signHash(ctx, hProv, hHash, KeySpec.SIGNATURE.code(), 0, out);
 * int required = out.length();
 * </pre>
 *
 * <p>출력 버퍼를 받는 메서드는 {@link OutputBuffer#sizeQuery()}면 필요한 길이만 채우고,
 * 용량이 부족하면 INSUFFICIENT_BUFFER(ERROR_MORE_DATA)로 실패하면서 필요한 길이를 버퍼에 기록합니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public interface BackendGateway {

    // ========== Provider ==========

    /**
     * 프로바이더 컨텍스트 획득.
     *
     * @param ctx 호출 컨텍스트
     * @param container 컨테이너 이름 (null이면 기본 컨테이너, VERIFY_CONTEXT면 null이어야 함)
     * @param flags 획득 플래그
     * @return 프로바이더 핸들 (DELETE_KEYSET이면 0)
     */
    Outcome<Long> acquireContext(CallContext ctx, String container, AcquireFlags flags);

    /**
     * 프로바이더 컨텍스트 해제.
     *
     * <p>프로바이더가 소유한 모든 키와 해시 핸들이 함께 폐기됩니다. 백엔드 호출은 없습니다.</p>
     */
    Outcome<Void> releaseContext(CallContext ctx, long hProv, int flags);

    Outcome<Integer> getProvParam(CallContext ctx, long hProv, int param, OutputBuffer out);

    Outcome<Void> setProvParam(CallContext ctx, long hProv, int param, byte[] value, int flags);

    /**
     * 백엔드 난수 생성.
     *
     * @return 요청한 길이의 난수 바이트
     */
    Outcome<byte[]> generateRandom(CallContext ctx, long hProv, int length);

    // ========== Key ==========

    /**
     * 키 생성.
     *
     * <p>flags 상위 16비트는 키 길이(비트)이며 0이면 알고리즘 기본값을 사용합니다.</p>
     *
     * @return 키 핸들
     */
    Outcome<Long> generateKey(CallContext ctx, long hProv, int algId, int flags);

    /**
     * 컨테이너에 저장된 키 조회.
     *
     * @param keySpec AT_KEYEXCHANGE(1) 또는 AT_SIGNATURE(2)
     * @return 키 핸들, 백엔드에 없으면 NTE_NO_KEY
     */
    Outcome<Long> getUserKey(CallContext ctx, long hProv, int keySpec);

    /**
     * 키 폐기. 백엔드 삭제가 성공한 뒤에만 핸들을 폐기합니다.
     */
    Outcome<Void> destroyKey(CallContext ctx, long hProv, long hKey);

    /**
     * 공개키 내보내기 (PUBLICKEYBLOB).
     *
     * @return 블롭 길이
     */
    Outcome<Integer> exportKey(CallContext ctx, long hProv, long hKey, long hExpKey, int blobType, int flags,
                               OutputBuffer out);

    /**
     * {@link #exportKey}가 만든 블롭 가져오기.
     *
     * @return 키 핸들
     */
    Outcome<Long> importKey(CallContext ctx, long hProv, byte[] blob, long hImpKey, int flags);

    Outcome<Integer> getKeyParam(CallContext ctx, long hProv, long hKey, int param, OutputBuffer out);

    Outcome<Void> setKeyParam(CallContext ctx, long hProv, long hKey, int param, byte[] value, int flags);

    Outcome<Integer> encrypt(CallContext ctx, long hProv, long hKey, byte[] plaintext, OutputBuffer out);

    Outcome<Integer> decrypt(CallContext ctx, long hProv, long hKey, byte[] ciphertext, OutputBuffer out);

    // ========== Hash ==========

    /**
     * 해시 객체 생성.
     *
     * @param hKey 0이어야 함 (keyed hash 미지원)
     * @return 해시 핸들
     */
    Outcome<Long> createHash(CallContext ctx, long hProv, int algId, long hKey, int flags);

    /**
     * 해시 입력 추가. 입력은 최종화까지 로컬에 버퍼링되며 원격 호출은 없습니다.
     */
    Outcome<Void> hashData(CallContext ctx, long hProv, long hHash, byte[] data, int flags);

    Outcome<Integer> getHashParam(CallContext ctx, long hProv, long hHash, int param, OutputBuffer out);

    Outcome<Void> setHashParam(CallContext ctx, long hProv, long hHash, int param, byte[] value, int flags);

    Outcome<Long> duplicateHash(CallContext ctx, long hProv, long hHash);

    /**
     * 해시 서명.
     *
     * <p>size query 호출에서도 원격 서명을 수행하고 결과를 해시 객체에 캐시하므로,
     * 이어지는 실제 호출은 같은 서명을 원격 호출 없이 반환합니다.</p>
     *
     * @return 서명 길이
     */
    Outcome<Integer> signHash(CallContext ctx, long hProv, long hHash, int keySpec, int flags, OutputBuffer out);

    /**
     * 서명 검증.
     *
     * @return 불일치면 NTE_BAD_SIGNATURE로 실패
     */
    Outcome<Void> verifySignature(CallContext ctx, long hProv, long hHash, byte[] signature, long hPubKey, int flags);

    Outcome<Void> destroyHash(CallContext ctx, long hProv, long hHash);

    // ========== Diagnostics ==========

    GatewayStats stats();

    CircuitBreakerState circuitBreakerState();

    /**
     * 서킷 브레이커를 CLOSED로 강제 초기화.
     */
    void resetCircuitBreaker();
}
