package com.ryuqq.cryptogateway.core.spi;

import com.ryuqq.cryptogateway.core.contract.GenerateKeyRequest;
import com.ryuqq.cryptogateway.core.contract.ImportKeyRequest;
import com.ryuqq.cryptogateway.core.contract.KeyMetadata;
import com.ryuqq.cryptogateway.core.contract.SignRequest;
import com.ryuqq.cryptogateway.core.contract.VerifyRequest;
import com.ryuqq.cryptogateway.core.model.AlgorithmId;

import java.util.List;

/**
 * 원격 암호 백엔드로 가는 채널 하나.
 *
 * <p>풀이 채널을 독점적으로 빌려주므로 구현체는 한 번에 한 스레드에서만 호출된다고 가정할 수 있습니다.
 * 단, 요청 타임아웃으로 취소된 호출이 끝나기 전에 {@link #close()}가 다른 스레드에서 호출될 수 있습니다.</p>
 *
 * <p><strong>실패 보고:</strong></p>
 * <ul>
 *   <li>전송 실패: {@link com.ryuqq.cryptogateway.core.error.TransportException}</li>
 *   <li>백엔드 거부: {@link com.ryuqq.cryptogateway.core.error.BackendRejectedException}</li>
 * </ul>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public interface BackendChannel extends AutoCloseable {

    /**
     * 키 생성.
     *
     * @param request 생성 요청
     * @return 생성된 키 정보
     */
    KeyMetadata generateKey(GenerateKeyRequest request);

    /**
     * 키 조회.
     *
     * @param keyId 백엔드 키 식별자
     * @return 키 정보 (없으면 KEY_NOT_FOUND로 거부)
     */
    KeyMetadata getKey(String keyId);

    /**
     * 접두사로 키 목록 조회.
     *
     * @param keyIdPrefix 식별자 접두사 (빈 문자열이면 전체)
     * @return 키 목록
     */
    List<KeyMetadata> listKeys(String keyIdPrefix);

    /**
     * 키 삭제.
     *
     * @param keyId 백엔드 키 식별자
     */
    void deleteKey(String keyId);

    /**
     * 공개키 가져오기.
     *
     * @param request 가져오기 요청
     * @return 생성된 키 정보
     */
    KeyMetadata importKey(ImportKeyRequest request);

    byte[] sign(SignRequest request);

    /**
     * 서명 검증.
     *
     * @param request 검증 요청
     * @return 서명이 유효하면 true
     */
    boolean verify(VerifyRequest request);

    byte[] encrypt(String keyId, byte[] plaintext);

    byte[] decrypt(String keyId, byte[] ciphertext);

    /**
     * 다이제스트 계산.
     *
     * @param hashAlgorithm 해시 알고리즘
     * @param data 입력
     * @return 다이제스트
     */
    byte[] digest(AlgorithmId hashAlgorithm, byte[] data);

    byte[] generateRandom(int length);

    /**
     * 채널을 계속 사용할 수 있는지 확인.
     *
     * @return 사용 가능하면 true
     */
    boolean isHealthy();

    /**
     * 채널 종료. 예외를 던지지 않습니다.
     */
    @Override
    void close();
}
