package com.ryuqq.cryptogateway.core.contract;

import com.ryuqq.cryptogateway.core.model.AlgorithmId;

/**
 * 백엔드 키 생성 요청.
 *
 * @param keyId 백엔드 키 식별자
 * @param algorithm 키 알고리즘
 * @param keySize 키 비트 수
 * @param exportable 공개키 내보내기 허용 여부
 * @param overwrite 같은 식별자의 키가 있으면 교체할지 여부
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public record GenerateKeyRequest(
    String keyId,
    AlgorithmId algorithm,
    int keySize,
    boolean exportable,
    boolean overwrite
) {

    public GenerateKeyRequest {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("keyId cannot be null or blank");
        }
        if (algorithm == null || !algorithm.isKey()) {
            throw new IllegalArgumentException("algorithm must be a key algorithm");
        }
        if (keySize <= 0) {
            throw new IllegalArgumentException("keySize must be positive");
        }
    }
}
