package com.ryuqq.cryptogateway.core.contract;

import com.ryuqq.cryptogateway.core.model.AlgorithmId;

/**
 * 백엔드 공개키 가져오기 요청.
 *
 * @param keyId 새 키에 부여할 백엔드 식별자
 * @param algorithm 키 알고리즘
 * @param keySize 키 비트 수
 * @param publicKey 공개키 (SPKI DER)
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public record ImportKeyRequest(String keyId, AlgorithmId algorithm, int keySize, byte[] publicKey) {

    public ImportKeyRequest {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("keyId cannot be null or blank");
        }
        if (algorithm == null || !algorithm.isKey()) {
            throw new IllegalArgumentException("algorithm must be a key algorithm");
        }
        if (publicKey == null || publicKey.length == 0) {
            throw new IllegalArgumentException("publicKey cannot be null or empty");
        }
        publicKey = publicKey.clone();
    }

    @Override
    public byte[] publicKey() {
        return publicKey.clone();
    }
}
