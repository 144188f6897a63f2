package com.ryuqq.cryptogateway.core.contract;

import com.ryuqq.cryptogateway.core.model.AlgorithmId;

/**
 * 백엔드 서명 검증 요청.
 *
 * @param keyId 검증 키 식별자
 * @param hashAlgorithm 해시 알고리즘
 * @param data 해시 입력 전체
 * @param signature 검증할 서명
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public record VerifyRequest(String keyId, AlgorithmId hashAlgorithm, byte[] data, byte[] signature) {

    public VerifyRequest {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("keyId cannot be null or blank");
        }
        if (hashAlgorithm == null || !hashAlgorithm.isHash()) {
            throw new IllegalArgumentException("hashAlgorithm must be a hash algorithm");
        }
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        if (signature == null) {
            throw new IllegalArgumentException("signature cannot be null");
        }
        data = data.clone();
        signature = signature.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    @Override
    public byte[] signature() {
        return signature.clone();
    }
}
