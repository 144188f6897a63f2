package com.ryuqq.cryptogateway.core.contract;

import com.ryuqq.cryptogateway.core.model.AlgorithmId;

/**
 * 백엔드 서명 요청.
 *
 * <p>백엔드가 {@code hashAlgorithm}으로 {@code data}를 해시한 뒤 서명합니다.</p>
 *
 * @param keyId 서명 키 식별자
 * @param hashAlgorithm 해시 알고리즘
 * @param data 해시 입력 전체
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public record SignRequest(String keyId, AlgorithmId hashAlgorithm, byte[] data) {

    public SignRequest {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("keyId cannot be null or blank");
        }
        if (hashAlgorithm == null || !hashAlgorithm.isHash()) {
            throw new IllegalArgumentException("hashAlgorithm must be a hash algorithm");
        }
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        data = data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }
}
