package com.ryuqq.cryptogateway.core.contract;

import com.ryuqq.cryptogateway.core.model.AlgorithmId;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * 백엔드가 보고하는 키 정보.
 *
 * <p>개인키 재료는 포함하지 않습니다. {@code publicKey}는 SubjectPublicKeyInfo DER 바이트입니다.</p>
 *
 * @param keyId 백엔드 키 식별자
 * @param algorithm 키 알고리즘
 * @param keySize 키 비트 수
 * @param publicKey 공개키 (SPKI DER)
 * @param exportable 내보내기 허용 여부
 * @param createdAt 생성 시각
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public record KeyMetadata(
    String keyId,
    AlgorithmId algorithm,
    int keySize,
    byte[] publicKey,
    boolean exportable,
    Instant createdAt
) {

    public KeyMetadata {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("keyId cannot be null or blank");
        }
        if (algorithm == null) {
            throw new IllegalArgumentException("algorithm cannot be null");
        }
        if (publicKey == null) {
            throw new IllegalArgumentException("publicKey cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        publicKey = publicKey.clone();
    }

    @Override
    public byte[] publicKey() {
        return publicKey.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KeyMetadata other)) return false;
        return keySize == other.keySize
            && exportable == other.exportable
            && keyId.equals(other.keyId)
            && algorithm == other.algorithm
            && Arrays.equals(publicKey, other.publicKey)
            && createdAt.equals(other.createdAt);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(keyId, algorithm, keySize, exportable, createdAt) + Arrays.hashCode(publicKey);
    }

    @Override
    public String toString() {
        return "KeyMetadata{keyId=" + keyId + ", algorithm=" + algorithm + ", keySize=" + keySize
            + ", exportable=" + exportable + ", createdAt=" + createdAt + '}';
    }
}
