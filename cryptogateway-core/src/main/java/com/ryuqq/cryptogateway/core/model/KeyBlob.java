package com.ryuqq.cryptogateway.core.model;

import com.ryuqq.cryptogateway.core.error.HostStatus;
import com.ryuqq.cryptogateway.core.error.InvalidParameterException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * 공개키 블롭 (PUBLICKEYBLOB).
 *
 * <p>레이아웃 (리틀 엔디언):</p>
 * <pre>
 * [0]     bType     = 0x06 (PUBLICKEYBLOB)
 * [1]     bVersion  = 0x02
 * [2..3]  reserved  = 0
 * [4..7]  aiKeyAlg  (ALG_ID)
 * [8..11] keySize   (bits)
 * [12..]  SubjectPublicKeyInfo (DER)
 * </pre>
 *
 * @param algorithm 키 알고리즘
 * @param keySize 키 비트 수
 * @param publicKey SubjectPublicKeyInfo DER 바이트
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public record KeyBlob(AlgorithmId algorithm, int keySize, byte[] publicKey) {

    public static final int PUBLICKEYBLOB = 0x06;
    public static final int BLOB_VERSION = 0x02;
    public static final int HEADER_LENGTH = 12;

    public KeyBlob {
        if (algorithm == null || !algorithm.isKey()) {
            throw new IllegalArgumentException("algorithm must be a key algorithm");
        }
        if (keySize <= 0) {
            throw new IllegalArgumentException("keySize must be positive");
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

    public byte[] encode() {
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_LENGTH + publicKey.length).order(ByteOrder.LITTLE_ENDIAN);
        buffer.put((byte) PUBLICKEYBLOB);
        buffer.put((byte) BLOB_VERSION);
        buffer.putShort((short) 0);
        buffer.putInt(algorithm.code());
        buffer.putInt(keySize);
        buffer.put(publicKey);
        return buffer.array();
    }

    /**
     * 블롭 해석.
     *
     * @param blob 블롭 바이트
     * @return KeyBlob
     * @throws InvalidParameterException 형식이 잘못된 경우 (BAD_TYPE, BAD_DATA, BAD_ALGID)
     */
    public static KeyBlob decode(byte[] blob) {
        if (blob == null || blob.length <= HEADER_LENGTH) {
            throw new InvalidParameterException(HostStatus.BAD_DATA, "Key blob is too short");
        }
        ByteBuffer buffer = ByteBuffer.wrap(blob).order(ByteOrder.LITTLE_ENDIAN);
        int type = buffer.get() & 0xFF;
        if (type != PUBLICKEYBLOB) {
            throw new InvalidParameterException(HostStatus.BAD_TYPE, "Unsupported blob type: 0x" + Integer.toHexString(type));
        }
        int version = buffer.get() & 0xFF;
        if (version != BLOB_VERSION) {
            throw new InvalidParameterException(HostStatus.BAD_DATA, "Unsupported blob version: " + version);
        }
        buffer.getShort();
        int algCode = buffer.getInt();
        AlgorithmId algorithm = AlgorithmId.fromCode(algCode)
            .filter(AlgorithmId::isKey)
            .orElseThrow(() -> new InvalidParameterException(HostStatus.BAD_ALGID,
                "Unsupported key algorithm in blob: 0x" + Integer.toHexString(algCode)));
        int keySize = buffer.getInt();
        if (keySize <= 0) {
            throw new InvalidParameterException(HostStatus.BAD_DATA, "Invalid key size in blob: " + keySize);
        }
        byte[] spki = Arrays.copyOfRange(blob, HEADER_LENGTH, blob.length);
        return new KeyBlob(algorithm, keySize, spki);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KeyBlob other)) return false;
        return algorithm == other.algorithm && keySize == other.keySize && Arrays.equals(publicKey, other.publicKey);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * algorithm.hashCode() + keySize) + Arrays.hashCode(publicKey);
    }

    @Override
    public String toString() {
        return "KeyBlob{algorithm=" + algorithm + ", keySize=" + keySize + ", publicKeyLength=" + publicKey.length + '}';
    }
}
