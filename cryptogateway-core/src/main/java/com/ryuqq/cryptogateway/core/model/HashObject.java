package com.ryuqq.cryptogateway.core.model;

import com.ryuqq.cryptogateway.core.error.HostStatus;
import com.ryuqq.cryptogateway.core.error.InvalidParameterException;

import java.io.ByteArrayOutputStream;

/**
 * 해시 객체.
 *
 * <p>입력은 최종화 시점까지 로컬에 버퍼링되고, 다이제스트/서명 계산은 백엔드가 수행합니다.
 * 최종화(다이제스트 조회, 서명, 검증) 이후에는 데이터를 추가할 수 없습니다.</p>
 *
 * <p><strong>동시성:</strong> 핸들 리스로 한 번에 한 작업만 접근하므로 내부 동기화를 하지 않습니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public final class HashObject implements ManagedObject {

    private final AlgorithmId algorithm;
    private final ByteArrayOutputStream input;
    private boolean finalized;
    private byte[] digest;
    private byte[] signature;
    private KeySpec signatureKeySpec;

    public HashObject(AlgorithmId algorithm) {
        if (algorithm == null || !algorithm.isHash()) {
            throw new IllegalArgumentException("algorithm must be a hash algorithm");
        }
        this.algorithm = algorithm;
        this.input = new ByteArrayOutputStream();
    }

    private HashObject(HashObject source) {
        this.algorithm = source.algorithm;
        this.input = new ByteArrayOutputStream(Math.max(32, source.input.size()));
        this.input.writeBytes(source.input.toByteArray());
        this.finalized = source.finalized;
        this.digest = source.digest;
        this.signature = source.signature;
        this.signatureKeySpec = source.signatureKeySpec;
    }

    @Override
    public HandleKind kind() {
        return HandleKind.HASH;
    }

    public AlgorithmId algorithm() {
        return algorithm;
    }

    /**
     * 입력 추가.
     *
     * @param data 입력 데이터
     * @param limit 누적 입력 최대 바이트 수
     * @throws InvalidParameterException 최종화된 경우 (BAD_HASH_STATE), 한도를 넘는 경우 (BAD_LEN)
     */
    public void append(byte[] data, long limit) {
        if (finalized) {
            throw new InvalidParameterException(HostStatus.BAD_HASH_STATE, "Hash is already finalized");
        }
        if ((long) input.size() + data.length > limit) {
            throw new InvalidParameterException(HostStatus.BAD_LEN,
                "Hash input exceeds limit of " + limit + " bytes");
        }
        input.writeBytes(data);
    }

    public byte[] input() {
        return input.toByteArray();
    }

    public int inputLength() {
        return input.size();
    }

    public boolean isFinalized() {
        return finalized;
    }

    public void markFinalized() {
        this.finalized = true;
    }

    /**
     * 캐시된 다이제스트.
     *
     * @return 다이제스트 사본, 없으면 null
     */
    public byte[] cachedDigest() {
        return digest == null ? null : digest.clone();
    }

    public void cacheDigest(byte[] value) {
        this.digest = value.clone();
        this.finalized = true;
    }

    /**
     * 같은 키 슬롯으로 만든 서명이 캐시되어 있으면 반환.
     *
     * <p>서명 크기 조회 후 실제 서명 호출에서 백엔드를 다시 호출하지 않기 위해 사용됩니다.</p>
     *
     * @param keySpec 서명 키 슬롯
     * @return 서명 사본, 없거나 슬롯이 다르면 null
     */
    public byte[] cachedSignature(KeySpec keySpec) {
        if (signature == null || signatureKeySpec != keySpec) {
            return null;
        }
        return signature.clone();
    }

    public void cacheSignature(KeySpec keySpec, byte[] value) {
        this.signature = value.clone();
        this.signatureKeySpec = keySpec;
        this.finalized = true;
    }

    /**
     * 현재 상태를 그대로 복제.
     *
     * @return 독립적인 사본
     */
    public HashObject duplicate() {
        return new HashObject(this);
    }

    @Override
    public String toString() {
        return "HashObject{algorithm=" + algorithm + ", inputLength=" + input.size()
            + ", finalized=" + finalized + '}';
    }
}
