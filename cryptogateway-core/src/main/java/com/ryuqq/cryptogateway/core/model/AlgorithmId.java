package com.ryuqq.cryptogateway.core.model;

import java.util.Optional;

/**
 * 지원하는 알고리즘 식별자 (ALG_ID).
 *
 * <p>키 알고리즘과 해시 알고리즘을 함께 정의합니다. 코드 값은 호스트가 전달하는
 * CALG_* 상수와 동일합니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public enum AlgorithmId {

    RSA_SIGN(0x2400, Category.KEY, KeySpec.SIGNATURE, 2048, 0, "RSA"),
    RSA_KEYX(0xA400, Category.KEY, KeySpec.EXCHANGE, 2048, 0, "RSA"),
    ECDSA_P256(0x2203, Category.KEY, KeySpec.SIGNATURE, 256, 0, "EC"),
    SHA1(0x8004, Category.HASH, null, 0, 20, "SHA-1"),
    SHA_256(0x800C, Category.HASH, null, 0, 32, "SHA-256"),
    SHA_384(0x800D, Category.HASH, null, 0, 48, "SHA-384"),
    SHA_512(0x800E, Category.HASH, null, 0, 64, "SHA-512");

    /**
     * 알고리즘 범주.
     */
    public enum Category {
        KEY,
        HASH
    }

    private final int code;
    private final Category category;
    private final KeySpec defaultKeySpec;
    private final int defaultKeySize;
    private final int digestLength;
    private final String jcaName;

    AlgorithmId(int code, Category category, KeySpec defaultKeySpec, int defaultKeySize, int digestLength, String jcaName) {
        this.code = code;
        this.category = category;
        this.defaultKeySpec = defaultKeySpec;
        this.defaultKeySize = defaultKeySize;
        this.digestLength = digestLength;
        this.jcaName = jcaName;
    }

    public int code() {
        return code;
    }

    public Category category() {
        return category;
    }

    public boolean isHash() {
        return category == Category.HASH;
    }

    public boolean isKey() {
        return category == Category.KEY;
    }

    /**
     * 키 알고리즘의 기본 슬롯.
     *
     * @return 키 슬롯, 해시 알고리즘이면 null
     */
    public KeySpec defaultKeySpec() {
        return defaultKeySpec;
    }

    /**
     * 크기가 지정되지 않았을 때 사용하는 키 비트 수.
     *
     * @return 키 비트 수, 해시 알고리즘이면 0
     */
    public int defaultKeySize() {
        return defaultKeySize;
    }

    /**
     * 해시 출력 바이트 수.
     *
     * @return 다이제스트 길이, 키 알고리즘이면 0
     */
    public int digestLength() {
        return digestLength;
    }

    /**
     * java.security 알고리즘 이름 (키: "RSA"/"EC", 해시: "SHA-256" 등).
     *
     * @return JCA 이름
     */
    public String jcaName() {
        return jcaName;
    }

    /**
     * 코드로 알고리즘 조회.
     *
     * @param code ALG_ID 값
     * @return 알고리즘, 지원하지 않는 코드면 empty
     */
    public static Optional<AlgorithmId> fromCode(int code) {
        for (AlgorithmId id : values()) {
            if (id.code == code) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }

    /**
     * 키 생성용 알고리즘 조회.
     *
     * <p>호스트는 키 생성 시 CALG_* 대신 AT_KEYEXCHANGE(1) / AT_SIGNATURE(2)를 전달할 수 있으며,
     * 이 경우 RSA 키로 해석합니다.</p>
     *
     * @param code ALG_ID 또는 KeySpec 코드
     * @return 키 알고리즘, 해시이거나 지원하지 않으면 empty
     */
    public static Optional<AlgorithmId> keyAlgorithmFromCode(int code) {
        if (code == KeySpec.EXCHANGE.code()) {
            return Optional.of(RSA_KEYX);
        }
        if (code == KeySpec.SIGNATURE.code()) {
            return Optional.of(RSA_SIGN);
        }
        return fromCode(code).filter(AlgorithmId::isKey);
    }
}
