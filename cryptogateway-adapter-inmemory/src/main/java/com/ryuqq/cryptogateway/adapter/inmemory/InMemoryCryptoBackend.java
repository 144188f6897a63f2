package com.ryuqq.cryptogateway.adapter.inmemory;

import com.ryuqq.cryptogateway.core.contract.GenerateKeyRequest;
import com.ryuqq.cryptogateway.core.contract.ImportKeyRequest;
import com.ryuqq.cryptogateway.core.contract.KeyMetadata;
import com.ryuqq.cryptogateway.core.contract.SignRequest;
import com.ryuqq.cryptogateway.core.contract.VerifyRequest;
import com.ryuqq.cryptogateway.core.error.BackendErrorCode;
import com.ryuqq.cryptogateway.core.error.BackendRejectedException;
import com.ryuqq.cryptogateway.core.model.AlgorithmId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.IllegalBlockSizeException;
import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Signature;
import java.security.SignatureException;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.X509EncodedKeySpec;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * JCA 기반 인메모리 암호 백엔드.
 *
 * <p>원격 백엔드 서비스의 서버 측 동작을 프로세스 안에서 재현합니다. 여러
 * {@link InMemoryBackendChannel}이 하나의 인스턴스를 공유하며, 키는
 * {@link ConcurrentHashMap}에 keyId 단위로 저장됩니다.</p>
 *
 * <p><strong>알고리즘 매핑:</strong></p>
 * <ul>
 *   <li>RSA_SIGN / RSA_KEYX: RSA KeyPairGenerator, 서명은 SHAxxxwithRSA, 암호화는 RSA/ECB/PKCS1Padding</li>
 *   <li>ECDSA_P256: secp256r1, 서명은 SHAxxxwithECDSA, 암호화 미지원</li>
 * </ul>
 *
 * <p>{@link #setAvailable(boolean)}로 장애를 흉내낼 수 있습니다. 비가용 상태에서는 새 연결이
 * 실패하고 기존 채널의 호출은 UNAVAILABLE 전송 오류가 됩니다.</p>
 *
 * <p><strong>제약:</strong></p>
 * <ul>
 *   <li>프로세스 재시작 시 모든 키가 사라집니다</li>
 *   <li>운영 환경용이 아닙니다</li>
 * </ul>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public class InMemoryCryptoBackend {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCryptoBackend.class);

    private static final int MIN_RSA_KEY_SIZE = 512;
    private static final int MAX_RSA_KEY_SIZE = 16384;
    private static final int EC_P256_KEY_SIZE = 256;
    private static final String RSA_CIPHER = "RSA/ECB/PKCS1Padding";
    private static final int PKCS1_PADDING_OVERHEAD = 11;
    private static final int MAX_RANDOM_LENGTH = 1024 * 1024;

    private final ConcurrentHashMap<String, StoredKey> keys = new ConcurrentHashMap<>();
    private final SecureRandom random = new SecureRandom();
    private final Clock clock;
    private volatile boolean available = true;

    public InMemoryCryptoBackend() {
        this(Clock.systemUTC());
    }

    public InMemoryCryptoBackend(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    // ========== 가용성 ==========

    public boolean isAvailable() {
        return available;
    }

    /**
     * 백엔드 가용성 전환.
     *
     * @param available false면 이후 연결과 호출이 실패
     */
    public void setAvailable(boolean available) {
        this.available = available;
        log.info("InMemoryCryptoBackend availability changed: {}", available);
    }

    public int keyCount() {
        return keys.size();
    }

    public boolean containsKey(String keyId) {
        return keys.containsKey(keyId);
    }

    // ========== 키 관리 ==========

    KeyMetadata generateKey(GenerateKeyRequest request) {
        if (!request.overwrite() && keys.containsKey(request.keyId())) {
            throw new BackendRejectedException(BackendErrorCode.KEY_ALREADY_EXISTS,
                "Key already exists: " + request.keyId());
        }
        KeyPair pair = newKeyPair(request.algorithm(), request.keySize());
        StoredKey stored = new StoredKey(request.keyId(), request.algorithm(), request.keySize(),
            pair.getPublic(), pair.getPrivate(), request.exportable(), clock.instant());

        if (request.overwrite()) {
            keys.put(request.keyId(), stored);
        } else if (keys.putIfAbsent(request.keyId(), stored) != null) {
            throw new BackendRejectedException(BackendErrorCode.KEY_ALREADY_EXISTS,
                "Key already exists: " + request.keyId());
        }
        log.debug("Generated key: keyId={}, algorithm={}, keySize={}",
            request.keyId(), request.algorithm(), request.keySize());
        return stored.toMetadata();
    }

    KeyMetadata getKey(String keyId) {
        return find(keyId).toMetadata();
    }

    List<KeyMetadata> listKeys(String keyIdPrefix) {
        String prefix = keyIdPrefix == null ? "" : keyIdPrefix;
        return keys.values().stream()
            .filter(key -> key.keyId().startsWith(prefix))
            .sorted(Comparator.comparing(StoredKey::keyId))
            .map(StoredKey::toMetadata)
            .collect(Collectors.toList());
    }

    void deleteKey(String keyId) {
        if (keys.remove(keyId) == null) {
            throw new BackendRejectedException(BackendErrorCode.KEY_NOT_FOUND, "Key not found: " + keyId);
        }
        log.debug("Deleted key: keyId={}", keyId);
    }

    KeyMetadata importKey(ImportKeyRequest request) {
        PublicKey publicKey;
        try {
            publicKey = KeyFactory.getInstance(request.algorithm().jcaName())
                .generatePublic(new X509EncodedKeySpec(request.publicKey()));
        } catch (GeneralSecurityException e) {
            throw new BackendRejectedException(BackendErrorCode.INVALID_DATA,
                "Public key is not a valid " + request.algorithm().jcaName() + " SubjectPublicKeyInfo");
        }
        StoredKey stored = new StoredKey(request.keyId(), request.algorithm(), request.keySize(),
            publicKey, null, true, clock.instant());
        if (keys.putIfAbsent(request.keyId(), stored) != null) {
            throw new BackendRejectedException(BackendErrorCode.KEY_ALREADY_EXISTS,
                "Key already exists: " + request.keyId());
        }
        return stored.toMetadata();
    }

    // ========== 서명 / 검증 ==========

    byte[] sign(SignRequest request) {
        StoredKey key = find(request.keyId());
        if (key.privateKey() == null) {
            throw new BackendRejectedException(BackendErrorCode.INVALID_REQUEST,
                "Key has no private part: " + request.keyId());
        }
        try {
            Signature signature = Signature.getInstance(signatureAlgorithm(request.hashAlgorithm(), key.algorithm()));
            signature.initSign(key.privateKey());
            signature.update(request.data());
            return signature.sign();
        } catch (GeneralSecurityException e) {
            throw cryptoFailure("sign", e);
        }
    }

    boolean verify(VerifyRequest request) {
        StoredKey key = find(request.keyId());
        try {
            Signature signature = Signature.getInstance(signatureAlgorithm(request.hashAlgorithm(), key.algorithm()));
            signature.initVerify(key.publicKey());
            signature.update(request.data());
            return signature.verify(request.signature());
        } catch (SignatureException e) {
            // 형식이 깨진 서명
            return false;
        } catch (GeneralSecurityException e) {
            throw cryptoFailure("verify", e);
        }
    }

    // ========== 암복호화 ==========

    byte[] encrypt(String keyId, byte[] plaintext) {
        StoredKey key = find(keyId);
        requireRsa(key);
        if (plaintext.length > key.keySize() / 8 - PKCS1_PADDING_OVERHEAD) {
            throw new BackendRejectedException(BackendErrorCode.INVALID_DATA,
                "Plaintext too long for " + key.keySize() + "-bit RSA key (current: " + plaintext.length + ")");
        }
        try {
            Cipher cipher = Cipher.getInstance(RSA_CIPHER);
            cipher.init(Cipher.ENCRYPT_MODE, key.publicKey());
            return cipher.doFinal(plaintext);
        } catch (GeneralSecurityException e) {
            throw cryptoFailure("encrypt", e);
        }
    }

    byte[] decrypt(String keyId, byte[] ciphertext) {
        StoredKey key = find(keyId);
        requireRsa(key);
        if (key.privateKey() == null) {
            throw new BackendRejectedException(BackendErrorCode.INVALID_REQUEST, "Key has no private part: " + keyId);
        }
        try {
            Cipher cipher = Cipher.getInstance(RSA_CIPHER);
            cipher.init(Cipher.DECRYPT_MODE, key.privateKey());
            return cipher.doFinal(ciphertext);
        } catch (BadPaddingException | IllegalBlockSizeException e) {
            throw new BackendRejectedException(BackendErrorCode.INVALID_DATA, "Ciphertext could not be decrypted");
        } catch (GeneralSecurityException e) {
            throw cryptoFailure("decrypt", e);
        }
    }

    // ========== 해시 / 난수 ==========

    byte[] digest(AlgorithmId hashAlgorithm, byte[] data) {
        if (!hashAlgorithm.isHash()) {
            throw new BackendRejectedException(BackendErrorCode.UNSUPPORTED_ALGORITHM,
                "Not a hash algorithm: " + hashAlgorithm);
        }
        try {
            return MessageDigest.getInstance(hashAlgorithm.jcaName()).digest(data);
        } catch (GeneralSecurityException e) {
            throw cryptoFailure("digest", e);
        }
    }

    byte[] generateRandom(int length) {
        if (length < 0 || length > MAX_RANDOM_LENGTH) {
            throw new BackendRejectedException(BackendErrorCode.INVALID_REQUEST,
                "length must be between 0 and " + MAX_RANDOM_LENGTH + " (current: " + length + ")");
        }
        byte[] bytes = new byte[length];
        random.nextBytes(bytes);
        return bytes;
    }

    // ========== 내부 구현 ==========

    private StoredKey find(String keyId) {
        StoredKey key = keys.get(keyId);
        if (key == null) {
            throw new BackendRejectedException(BackendErrorCode.KEY_NOT_FOUND, "Key not found: " + keyId);
        }
        return key;
    }

    private KeyPair newKeyPair(AlgorithmId algorithm, int keySize) {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance(algorithm.jcaName());
            if (algorithm == AlgorithmId.ECDSA_P256) {
                if (keySize != EC_P256_KEY_SIZE) {
                    throw new BackendRejectedException(BackendErrorCode.INVALID_KEY_SIZE,
                        "P-256 key size must be 256 (current: " + keySize + ")");
                }
                generator.initialize(new ECGenParameterSpec("secp256r1"), random);
            } else {
                if (keySize < MIN_RSA_KEY_SIZE || keySize > MAX_RSA_KEY_SIZE) {
                    throw new BackendRejectedException(BackendErrorCode.INVALID_KEY_SIZE,
                        "RSA key size must be between " + MIN_RSA_KEY_SIZE + " and " + MAX_RSA_KEY_SIZE
                            + " (current: " + keySize + ")");
                }
                generator.initialize(keySize, random);
            }
            return generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw cryptoFailure("generateKey", e);
        }
    }

    private static void requireRsa(StoredKey key) {
        if (key.algorithm() == AlgorithmId.ECDSA_P256) {
            throw new BackendRejectedException(BackendErrorCode.UNSUPPORTED_ALGORITHM,
                "Encryption is not supported for " + key.algorithm());
        }
    }

    private static String signatureAlgorithm(AlgorithmId hash, AlgorithmId key) {
        if (!hash.isHash()) {
            throw new BackendRejectedException(BackendErrorCode.UNSUPPORTED_ALGORITHM, "Not a hash algorithm: " + hash);
        }
        String suffix = key == AlgorithmId.ECDSA_P256 ? "withECDSA" : "withRSA";
        return hash.jcaName().replace("-", "") + suffix;
    }

    private static BackendRejectedException cryptoFailure(String operation, GeneralSecurityException e) {
        log.warn("{} failed: {}", operation, e.toString());
        BackendErrorCode code = e instanceof InvalidKeyException
            ? BackendErrorCode.INVALID_REQUEST
            : BackendErrorCode.CRYPTO_OPERATION_FAILED;
        return new BackendRejectedException(code, operation + " failed: " + e.getMessage());
    }

    private record StoredKey(
        String keyId,
        AlgorithmId algorithm,
        int keySize,
        PublicKey publicKey,
        PrivateKey privateKey,
        boolean exportable,
        Instant createdAt
    ) {
        KeyMetadata toMetadata() {
            return new KeyMetadata(keyId, algorithm, keySize, publicKey.getEncoded(), exportable, createdAt);
        }
    }
}
