package com.ryuqq.cryptogateway.application.gateway;

import com.ryuqq.cryptogateway.application.invoke.RemoteInvoker;
import com.ryuqq.cryptogateway.core.contract.GenerateKeyRequest;
import com.ryuqq.cryptogateway.core.contract.ImportKeyRequest;
import com.ryuqq.cryptogateway.core.contract.KeyMetadata;
import com.ryuqq.cryptogateway.core.contract.SignRequest;
import com.ryuqq.cryptogateway.core.contract.VerifyRequest;
import com.ryuqq.cryptogateway.core.error.BackendErrorCode;
import com.ryuqq.cryptogateway.core.error.BackendRejectedException;
import com.ryuqq.cryptogateway.core.error.ErrorContext;
import com.ryuqq.cryptogateway.core.error.ErrorTranslator;
import com.ryuqq.cryptogateway.core.error.GatewayException;
import com.ryuqq.cryptogateway.core.error.HostStatus;
import com.ryuqq.cryptogateway.core.error.InvalidParameterException;
import com.ryuqq.cryptogateway.core.handle.HandleLease;
import com.ryuqq.cryptogateway.core.handle.HandleTable;
import com.ryuqq.cryptogateway.core.model.AcquireFlags;
import com.ryuqq.cryptogateway.core.model.AlgorithmId;
import com.ryuqq.cryptogateway.core.model.HandleKind;
import com.ryuqq.cryptogateway.core.model.HashObject;
import com.ryuqq.cryptogateway.core.model.HashParam;
import com.ryuqq.cryptogateway.core.model.KeyBlob;
import com.ryuqq.cryptogateway.core.model.KeyFlags;
import com.ryuqq.cryptogateway.core.model.KeyObject;
import com.ryuqq.cryptogateway.core.model.KeyParam;
import com.ryuqq.cryptogateway.core.model.KeySpec;
import com.ryuqq.cryptogateway.core.model.ManagedObject;
import com.ryuqq.cryptogateway.core.model.OutputBuffer;
import com.ryuqq.cryptogateway.core.model.ProvParam;
import com.ryuqq.cryptogateway.core.model.ProviderContext;
import com.ryuqq.cryptogateway.core.outcome.Fail;
import com.ryuqq.cryptogateway.core.outcome.Ok;
import com.ryuqq.cryptogateway.core.outcome.Outcome;
import com.ryuqq.cryptogateway.core.protection.CircuitBreaker;
import com.ryuqq.cryptogateway.core.protection.CircuitBreakerState;
import com.ryuqq.cryptogateway.core.spi.ConnectionPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * {@link BackendGateway} 기본 구현.
 *
 * <p>핸들 테이블, 원격 호출 실행기, 설정을 주입받아 호스트 동사를 구현합니다.
 * 게이트웨이 내부의 모든 실패는 {@link GatewayException}으로 던져지고,
 * {@link #execute}에서 한 번만 잡혀 {@link Fail}과 CallContext 마지막 오류로 바뀝니다.</p>
 *
 * <p><strong>핸들 독점:</strong> 키와 해시 핸들을 다루는 동작은 작업 동안 해당 핸들을 lease하므로,
 * 같은 핸들에 대한 동시 호출 중 하나는 HANDLE_BUSY로 실패합니다.</p>
 *
 * <p><strong>원자성:</strong> 원격 호출이 실패하면 핸들 테이블은 바뀌지 않습니다.
 * 원격에서 키를 만든 뒤 핸들 발급이 실패하면 백엔드 키를 다시 삭제합니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public final class CryptoBackendGateway implements BackendGateway, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CryptoBackendGateway.class);

    private static final int MIN_RSA_KEY_SIZE = 1024;
    private static final int MAX_RSA_KEY_SIZE = 16384;
    private static final int EC_P256_KEY_SIZE = 256;

    private final HandleTable handles;
    private final RemoteInvoker invoker;
    private final GatewayConfig config;

    /**
     * 생성자.
     *
     * @param pool 커넥션 풀
     * @param circuitBreaker 서킷 브레이커
     * @param config 게이트웨이 설정
     */
    public CryptoBackendGateway(ConnectionPool pool, CircuitBreaker circuitBreaker, GatewayConfig config) {
        this(new HandleTable(), new RemoteInvoker(pool, circuitBreaker, requireConfig(config).retryPolicy()), config);
    }

    /**
     * 생성자 (구성 요소 직접 주입).
     *
     * @param handles 핸들 테이블
     * @param invoker 원격 호출 실행기
     * @param config 게이트웨이 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public CryptoBackendGateway(HandleTable handles, RemoteInvoker invoker, GatewayConfig config) {
        if (handles == null) {
            throw new IllegalArgumentException("handles cannot be null");
        }
        if (invoker == null) {
            throw new IllegalArgumentException("invoker cannot be null");
        }
        this.handles = handles;
        this.invoker = invoker;
        this.config = requireConfig(config);
    }

    private static GatewayConfig requireConfig(GatewayConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return config;
    }

    // ========== Provider ==========

    @Override
    public Outcome<Long> acquireContext(CallContext ctx, String container, AcquireFlags flags) {
        return execute(ctx, "acquireContext", () -> {
            AcquireFlags acquireFlags = flags == null ? AcquireFlags.none() : flags;
            if (acquireFlags.hasUnknownBits()) {
                throw new InvalidParameterException(HostStatus.BAD_FLAGS, "Unknown acquire flags " + acquireFlags);
            }
            boolean verify = acquireFlags.isVerifyContext();
            boolean hasContainer = container != null && !container.isBlank();
            if (verify && hasContainer) {
                throw new InvalidParameterException(HostStatus.BAD_FLAGS,
                    "VERIFYCONTEXT cannot be combined with a container name");
            }
            if (verify && (acquireFlags.isNewKeyset() || acquireFlags.isDeleteKeyset())) {
                throw new InvalidParameterException(HostStatus.BAD_FLAGS,
                    "VERIFYCONTEXT cannot be combined with NEWKEYSET or DELETEKEYSET");
            }

            String name = verify ? null : (hasContainer ? container : config.defaultContainer());
            if (name != null && name.contains("/")) {
                throw new InvalidParameterException("Container name cannot contain '/': " + name);
            }

            if (acquireFlags.isDeleteKeyset()) {
                int deleted = invoker.invoke("deleteKeyset", channel -> {
                    List<KeyMetadata> keys = channel.listKeys(name + "/");
                    for (KeyMetadata key : keys) {
                        channel.deleteKey(key.keyId());
                    }
                    return keys.size();
                });
                log.info("Deleted key container {} ({} keys)", name, deleted);
                return 0L;
            }
            if (acquireFlags.isNewKeyset()) {
                List<KeyMetadata> existing = invoker.invoke("listKeys", channel -> channel.listKeys(name + "/"));
                if (!existing.isEmpty()) {
                    throw new InvalidParameterException(HostStatus.EXISTS, "Key container already exists: " + name);
                }
            }

            ProviderContext provider = ProviderContext.open(name, acquireFlags);
            long hProv = handles.create(provider);
            log.debug("Acquired provider 0x{} for {}", Long.toHexString(hProv), provider);
            return hProv;
        });
    }

    @Override
    public Outcome<Void> releaseContext(CallContext ctx, long hProv, int flags) {
        return execute(ctx, "releaseContext", () -> {
            handles.resolve(hProv, HandleKind.PROVIDER, ProviderContext.class);
            requireNoFlags(flags);
            List<ManagedObject> retired = handles.retire(hProv);
            log.debug("Released provider 0x{} with {} owned objects", Long.toHexString(hProv), retired.size() - 1);
            return null;
        });
    }

    @Override
    public Outcome<Integer> getProvParam(CallContext ctx, long hProv, int param, OutputBuffer out) {
        return execute(ctx, "getProvParam", () -> {
            ProviderContext provider = handles.resolve(hProv, HandleKind.PROVIDER, ProviderContext.class);
            requireOutput(out);
            ProvParam parameter = ProvParam.fromCode(param)
                .orElseThrow(() -> new InvalidParameterException(HostStatus.BAD_TYPE, "Unknown provider parameter " + param));
            byte[] value = switch (parameter) {
                case NAME -> HostEncoding.asciiz(config.providerName());
                case CONTAINER -> HostEncoding.asciiz(requireContainer(provider));
                case UNIQUE_CONTAINER -> HostEncoding.asciiz(config.providerName() + "\\" + requireContainer(provider));
                case VERSION -> HostEncoding.dword(config.providerVersion());
                case PROVTYPE -> HostEncoding.dword(config.providerType());
                case IMPTYPE -> HostEncoding.dword(config.implementationType());
                case CLIENT_HWND -> throw new InvalidParameterException(HostStatus.BAD_TYPE, "PP_CLIENT_HWND is write-only");
            };
            out.fill(value);
            return out.length();
        });
    }

    @Override
    public Outcome<Void> setProvParam(CallContext ctx, long hProv, int param, byte[] value, int flags) {
        return execute(ctx, "setProvParam", () -> {
            ProviderContext provider = handles.resolve(hProv, HandleKind.PROVIDER, ProviderContext.class);
            requireNoFlags(flags);
            if (ProvParam.fromCode(param).filter(p -> p == ProvParam.CLIENT_HWND).isEmpty()) {
                throw new InvalidParameterException(HostStatus.BAD_TYPE, "Provider parameter " + param + " is not settable");
            }
            provider.setClientWindow(HostEncoding.readHandleValue(value));
            return null;
        });
    }

    @Override
    public Outcome<byte[]> generateRandom(CallContext ctx, long hProv, int length) {
        return execute(ctx, "generateRandom", () -> {
            handles.resolve(hProv, HandleKind.PROVIDER, ProviderContext.class);
            if (length < 0) {
                throw new InvalidParameterException("length must be non-negative (current: " + length + ")");
            }
            if (length == 0) {
                return new byte[0];
            }
            return invoker.invoke("generateRandom", channel -> channel.generateRandom(length));
        });
    }

    // ========== Key ==========

    @Override
    public Outcome<Long> generateKey(CallContext ctx, long hProv, int algId, int flags) {
        return execute(ctx, "generateKey", () -> {
            ProviderContext provider = handles.resolve(hProv, HandleKind.PROVIDER, ProviderContext.class);
            AlgorithmId algorithm = AlgorithmId.keyAlgorithmFromCode(algId)
                .orElseThrow(() -> new InvalidParameterException(HostStatus.BAD_ALGID,
                    "Unsupported key algorithm 0x" + Integer.toHexString(algId)));
            if (KeyFlags.hasUnknownOptions(flags)) {
                throw new InvalidParameterException(HostStatus.BAD_FLAGS,
                    "Unknown key flags 0x" + Integer.toHexString(flags & 0xFFFF));
            }
            int requested = KeyFlags.keySize(flags);
            int keySize = requested == 0 ? algorithm.defaultKeySize() : requested;
            requireSupportedKeySize(algorithm, keySize);

            boolean exportable = KeyFlags.isExportable(flags);
            boolean persistent = !provider.isVerifyContext();
            KeySpec keySpec = algorithm.defaultKeySpec();
            String keyId = persistent
                ? provider.keyIdFor(keySpec)
                : "ephemeral/" + provider.sessionId() + "/" + UUID.randomUUID();

            GenerateKeyRequest request = new GenerateKeyRequest(keyId, algorithm, keySize, exportable, persistent);
            KeyMetadata metadata = invoker.invoke("generateKey", channel -> channel.generateKey(request));
            KeyObject key = new KeyObject(metadata.keyId(), algorithm, keySpec, metadata.keySize(), exportable, persistent);
            return issueKeyHandle(hProv, key);
        });
    }

    @Override
    public Outcome<Long> getUserKey(CallContext ctx, long hProv, int keySpec) {
        return execute(ctx, "getUserKey", () -> {
            ProviderContext provider = handles.resolve(hProv, HandleKind.PROVIDER, ProviderContext.class);
            KeySpec spec = requireKeySpec(keySpec);
            if (provider.isVerifyContext()) {
                throw new InvalidParameterException(HostStatus.NO_KEY, "Verify context has no stored keys");
            }
            String keyId = provider.keyIdFor(spec);
            KeyMetadata metadata = invoker.invoke("getKey", channel -> channel.getKey(keyId));
            KeyObject key = new KeyObject(metadata.keyId(), metadata.algorithm(), spec, metadata.keySize(),
                metadata.exportable(), true);
            return handles.createChild(hProv, key);
        });
    }

    @Override
    public Outcome<Void> destroyKey(CallContext ctx, long hProv, long hKey) {
        return execute(ctx, "destroyKey", () -> {
            handles.requireOwnedBy(hProv, hKey);
            try (HandleLease<KeyObject> lease = handles.lease(hKey, HandleKind.KEY, KeyObject.class)) {
                String keyId = lease.payload().keyId();
                try {
                    invoker.invoke("deleteKey", channel -> {
                        channel.deleteKey(keyId);
                        return null;
                    });
                } catch (BackendRejectedException e) {
                    if (e.reason() != BackendErrorCode.KEY_NOT_FOUND) {
                        throw e;
                    }
                    log.debug("Backend key {} was already gone", keyId);
                }
                lease.retire();
            }
            return null;
        });
    }

    @Override
    public Outcome<Integer> exportKey(CallContext ctx, long hProv, long hKey, long hExpKey, int blobType, int flags,
                                      OutputBuffer out) {
        return execute(ctx, "exportKey", () -> {
            handles.requireOwnedBy(hProv, hKey);
            requireOutput(out);
            if (hExpKey != 0) {
                throw new InvalidParameterException("Key wrapping with an export key is not supported");
            }
            if (blobType != KeyBlob.PUBLICKEYBLOB) {
                throw new InvalidParameterException(HostStatus.BAD_TYPE,
                    "Only PUBLICKEYBLOB is supported (requested: " + blobType + ")");
            }
            requireNoFlags(flags);
            try (HandleLease<KeyObject> lease = handles.lease(hKey, HandleKind.KEY, KeyObject.class)) {
                KeyObject key = lease.payload();
                KeyMetadata metadata = invoker.invoke("getKey", channel -> channel.getKey(key.keyId()));
                byte[] blob = new KeyBlob(key.algorithm(), key.keySize(), metadata.publicKey()).encode();
                out.fill(blob);
                return out.length();
            }
        });
    }

    @Override
    public Outcome<Long> importKey(CallContext ctx, long hProv, byte[] blob, long hImpKey, int flags) {
        return execute(ctx, "importKey", () -> {
            ProviderContext provider = handles.resolve(hProv, HandleKind.PROVIDER, ProviderContext.class);
            if (hImpKey != 0) {
                throw new InvalidParameterException("Importing wrapped keys is not supported");
            }
            if (KeyFlags.hasUnknownOptions(flags)) {
                throw new InvalidParameterException(HostStatus.BAD_FLAGS,
                    "Unknown key flags 0x" + Integer.toHexString(flags));
            }
            if (blob == null) {
                throw new InvalidParameterException("blob cannot be null");
            }
            KeyBlob decoded = KeyBlob.decode(blob);
            String keyId = "imported/" + provider.sessionId() + "/" + UUID.randomUUID();
            ImportKeyRequest request = new ImportKeyRequest(keyId, decoded.algorithm(), decoded.keySize(),
                decoded.publicKey());
            KeyMetadata metadata = invoker.invoke("importKey", channel -> channel.importKey(request));
            KeyObject key = KeyObject.imported(metadata.keyId(), decoded.algorithm(), decoded.keySize());
            return issueKeyHandle(hProv, key);
        });
    }

    @Override
    public Outcome<Integer> getKeyParam(CallContext ctx, long hProv, long hKey, int param, OutputBuffer out) {
        return execute(ctx, "getKeyParam", () -> {
            handles.requireOwnedBy(hProv, hKey);
            requireOutput(out);
            try (HandleLease<KeyObject> lease = handles.lease(hKey, HandleKind.KEY, KeyObject.class)) {
                KeyObject key = lease.payload();
                KeyParam parameter = requireKeyParam(param);
                int value = switch (parameter) {
                    case ALGID -> key.algorithm().code();
                    case KEYLEN -> key.keySize();
                    case PERMISSIONS -> key.permissions();
                };
                out.fill(HostEncoding.dword(value));
                return out.length();
            }
        });
    }

    @Override
    public Outcome<Void> setKeyParam(CallContext ctx, long hProv, long hKey, int param, byte[] value, int flags) {
        return execute(ctx, "setKeyParam", () -> {
            handles.requireOwnedBy(hProv, hKey);
            requireNoFlags(flags);
            try (HandleLease<KeyObject> lease = handles.lease(hKey, HandleKind.KEY, KeyObject.class)) {
                KeyParam parameter = requireKeyParam(param);
                if (parameter != KeyParam.PERMISSIONS) {
                    throw new InvalidParameterException(HostStatus.BAD_TYPE, "Key parameter " + parameter + " is read-only");
                }
                int permissions = HostEncoding.readDword(value);
                if (!lease.payload().updatePermissions(permissions)) {
                    throw new InvalidParameterException(HostStatus.PERM, "Export permission cannot be granted");
                }
                return null;
            }
        });
    }

    @Override
    public Outcome<Integer> encrypt(CallContext ctx, long hProv, long hKey, byte[] plaintext, OutputBuffer out) {
        return execute(ctx, "encrypt", () -> {
            handles.requireOwnedBy(hProv, hKey);
            requireOutput(out);
            if (plaintext == null) {
                throw new InvalidParameterException("plaintext cannot be null");
            }
            try (HandleLease<KeyObject> lease = handles.lease(hKey, HandleKind.KEY, KeyObject.class)) {
                KeyObject key = requireCipherKey(lease.payload(), KeyObject.PERMISSION_ENCRYPT);
                if (out.isSizeQuery()) {
                    out.fill(new byte[key.keySize() / Byte.SIZE]);
                    return out.length();
                }
                byte[] ciphertext = invoker.invoke("encrypt", channel -> channel.encrypt(key.keyId(), plaintext));
                out.fill(ciphertext);
                return out.length();
            }
        });
    }

    @Override
    public Outcome<Integer> decrypt(CallContext ctx, long hProv, long hKey, byte[] ciphertext, OutputBuffer out) {
        return execute(ctx, "decrypt", () -> {
            handles.requireOwnedBy(hProv, hKey);
            requireOutput(out);
            if (ciphertext == null) {
                throw new InvalidParameterException("ciphertext cannot be null");
            }
            try (HandleLease<KeyObject> lease = handles.lease(hKey, HandleKind.KEY, KeyObject.class)) {
                KeyObject key = requireCipherKey(lease.payload(), KeyObject.PERMISSION_DECRYPT);
                byte[] plaintext = invoker.invoke("decrypt", channel -> channel.decrypt(key.keyId(), ciphertext));
                out.fill(plaintext);
                return out.length();
            }
        });
    }

    // ========== Hash ==========

    @Override
    public Outcome<Long> createHash(CallContext ctx, long hProv, int algId, long hKey, int flags) {
        return execute(ctx, "createHash", () -> {
            handles.resolve(hProv, HandleKind.PROVIDER, ProviderContext.class);
            if (hKey != 0) {
                throw new InvalidParameterException(HostStatus.BAD_KEY, "Keyed hashes are not supported");
            }
            AlgorithmId algorithm = AlgorithmId.fromCode(algId)
                .filter(AlgorithmId::isHash)
                .orElseThrow(() -> new InvalidParameterException(HostStatus.BAD_ALGID,
                    "Unsupported hash algorithm 0x" + Integer.toHexString(algId)));
            requireNoFlags(flags);
            return handles.createChild(hProv, new HashObject(algorithm));
        });
    }

    @Override
    public Outcome<Void> hashData(CallContext ctx, long hProv, long hHash, byte[] data, int flags) {
        return execute(ctx, "hashData", () -> {
            handles.requireOwnedBy(hProv, hHash);
            requireNoFlags(flags);
            if (data == null) {
                throw new InvalidParameterException("data cannot be null");
            }
            try (HandleLease<HashObject> lease = handles.lease(hHash, HandleKind.HASH, HashObject.class)) {
                lease.payload().append(data, config.maxHashInputBytes());
            }
            return null;
        });
    }

    @Override
    public Outcome<Integer> getHashParam(CallContext ctx, long hProv, long hHash, int param, OutputBuffer out) {
        return execute(ctx, "getHashParam", () -> {
            handles.requireOwnedBy(hProv, hHash);
            requireOutput(out);
            try (HandleLease<HashObject> lease = handles.lease(hHash, HandleKind.HASH, HashObject.class)) {
                HashObject hash = lease.payload();
                HashParam parameter = HashParam.fromCode(param)
                    .orElseThrow(() -> new InvalidParameterException(HostStatus.BAD_TYPE, "Unknown hash parameter " + param));
                switch (parameter) {
                    case ALGID -> out.fill(HostEncoding.dword(hash.algorithm().code()));
                    case HASHSIZE -> out.fill(HostEncoding.dword(hash.algorithm().digestLength()));
                    case HASHVAL -> fillDigest(hash, out);
                }
                return out.length();
            }
        });
    }

    /**
     * HP_HASHVAL 응답.
     *
     * <p>다이제스트 길이는 알고리즘으로 정해지므로 size query와 용량 부족은 원격 호출 없이 처리하고,
     * 해시도 최종화하지 않습니다.</p>
     */
    private void fillDigest(HashObject hash, OutputBuffer out) {
        byte[] cached = hash.cachedDigest();
        if (cached != null) {
            out.fill(cached);
            return;
        }
        int digestLength = hash.algorithm().digestLength();
        if (out.isSizeQuery() || out.capacity() < digestLength) {
            out.fill(new byte[digestLength]);
            return;
        }
        byte[] input = hash.input();
        byte[] digest = invoker.invoke("digest", channel -> channel.digest(hash.algorithm(), input));
        hash.cacheDigest(digest);
        out.fill(digest);
    }

    @Override
    public Outcome<Void> setHashParam(CallContext ctx, long hProv, long hHash, int param, byte[] value, int flags) {
        return execute(ctx, "setHashParam", () -> {
            handles.requireOwnedBy(hProv, hHash);
            requireNoFlags(flags);
            try (HandleLease<HashObject> ignored = handles.lease(hHash, HandleKind.HASH, HashObject.class)) {
                HashParam parameter = HashParam.fromCode(param)
                    .orElseThrow(() -> new InvalidParameterException(HostStatus.BAD_TYPE, "Unknown hash parameter " + param));
                if (parameter == HashParam.HASHVAL) {
                    throw new InvalidParameterException(HostStatus.NOT_SUPPORTED,
                        "Setting HP_HASHVAL is not supported; the backend hashes the buffered input");
                }
                throw new InvalidParameterException(HostStatus.BAD_TYPE, "Hash parameter " + parameter + " is read-only");
            }
        });
    }

    @Override
    public Outcome<Long> duplicateHash(CallContext ctx, long hProv, long hHash) {
        return execute(ctx, "duplicateHash", () -> {
            handles.requireOwnedBy(hProv, hHash);
            try (HandleLease<HashObject> lease = handles.lease(hHash, HandleKind.HASH, HashObject.class)) {
                return handles.createChild(hProv, lease.payload().duplicate());
            }
        });
    }

    @Override
    public Outcome<Integer> signHash(CallContext ctx, long hProv, long hHash, int keySpec, int flags, OutputBuffer out) {
        return execute(ctx, "signHash", () -> {
            handles.requireOwnedBy(hProv, hHash);
            KeySpec spec = requireKeySpec(keySpec);
            requireNoFlags(flags);
            requireOutput(out);
            try (HandleLease<HashObject> lease = handles.lease(hHash, HandleKind.HASH, HashObject.class)) {
                HashObject hash = lease.payload();
                KeyObject key = handles.findChild(hProv, KeyObject.class, k -> k.keySpec() == spec && !k.isImported())
                    .orElseThrow(() -> new InvalidParameterException(HostStatus.NO_KEY,
                        "Provider has no " + spec + " key; call generateKey or getUserKey first"));
                byte[] signature = hash.cachedSignature(spec);
                if (signature == null) {
                    SignRequest request = new SignRequest(key.keyId(), hash.algorithm(), hash.input());
                    signature = invoker.invoke("sign", channel -> channel.sign(request));
                    hash.cacheSignature(spec, signature);
                }
                out.fill(signature);
                return out.length();
            }
        });
    }

    @Override
    public Outcome<Void> verifySignature(CallContext ctx, long hProv, long hHash, byte[] signature, long hPubKey,
                                         int flags) {
        return execute(ctx, "verifySignature", () -> {
            handles.requireOwnedBy(hProv, hHash);
            handles.requireOwnedBy(hProv, hPubKey);
            requireNoFlags(flags);
            if (signature == null || signature.length == 0) {
                throw new InvalidParameterException("signature cannot be null or empty");
            }
            try (HandleLease<HashObject> lease = handles.lease(hHash, HandleKind.HASH, HashObject.class)) {
                HashObject hash = lease.payload();
                KeyObject key = handles.resolve(hPubKey, HandleKind.KEY, KeyObject.class);
                VerifyRequest request = new VerifyRequest(key.keyId(), hash.algorithm(), hash.input(), signature);
                boolean valid = invoker.invoke("verify", channel -> channel.verify(request));
                hash.markFinalized();
                if (!valid) {
                    throw new BackendRejectedException(BackendErrorCode.INVALID_SIGNATURE, "Signature does not match");
                }
            }
            return null;
        });
    }

    @Override
    public Outcome<Void> destroyHash(CallContext ctx, long hProv, long hHash) {
        return execute(ctx, "destroyHash", () -> {
            handles.requireOwnedBy(hProv, hHash);
            try (HandleLease<HashObject> lease = handles.lease(hHash, HandleKind.HASH, HashObject.class)) {
                lease.retire();
            }
            return null;
        });
    }

    // ========== Diagnostics ==========

    @Override
    public GatewayStats stats() {
        return new GatewayStats(
            invoker.totalRequests(),
            invoker.successfulRequests(),
            invoker.failedRequests(),
            invoker.circuitBreakerRejects(),
            invoker.pool().stats(),
            invoker.circuitBreaker().snapshot(),
            handles.size()
        );
    }

    @Override
    public CircuitBreakerState circuitBreakerState() {
        return invoker.circuitBreaker().getState();
    }

    @Override
    public void resetCircuitBreaker() {
        invoker.circuitBreaker().reset();
        log.info("Circuit breaker reset to CLOSED");
    }

    /**
     * 호출 실행기와 커넥션 풀을 닫습니다. 핸들 테이블은 그대로 남습니다.
     */
    @Override
    public void close() {
        invoker.close();
        invoker.pool().close();
    }

    // ========== 내부 구현 ==========

    /**
     * 게이트웨이 경계.
     *
     * <p>CallContext를 비우고 동작을 실행합니다. GatewayException은 Fail로,
     * 그 밖의 RuntimeException은 INTERNAL_ERROR Fail로 바꿉니다.</p>
     */
    private <T> Outcome<T> execute(CallContext ctx, String operation, Supplier<T> action) {
        if (ctx == null) {
            throw new IllegalArgumentException("ctx cannot be null");
        }
        ctx.clear();
        try {
            return Ok.of(action.get());
        } catch (GatewayException e) {
            ErrorContext error = e.toErrorContext(operation);
            if (e.kind().isLocal()) {
                log.debug("{} failed: {}", operation, error.describe());
            } else {
                log.warn("{} failed: {}", operation, error.describe());
            }
            ctx.record(error);
            return Fail.of(error);
        } catch (RuntimeException e) {
            ErrorContext error = ErrorTranslator.toErrorContext(e, operation);
            log.error("{} failed unexpectedly", operation, e);
            ctx.record(error);
            return Fail.of(error);
        }
    }

    /**
     * 키 핸들 발급. 발급이 실패하면 방금 만든 백엔드 키를 삭제합니다.
     */
    private long issueKeyHandle(long hProv, KeyObject key) {
        try {
            return handles.createChild(hProv, key);
        } catch (RuntimeException e) {
            try {
                invoker.invoke("deleteKey", channel -> {
                    channel.deleteKey(key.keyId());
                    return null;
                });
            } catch (GatewayException cleanup) {
                log.warn("Could not delete orphaned backend key {}: {}", key.keyId(), cleanup.getMessage());
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    private static void requireSupportedKeySize(AlgorithmId algorithm, int keySize) {
        boolean supported;
        if (algorithm == AlgorithmId.ECDSA_P256) {
            supported = keySize == EC_P256_KEY_SIZE;
        } else {
            supported = keySize >= MIN_RSA_KEY_SIZE && keySize <= MAX_RSA_KEY_SIZE && keySize % Byte.SIZE == 0;
        }
        if (!supported) {
            throw new InvalidParameterException(HostStatus.BAD_FLAGS,
                "Unsupported key size " + keySize + " for " + algorithm);
        }
    }

    private static KeyObject requireCipherKey(KeyObject key, int permission) {
        if (key.algorithm() == AlgorithmId.ECDSA_P256) {
            throw new InvalidParameterException(HostStatus.BAD_KEY, "ECDSA keys cannot encrypt or decrypt");
        }
        if ((key.permissions() & permission) == 0) {
            throw new InvalidParameterException(HostStatus.PERM, "Key permissions do not allow this operation");
        }
        return key;
    }

    private static KeySpec requireKeySpec(int keySpec) {
        return KeySpec.fromCode(keySpec)
            .orElseThrow(() -> new InvalidParameterException("Unknown key spec " + keySpec));
    }

    private static KeyParam requireKeyParam(int param) {
        return KeyParam.fromCode(param)
            .orElseThrow(() -> new InvalidParameterException(HostStatus.BAD_TYPE, "Unknown key parameter " + param));
    }

    private static String requireContainer(ProviderContext provider) {
        if (provider.isVerifyContext()) {
            throw new InvalidParameterException(HostStatus.BAD_KEYSET, "Verify context has no key container");
        }
        return provider.container();
    }

    private static void requireNoFlags(int flags) {
        if (flags != 0) {
            throw new InvalidParameterException(HostStatus.BAD_FLAGS, "flags must be 0 (current: 0x"
                + Integer.toHexString(flags) + ")");
        }
    }

    private static void requireOutput(OutputBuffer out) {
        if (out == null) {
            throw new InvalidParameterException("output buffer cannot be null");
        }
    }
}
