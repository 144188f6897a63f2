package com.ryuqq.cryptogateway.adapter.inmemory;

import com.ryuqq.cryptogateway.core.contract.GenerateKeyRequest;
import com.ryuqq.cryptogateway.core.contract.ImportKeyRequest;
import com.ryuqq.cryptogateway.core.contract.KeyMetadata;
import com.ryuqq.cryptogateway.core.contract.SignRequest;
import com.ryuqq.cryptogateway.core.contract.VerifyRequest;
import com.ryuqq.cryptogateway.core.error.TransportException;
import com.ryuqq.cryptogateway.core.error.TransportStatus;
import com.ryuqq.cryptogateway.core.model.AlgorithmId;
import com.ryuqq.cryptogateway.core.spi.BackendChannel;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link InMemoryCryptoBackend}에 붙는 채널.
 *
 * <p>닫힌 채널이나 비가용 백엔드에 대한 호출은 UNAVAILABLE 전송 오류로 실패합니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public class InMemoryBackendChannel implements BackendChannel {

    private final InMemoryCryptoBackend backend;
    private final long sessionId;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    InMemoryBackendChannel(InMemoryCryptoBackend backend, long sessionId) {
        this.backend = backend;
        this.sessionId = sessionId;
    }

    public long sessionId() {
        return sessionId;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public KeyMetadata generateKey(GenerateKeyRequest request) {
        ensureOpen();
        return backend.generateKey(request);
    }

    @Override
    public KeyMetadata getKey(String keyId) {
        ensureOpen();
        return backend.getKey(keyId);
    }

    @Override
    public List<KeyMetadata> listKeys(String keyIdPrefix) {
        ensureOpen();
        return backend.listKeys(keyIdPrefix);
    }

    @Override
    public void deleteKey(String keyId) {
        ensureOpen();
        backend.deleteKey(keyId);
    }

    @Override
    public KeyMetadata importKey(ImportKeyRequest request) {
        ensureOpen();
        return backend.importKey(request);
    }

    @Override
    public byte[] sign(SignRequest request) {
        ensureOpen();
        return backend.sign(request);
    }

    @Override
    public boolean verify(VerifyRequest request) {
        ensureOpen();
        return backend.verify(request);
    }

    @Override
    public byte[] encrypt(String keyId, byte[] plaintext) {
        ensureOpen();
        return backend.encrypt(keyId, plaintext);
    }

    @Override
    public byte[] decrypt(String keyId, byte[] ciphertext) {
        ensureOpen();
        return backend.decrypt(keyId, ciphertext);
    }

    @Override
    public byte[] digest(AlgorithmId hashAlgorithm, byte[] data) {
        ensureOpen();
        return backend.digest(hashAlgorithm, data);
    }

    @Override
    public byte[] generateRandom(int length) {
        ensureOpen();
        return backend.generateRandom(length);
    }

    @Override
    public boolean isHealthy() {
        return !closed.get() && backend.isAvailable();
    }

    @Override
    public void close() {
        closed.set(true);
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new TransportException(TransportStatus.UNAVAILABLE, "Channel #" + sessionId + " is closed");
        }
        if (!backend.isAvailable()) {
            throw new TransportException(TransportStatus.UNAVAILABLE, "In-memory backend is unavailable");
        }
    }

    @Override
    public String toString() {
        return "InMemoryBackendChannel{sessionId=" + sessionId + ", closed=" + closed.get() + '}';
    }
}
