package com.ryuqq.cryptogateway.adapter.grpc;

import com.google.protobuf.ByteString;
import com.ryuqq.cryptogateway.adapter.grpc.proto.ComputeDigestRequest;
import com.ryuqq.cryptogateway.adapter.grpc.proto.ComputeDigestResponse;
import com.ryuqq.cryptogateway.adapter.grpc.proto.CryptoBackendServiceGrpc;
import com.ryuqq.cryptogateway.adapter.grpc.proto.DecryptDataRequest;
import com.ryuqq.cryptogateway.adapter.grpc.proto.DecryptDataResponse;
import com.ryuqq.cryptogateway.adapter.grpc.proto.DeleteKeyRequest;
import com.ryuqq.cryptogateway.adapter.grpc.proto.DeleteKeyResponse;
import com.ryuqq.cryptogateway.adapter.grpc.proto.EncryptDataRequest;
import com.ryuqq.cryptogateway.adapter.grpc.proto.EncryptDataResponse;
import com.ryuqq.cryptogateway.adapter.grpc.proto.GenerateRandomRequest;
import com.ryuqq.cryptogateway.adapter.grpc.proto.GenerateRandomResponse;
import com.ryuqq.cryptogateway.adapter.grpc.proto.GetKeyRequest;
import com.ryuqq.cryptogateway.adapter.grpc.proto.KeyResponse;
import com.ryuqq.cryptogateway.adapter.grpc.proto.ListKeysRequest;
import com.ryuqq.cryptogateway.adapter.grpc.proto.ListKeysResponse;
import com.ryuqq.cryptogateway.adapter.grpc.proto.SignDataRequest;
import com.ryuqq.cryptogateway.adapter.grpc.proto.SignDataResponse;
import com.ryuqq.cryptogateway.adapter.grpc.proto.VerifySignatureRequest;
import com.ryuqq.cryptogateway.adapter.grpc.proto.VerifySignatureResponse;
import com.ryuqq.cryptogateway.core.contract.GenerateKeyRequest;
import com.ryuqq.cryptogateway.core.contract.ImportKeyRequest;
import com.ryuqq.cryptogateway.core.contract.KeyMetadata;
import com.ryuqq.cryptogateway.core.contract.SignRequest;
import com.ryuqq.cryptogateway.core.contract.VerifyRequest;
import com.ryuqq.cryptogateway.core.error.TransportException;
import com.ryuqq.cryptogateway.core.error.TransportStatus;
import com.ryuqq.cryptogateway.core.model.AlgorithmId;
import com.ryuqq.cryptogateway.core.spi.BackendChannel;
import io.grpc.ConnectivityState;
import io.grpc.ManagedChannel;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * gRPC 채널 위의 {@link BackendChannel}.
 *
 * <p>모든 RPC는 blocking stub에 호출 단위 deadline을 걸어 실행합니다. 전송 실패는
 * {@link TransportException}, 응답 본문의 오류는
 * {@link com.ryuqq.cryptogateway.core.error.BackendRejectedException}으로 변환됩니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public class GrpcBackendChannel implements BackendChannel {

    private static final Logger log = LoggerFactory.getLogger(GrpcBackendChannel.class);

    private static final long SHUTDOWN_TIMEOUT_MILLIS = 1000;

    private final ManagedChannel channel;
    private final CryptoBackendServiceGrpc.CryptoBackendServiceBlockingStub stub;
    private final Duration callDeadline;

    public GrpcBackendChannel(ManagedChannel channel, Duration callDeadline) {
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        if (callDeadline == null || callDeadline.isNegative() || callDeadline.isZero()) {
            throw new IllegalArgumentException("callDeadline must be positive (current: " + callDeadline + ")");
        }
        this.channel = channel;
        this.stub = CryptoBackendServiceGrpc.newBlockingStub(channel);
        this.callDeadline = callDeadline;
    }

    // ========== 키 관리 ==========

    @Override
    public KeyMetadata generateKey(GenerateKeyRequest request) {
        KeyResponse response = call(s -> s.generateKey(ProtoConverter.toProto(request)));
        return unwrap(response);
    }

    @Override
    public KeyMetadata getKey(String keyId) {
        KeyResponse response = call(s -> s.getKey(GetKeyRequest.newBuilder().setKeyId(keyId).build()));
        return unwrap(response);
    }

    @Override
    public List<KeyMetadata> listKeys(String keyIdPrefix) {
        ListKeysResponse response = call(s -> s.listKeys(
            ListKeysRequest.newBuilder().setKeyIdPrefix(keyIdPrefix == null ? "" : keyIdPrefix).build()));
        if (response.hasError()) {
            throw GrpcStatusMapper.toRejected(response.getError());
        }
        return response.getKeysList().stream()
            .map(ProtoConverter::fromProto)
            .collect(Collectors.toList());
    }

    @Override
    public void deleteKey(String keyId) {
        DeleteKeyResponse response = call(s -> s.deleteKey(DeleteKeyRequest.newBuilder().setKeyId(keyId).build()));
        if (response.hasError()) {
            throw GrpcStatusMapper.toRejected(response.getError());
        }
    }

    @Override
    public KeyMetadata importKey(ImportKeyRequest request) {
        KeyResponse response = call(s -> s.importKey(ProtoConverter.toProto(request)));
        return unwrap(response);
    }

    // ========== 서명 / 암호화 ==========

    @Override
    public byte[] sign(SignRequest request) {
        SignDataResponse response = call(s -> s.signData(SignDataRequest.newBuilder()
            .setKeyId(request.keyId())
            .setHashAlgorithmId(request.hashAlgorithm().code())
            .setData(ByteString.copyFrom(request.data()))
            .build()));
        if (response.getResultCase() == SignDataResponse.ResultCase.ERROR) {
            throw GrpcStatusMapper.toRejected(response.getError());
        }
        return response.getSignature().toByteArray();
    }

    @Override
    public boolean verify(VerifyRequest request) {
        VerifySignatureResponse response = call(s -> s.verifySignature(VerifySignatureRequest.newBuilder()
            .setKeyId(request.keyId())
            .setHashAlgorithmId(request.hashAlgorithm().code())
            .setData(ByteString.copyFrom(request.data()))
            .setSignature(ByteString.copyFrom(request.signature()))
            .build()));
        if (response.getResultCase() == VerifySignatureResponse.ResultCase.ERROR) {
            throw GrpcStatusMapper.toRejected(response.getError());
        }
        return response.getValid();
    }

    @Override
    public byte[] encrypt(String keyId, byte[] plaintext) {
        EncryptDataResponse response = call(s -> s.encryptData(EncryptDataRequest.newBuilder()
            .setKeyId(keyId)
            .setPlaintext(ByteString.copyFrom(plaintext))
            .build()));
        if (response.getResultCase() == EncryptDataResponse.ResultCase.ERROR) {
            throw GrpcStatusMapper.toRejected(response.getError());
        }
        return response.getCiphertext().toByteArray();
    }

    @Override
    public byte[] decrypt(String keyId, byte[] ciphertext) {
        DecryptDataResponse response = call(s -> s.decryptData(DecryptDataRequest.newBuilder()
            .setKeyId(keyId)
            .setCiphertext(ByteString.copyFrom(ciphertext))
            .build()));
        if (response.getResultCase() == DecryptDataResponse.ResultCase.ERROR) {
            throw GrpcStatusMapper.toRejected(response.getError());
        }
        return response.getPlaintext().toByteArray();
    }

    @Override
    public byte[] digest(AlgorithmId hashAlgorithm, byte[] data) {
        ComputeDigestResponse response = call(s -> s.computeDigest(ComputeDigestRequest.newBuilder()
            .setHashAlgorithmId(hashAlgorithm.code())
            .setData(ByteString.copyFrom(data))
            .build()));
        if (response.getResultCase() == ComputeDigestResponse.ResultCase.ERROR) {
            throw GrpcStatusMapper.toRejected(response.getError());
        }
        return response.getDigest().toByteArray();
    }

    @Override
    public byte[] generateRandom(int length) {
        GenerateRandomResponse response = call(s -> s.generateRandom(
            GenerateRandomRequest.newBuilder().setLength(length).build()));
        if (response.getResultCase() == GenerateRandomResponse.ResultCase.ERROR) {
            throw GrpcStatusMapper.toRejected(response.getError());
        }
        return response.getRandomBytes().toByteArray();
    }

    // ========== 수명 ==========

    @Override
    public boolean isHealthy() {
        ConnectivityState state = channel.getState(false);
        return !channel.isShutdown()
            && state != ConnectivityState.SHUTDOWN
            && state != ConnectivityState.TRANSIENT_FAILURE;
    }

    @Override
    public void close() {
        channel.shutdown();
        try {
            if (!channel.awaitTermination(SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
                channel.shutdownNow();
            }
        } catch (InterruptedException e) {
            channel.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ========== 내부 구현 ==========

    private <R> R call(Function<CryptoBackendServiceGrpc.CryptoBackendServiceBlockingStub, R> rpc) {
        try {
            return rpc.apply(stub.withDeadlineAfter(callDeadline.toMillis(), TimeUnit.MILLISECONDS));
        } catch (StatusRuntimeException e) {
            TransportException mapped = GrpcStatusMapper.toTransportException(e);
            log.debug("RPC failed on {}: {} {}", channel.authority(), mapped.status(), mapped.getMessage());
            throw mapped;
        }
    }

    private static KeyMetadata unwrap(KeyResponse response) {
        switch (response.getResultCase()) {
            case KEY:
                return ProtoConverter.fromProto(response.getKey());
            case ERROR:
                throw GrpcStatusMapper.toRejected(response.getError());
            default:
                throw new TransportException(TransportStatus.INTERNAL, "KeyResponse carried neither key nor error");
        }
    }
}
