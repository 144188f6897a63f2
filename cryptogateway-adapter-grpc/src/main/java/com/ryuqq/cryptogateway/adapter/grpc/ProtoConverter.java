package com.ryuqq.cryptogateway.adapter.grpc;

import com.google.protobuf.ByteString;
import com.ryuqq.cryptogateway.core.contract.GenerateKeyRequest;
import com.ryuqq.cryptogateway.core.contract.ImportKeyRequest;
import com.ryuqq.cryptogateway.core.contract.KeyMetadata;
import com.ryuqq.cryptogateway.core.error.TransportException;
import com.ryuqq.cryptogateway.core.error.TransportStatus;
import com.ryuqq.cryptogateway.core.model.AlgorithmId;

import java.time.Instant;

/**
 * 계약 레코드와 proto 메시지 간 변환.
 *
 * <p>이름이 같은 proto 메시지는 정규화된 이름으로 참조합니다.</p>
 */
final class ProtoConverter {

    private ProtoConverter() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static com.ryuqq.cryptogateway.adapter.grpc.proto.GenerateKeyRequest toProto(GenerateKeyRequest request) {
        return com.ryuqq.cryptogateway.adapter.grpc.proto.GenerateKeyRequest.newBuilder()
            .setKeyId(request.keyId())
            .setAlgorithmId(request.algorithm().code())
            .setKeySize(request.keySize())
            .setExportable(request.exportable())
            .setOverwrite(request.overwrite())
            .build();
    }

    static com.ryuqq.cryptogateway.adapter.grpc.proto.ImportKeyRequest toProto(ImportKeyRequest request) {
        return com.ryuqq.cryptogateway.adapter.grpc.proto.ImportKeyRequest.newBuilder()
            .setKeyId(request.keyId())
            .setAlgorithmId(request.algorithm().code())
            .setKeySize(request.keySize())
            .setPublicKey(ByteString.copyFrom(request.publicKey()))
            .build();
    }

    static com.ryuqq.cryptogateway.adapter.grpc.proto.KeyMetadata toProto(KeyMetadata metadata) {
        return com.ryuqq.cryptogateway.adapter.grpc.proto.KeyMetadata.newBuilder()
            .setKeyId(metadata.keyId())
            .setAlgorithmId(metadata.algorithm().code())
            .setKeySize(metadata.keySize())
            .setPublicKey(ByteString.copyFrom(metadata.publicKey()))
            .setExportable(metadata.exportable())
            .setCreatedAtEpochMillis(metadata.createdAt().toEpochMilli())
            .build();
    }

    static KeyMetadata fromProto(com.ryuqq.cryptogateway.adapter.grpc.proto.KeyMetadata proto) {
        return new KeyMetadata(
            proto.getKeyId(),
            algorithm(proto.getAlgorithmId()),
            proto.getKeySize(),
            proto.getPublicKey().toByteArray(),
            proto.getExportable(),
            Instant.ofEpochMilli(proto.getCreatedAtEpochMillis())
        );
    }

    static GenerateKeyRequest fromProto(com.ryuqq.cryptogateway.adapter.grpc.proto.GenerateKeyRequest proto) {
        return new GenerateKeyRequest(proto.getKeyId(), algorithm(proto.getAlgorithmId()), proto.getKeySize(),
            proto.getExportable(), proto.getOverwrite());
    }

    static ImportKeyRequest fromProto(com.ryuqq.cryptogateway.adapter.grpc.proto.ImportKeyRequest proto) {
        return new ImportKeyRequest(proto.getKeyId(), algorithm(proto.getAlgorithmId()), proto.getKeySize(),
            proto.getPublicKey().toByteArray());
    }

    /**
     * 와이어의 ALG_ID 코드를 알고리즘으로 변환.
     *
     * @throws TransportException 알 수 없는 코드 (프로토콜 위반)
     */
    static AlgorithmId algorithm(int code) {
        return AlgorithmId.fromCode(code)
            .orElseThrow(() -> new TransportException(TransportStatus.INTERNAL,
                "Unknown algorithm id on the wire: 0x" + Integer.toHexString(code)));
    }
}
