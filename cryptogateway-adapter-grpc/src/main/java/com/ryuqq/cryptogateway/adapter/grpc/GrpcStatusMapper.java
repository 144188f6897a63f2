package com.ryuqq.cryptogateway.adapter.grpc;

import com.ryuqq.cryptogateway.adapter.grpc.proto.ErrorCode;
import com.ryuqq.cryptogateway.adapter.grpc.proto.ErrorDetails;
import com.ryuqq.cryptogateway.core.error.BackendErrorCode;
import com.ryuqq.cryptogateway.core.error.BackendRejectedException;
import com.ryuqq.cryptogateway.core.error.TransportException;
import com.ryuqq.cryptogateway.core.error.TransportStatus;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;

/**
 * gRPC 상태와 백엔드 오류 코드를 게이트웨이 예외로 변환.
 *
 * <p>전송 계층 실패(StatusRuntimeException)는 {@link TransportException}으로,
 * 응답 본문의 {@link ErrorDetails}는 {@link BackendRejectedException}으로 바뀝니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public final class GrpcStatusMapper {

    private GrpcStatusMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static TransportStatus toTransportStatus(Status.Code code) {
        if (code == null) {
            return TransportStatus.UNKNOWN;
        }
        return TransportStatus.fromValue(code.value());
    }

    public static TransportException toTransportException(StatusRuntimeException e) {
        Status status = e.getStatus();
        String description = status.getDescription() == null ? status.getCode().name() : status.getDescription();
        return new TransportException(toTransportStatus(status.getCode()), description, e);
    }

    public static BackendErrorCode toBackendErrorCode(ErrorCode code) {
        if (code == null || code == ErrorCode.UNRECOGNIZED) {
            return BackendErrorCode.UNSPECIFIED;
        }
        return BackendErrorCode.fromValue(code.getNumber());
    }

    public static ErrorCode toProto(BackendErrorCode code) {
        ErrorCode mapped = ErrorCode.forNumber(code.value());
        return mapped == null ? ErrorCode.ERROR_CODE_UNSPECIFIED : mapped;
    }

    public static BackendRejectedException toRejected(ErrorDetails error) {
        return new BackendRejectedException(toBackendErrorCode(error.getCode()), error.getMessage());
    }
}
