package com.ryuqq.cryptogateway.core.error;

/**
 * 세 오류 체계(호스트, 전송, 백엔드) 사이의 변환.
 *
 * <p>모든 메서드는 순수 함수이며 입력 enum의 모든 상수에 대해 정의됩니다(total).
 * 새 상수가 추가되면 switch 표현식이 컴파일 오류를 내므로 누락될 수 없습니다.</p>
 *
 * <p><strong>전송 → 호스트:</strong></p>
 * <pre>
 * OK                    → SUCCESS
 * INVALID_ARGUMENT      → INVALID_PARAMETER
 * DEADLINE_EXCEEDED     → TIMEOUT
 * NOT_FOUND             → NO_KEY
 * ALREADY_EXISTS        → EXISTS
 * PERMISSION_DENIED     → PERM
 * UNAUTHENTICATED       → PERM
 * RESOURCE_EXHAUSTED    → NO_MEMORY
 * FAILED_PRECONDITION   → BAD_KEY_STATE
 * OUT_OF_RANGE          → BAD_LEN
 * UNIMPLEMENTED         → NOT_SUPPORTED
 * UNAVAILABLE           → DEVICE_NOT_READY
 * 그 외                 → FAIL
 * </pre>
 *
 * <p><strong>백엔드 → 호스트:</strong></p>
 * <pre>
 * UNSPECIFIED, CRYPTO_OPERATION_FAILED, INTERNAL_ERROR → FAIL
 * INVALID_REQUEST        → INVALID_PARAMETER
 * KEY_NOT_FOUND          → NO_KEY
 * KEY_ALREADY_EXISTS     → EXISTS
 * UNSUPPORTED_ALGORITHM  → BAD_ALGID
 * INVALID_KEY_SIZE       → BAD_FLAGS
 * INVALID_SIGNATURE      → BAD_SIGNATURE
 * INVALID_DATA           → BAD_DATA
 * AUTHENTICATION_FAILED  → PERM
 * AUTHORIZATION_FAILED   → PERM
 * QUOTA_EXCEEDED         → NO_MEMORY
 * SERVICE_UNAVAILABLE    → DEVICE_NOT_READY
 * </pre>
 *
 * <p><strong>호스트 → 백엔드 (손실 변환):</strong> 호스트 코드가 백엔드 코드보다 많으므로
 * 역변환은 단사가 아닙니다. 대응하는 백엔드 사유가 없는 호스트 코드(핸들, 버퍼, 타임아웃 등)는
 * {@link BackendErrorCode#INTERNAL_ERROR}로, SUCCESS는 {@link BackendErrorCode#UNSPECIFIED}로 변환됩니다.
 * PERM은 AUTHORIZATION_FAILED로 돌아갑니다 (AUTHENTICATION_FAILED와 구분 불가).</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public final class ErrorTranslator {

    private ErrorTranslator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전송 상태를 호스트 코드로 변환.
     *
     * @param status 전송 상태
     * @return 호스트 코드
     */
    public static HostStatus transportToHost(TransportStatus status) {
        return switch (status) {
            case OK -> HostStatus.SUCCESS;
            case INVALID_ARGUMENT -> HostStatus.INVALID_PARAMETER;
            case DEADLINE_EXCEEDED -> HostStatus.TIMEOUT;
            case NOT_FOUND -> HostStatus.NO_KEY;
            case ALREADY_EXISTS -> HostStatus.EXISTS;
            case PERMISSION_DENIED, UNAUTHENTICATED -> HostStatus.PERM;
            case RESOURCE_EXHAUSTED -> HostStatus.NO_MEMORY;
            case FAILED_PRECONDITION -> HostStatus.BAD_KEY_STATE;
            case OUT_OF_RANGE -> HostStatus.BAD_LEN;
            case UNIMPLEMENTED -> HostStatus.NOT_SUPPORTED;
            case UNAVAILABLE -> HostStatus.DEVICE_NOT_READY;
            case CANCELLED, UNKNOWN, ABORTED, INTERNAL, DATA_LOSS -> HostStatus.FAIL;
        };
    }

    /**
     * 백엔드 도메인 오류를 호스트 코드로 변환.
     *
     * @param code 백엔드 오류 코드
     * @return 호스트 코드 (항상 실패 코드)
     */
    public static HostStatus backendToHost(BackendErrorCode code) {
        return switch (code) {
            case UNSPECIFIED, CRYPTO_OPERATION_FAILED, INTERNAL_ERROR -> HostStatus.FAIL;
            case INVALID_REQUEST -> HostStatus.INVALID_PARAMETER;
            case KEY_NOT_FOUND -> HostStatus.NO_KEY;
            case KEY_ALREADY_EXISTS -> HostStatus.EXISTS;
            case UNSUPPORTED_ALGORITHM -> HostStatus.BAD_ALGID;
            case INVALID_KEY_SIZE -> HostStatus.BAD_FLAGS;
            case INVALID_SIGNATURE -> HostStatus.BAD_SIGNATURE;
            case INVALID_DATA -> HostStatus.BAD_DATA;
            case AUTHENTICATION_FAILED, AUTHORIZATION_FAILED -> HostStatus.PERM;
            case QUOTA_EXCEEDED -> HostStatus.NO_MEMORY;
            case SERVICE_UNAVAILABLE -> HostStatus.DEVICE_NOT_READY;
        };
    }

    /**
     * 호스트 코드를 백엔드 도메인 오류로 변환 (손실 변환, 클래스 Javadoc 참고).
     *
     * @param status 호스트 코드
     * @return 백엔드 오류 코드
     */
    public static BackendErrorCode hostToBackend(HostStatus status) {
        return switch (status) {
            case SUCCESS -> BackendErrorCode.UNSPECIFIED;
            case INVALID_PARAMETER, BAD_FLAGS, BAD_TYPE -> BackendErrorCode.INVALID_REQUEST;
            case NO_KEY, BAD_KEYSET, NOT_FOUND -> BackendErrorCode.KEY_NOT_FOUND;
            case EXISTS -> BackendErrorCode.KEY_ALREADY_EXISTS;
            case BAD_ALGID, NOT_SUPPORTED -> BackendErrorCode.UNSUPPORTED_ALGORITHM;
            case BAD_SIGNATURE -> BackendErrorCode.INVALID_SIGNATURE;
            case BAD_DATA, BAD_LEN, BAD_HASH -> BackendErrorCode.INVALID_DATA;
            case BAD_KEY, BAD_KEY_STATE, BAD_HASH_STATE -> BackendErrorCode.CRYPTO_OPERATION_FAILED;
            case PERM -> BackendErrorCode.AUTHORIZATION_FAILED;
            case NO_MEMORY -> BackendErrorCode.QUOTA_EXCEEDED;
            case DEVICE_NOT_READY -> BackendErrorCode.SERVICE_UNAVAILABLE;
            case INVALID_HANDLE, BUSY, MORE_DATA, TIMEOUT, PROVIDER_DLL_FAIL, FAIL -> BackendErrorCode.INTERNAL_ERROR;
        };
    }

    /**
     * 오류 분류의 기본 호스트 코드.
     *
     * <p>세부 정보가 없는 경우에 사용됩니다. INVALID_PARAMETER, TRANSPORT_ERROR, BACKEND_REJECTED는
     * 실제 예외가 더 구체적인 코드를 가질 수 있습니다.</p>
     *
     * @param kind 오류 분류
     * @return 호스트 코드 (항상 실패 코드)
     */
    public static HostStatus kindToHost(ErrorKind kind) {
        return switch (kind) {
            case INVALID_HANDLE -> HostStatus.INVALID_HANDLE;
            case INVALID_PARAMETER -> HostStatus.INVALID_PARAMETER;
            case HANDLE_BUSY, POOL_EXHAUSTED -> HostStatus.BUSY;
            case INSUFFICIENT_BUFFER -> HostStatus.MORE_DATA;
            case CONNECT_ERROR, CIRCUIT_OPEN -> HostStatus.DEVICE_NOT_READY;
            case DEADLINE_EXCEEDED -> HostStatus.TIMEOUT;
            case TRANSPORT_ERROR, BACKEND_REJECTED, INTERNAL_ERROR -> HostStatus.FAIL;
        };
    }

    /**
     * 전송 실패 상태의 오류 분류.
     *
     * <p>OK는 실패가 아니므로 INTERNAL_ERROR로 취급합니다 (실패 경로에서 OK를 받는 것은 모순).</p>
     *
     * @param status 전송 상태
     * @return 오류 분류
     */
    public static ErrorKind transportToKind(TransportStatus status) {
        return switch (status) {
            case OK -> ErrorKind.INTERNAL_ERROR;
            case DEADLINE_EXCEEDED -> ErrorKind.DEADLINE_EXCEEDED;
            case CANCELLED, UNKNOWN, INVALID_ARGUMENT, NOT_FOUND, ALREADY_EXISTS, PERMISSION_DENIED,
                 RESOURCE_EXHAUSTED, FAILED_PRECONDITION, ABORTED, OUT_OF_RANGE, UNIMPLEMENTED,
                 INTERNAL, UNAVAILABLE, DATA_LOSS, UNAUTHENTICATED -> ErrorKind.TRANSPORT_ERROR;
        };
    }

    /**
     * 임의의 예외를 ErrorContext로 변환.
     *
     * <p>{@link GatewayException}은 자신의 분류와 코드를 그대로 사용하고, 그 외 예외는
     * INTERNAL_ERROR / FAIL로 변환됩니다.</p>
     *
     * @param throwable 발생한 예외
     * @param origin 동작 이름 (null 가능)
     * @return ErrorContext
     */
    public static ErrorContext toErrorContext(Throwable throwable, String origin) {
        if (throwable instanceof GatewayException ge) {
            return ge.toErrorContext(origin);
        }
        String message = throwable.getMessage();
        if (message == null || message.isBlank()) {
            message = throwable.getClass().getSimpleName();
        }
        return new ErrorContext(ErrorKind.INTERNAL_ERROR, HostStatus.FAIL, message,
            throwable.getClass().getName(), origin, null);
    }
}
