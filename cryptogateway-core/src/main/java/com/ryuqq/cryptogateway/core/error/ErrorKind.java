package com.ryuqq.cryptogateway.core.error;

/**
 * 게이트웨이 오류 분류.
 *
 * <p>호스트 코드나 전송 코드와 무관한 "종류"입니다. 로컬에서 감지되는 오류
 * (핸들/파라미터 검증)와 원격 호출 경로의 오류(풀, 연결, 타임아웃, 서킷, 백엔드 거부)를 구분합니다.</p>
 *
 * <p><strong>로컬 오류:</strong> INVALID_HANDLE, INVALID_PARAMETER, HANDLE_BUSY, INSUFFICIENT_BUFFER
 * → 네트워크 계층에 도달하지 않습니다.</p>
 *
 * <p><strong>원격 경로 오류:</strong> POOL_EXHAUSTED, CONNECT_ERROR, DEADLINE_EXCEEDED, CIRCUIT_OPEN,
 * TRANSPORT_ERROR, BACKEND_REJECTED → 반드시 {@link ErrorTranslator}를 거쳐 호스트 코드로 변환됩니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /** 알 수 없거나 폐기된 핸들, 또는 기대와 다른 종류의 핸들. */
    INVALID_HANDLE,

    /** 파라미터/플래그/알고리즘/상태 검증 실패. */
    INVALID_PARAMETER,

    /** 동일 핸들에 대한 동시 작업. */
    HANDLE_BUSY,

    /** 호출자가 제공한 출력 버퍼가 작음. */
    INSUFFICIENT_BUFFER,

    /** connectTimeout 내에 풀에서 연결을 얻지 못함. */
    POOL_EXHAUSTED,

    /** 채널 생성 실패 (DNS, TLS 핸드셰이크, 연결 거부). */
    CONNECT_ERROR,

    /** requestTimeout 초과. */
    DEADLINE_EXCEEDED,

    /** 서킷 브레이커가 호출을 차단함 (네트워크 호출 시도 없음). */
    CIRCUIT_OPEN,

    /** 타임아웃 이외의 전송 계층 실패. */
    TRANSPORT_ERROR,

    /** 백엔드가 요청을 거부함 (도메인 사유 포함). */
    BACKEND_REJECTED,

    /** 변환할 수 없는 조건. */
    INTERNAL_ERROR;

    /**
     * 로컬에서 감지되는 오류인지 확인.
     *
     * @return 네트워크 계층에 도달하지 않는 오류이면 true
     */
    public boolean isLocal() {
        return this == INVALID_HANDLE
            || this == INVALID_PARAMETER
            || this == HANDLE_BUSY
            || this == INSUFFICIENT_BUFFER;
    }
}
