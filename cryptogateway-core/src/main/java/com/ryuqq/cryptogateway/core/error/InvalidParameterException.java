package com.ryuqq.cryptogateway.core.error;

/**
 * 로컬 파라미터 검증 실패.
 *
 * <p>플래그, 알고리즘, 블롭 형식, 객체 상태 등 네트워크에 나가기 전에 걸러지는 오류입니다.
 * 호스트 코드는 원인에 따라 달라집니다 (예: BAD_ALGID, BAD_FLAGS, BAD_HASH_STATE).</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public class InvalidParameterException extends GatewayException {

    public InvalidParameterException(HostStatus hostStatus, String message) {
        super(ErrorKind.INVALID_PARAMETER, hostStatus, message, null, null);
    }

    public InvalidParameterException(String message) {
        this(HostStatus.INVALID_PARAMETER, message);
    }
}
