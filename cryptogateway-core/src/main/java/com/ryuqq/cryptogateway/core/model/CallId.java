package com.ryuqq.cryptogateway.core.model;

import java.util.UUID;

/**
 * 원격 호출 하나의 식별자.
 *
 * <p>서킷 브레이커 통계와 로그 상관관계에 사용됩니다. 게이트웨이는 원격 호출마다
 * "동작이름-UUID" 형식의 CallId를 발급합니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public final class CallId {

    private final String value;

    private CallId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CallId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("CallId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("CallId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * CallId 생성.
     *
     * @param value CallId 값
     * @return CallId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static CallId of(String value) {
        return new CallId(value);
    }

    /**
     * 동작 이름으로 새 CallId 발급.
     *
     * @param operation 동작 이름 (예: signHash)
     * @return 고유한 CallId
     */
    public static CallId next(String operation) {
        return new CallId(operation + "-" + UUID.randomUUID());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CallId callId = (CallId) o;
        return value.equals(callId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "CallId{" + value + '}';
    }
}
