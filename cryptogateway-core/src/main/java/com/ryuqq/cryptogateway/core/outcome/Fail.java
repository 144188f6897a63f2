package com.ryuqq.cryptogateway.core.outcome;

import com.ryuqq.cryptogateway.core.error.ErrorContext;

/**
 * 실패 결과.
 *
 * <p>실패한 동작은 부분적으로 성공하지 않습니다. 새 핸들이 발급되지 않았고,
 * 기존 핸들 상태도 바뀌지 않았음을 의미합니다.</p>
 *
 * @param error 오류 정보
 * @param <T> 성공했다면 반환되었을 값 타입
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public record Fail<T>(ErrorContext error) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException error가 null인 경우
     */
    public Fail {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }

    public static <T> Fail<T> of(ErrorContext error) {
        return new Fail<>(error);
    }
}
