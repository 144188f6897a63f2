package com.ryuqq.cryptogateway.core.outcome;

/**
 * 성공 결과.
 *
 * @param value 결과 값 (값이 없는 동작은 {@link Void}와 null)
 * @param <T> 결과 값 타입
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public record Ok<T>(T value) implements Outcome<T> {

    public static <T> Ok<T> of(T value) {
        return new Ok<>(value);
    }

    /**
     * 값 없는 성공 결과.
     *
     * @return Ok 인스턴스
     */
    public static Ok<Void> empty() {
        return new Ok<>(null);
    }
}
