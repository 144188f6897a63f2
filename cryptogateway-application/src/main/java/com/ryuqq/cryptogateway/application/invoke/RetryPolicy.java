package com.ryuqq.cryptogateway.application.invoke;

import com.ryuqq.cryptogateway.core.error.ErrorKind;
import com.ryuqq.cryptogateway.core.error.GatewayException;

import java.util.EnumSet;
import java.util.Set;

/**
 * 원격 호출 재시도 정책 (불변 record).
 *
 * <p>기본값은 재시도하지 않음(maxAttempts=1)입니다. 백엔드 동작의 멱등성은 백엔드 계약이므로,
 * 재시도를 켜는 쪽이 안전한 오류 분류를 선택해야 합니다.</p>
 *
 * <p>CIRCUIT_OPEN은 retryOn에 포함되어도 재시도하지 않습니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 * @param maxAttempts 최초 시도를 포함한 최대 시도 횟수 (1 이상)
 * @param retryOn 재시도할 오류 분류
 * @param backoff 재시도 간격 계산기
 */
public record RetryPolicy(int maxAttempts, Set<ErrorKind> retryOn, BackoffCalculator backoff) {

    /**
     * 기본 설정 생성자 (재시도 없음).
     */
    public RetryPolicy() {
        this(1, EnumSet.noneOf(ErrorKind.class), new BackoffCalculator());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicy {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (retryOn == null) {
            throw new IllegalArgumentException("retryOn cannot be null");
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
        retryOn = retryOn.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(retryOn));
    }

    public static RetryPolicy none() {
        return new RetryPolicy();
    }

    /**
     * 주어진 분류에 대해 재시도하는 정책.
     *
     * @param maxAttempts 최대 시도 횟수
     * @param first 재시도할 분류
     * @param rest 추가 분류
     * @return RetryPolicy
     */
    public static RetryPolicy of(int maxAttempts, ErrorKind first, ErrorKind... rest) {
        return new RetryPolicy(maxAttempts, EnumSet.of(first, rest), new BackoffCalculator());
    }

    /**
     * 재시도 여부 판단.
     *
     * @param failure 실패 원인
     * @param attempt 방금 실패한 시도 번호 (1부터)
     * @return 재시도하면 true
     */
    public boolean shouldRetry(GatewayException failure, int attempt) {
        if (attempt >= maxAttempts) {
            return false;
        }
        ErrorKind kind = failure.kind();
        return kind != ErrorKind.CIRCUIT_OPEN && retryOn.contains(kind);
    }

    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, retryOn, backoff);
    }

    public RetryPolicy withBackoff(BackoffCalculator backoff) {
        return new RetryPolicy(maxAttempts, retryOn, backoff);
    }
}
