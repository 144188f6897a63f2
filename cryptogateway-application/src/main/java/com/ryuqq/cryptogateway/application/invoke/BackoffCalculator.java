package com.ryuqq.cryptogateway.application.invoke;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 원격 호출 재시도 간격 계산기.
 *
 * <p>n번째 실패 뒤의 대기 시간은 {@code base * 2^(n-1)}에 그 값의
 * {@code jitterFactor} 비율 이내의 무작위 지연을 더한 값이며, 항상 {@code maxDelay}로 잘립니다.
 * 같은 순간 타임아웃을 맞은 호스트 스레드들이 동시에 재시도하지 않도록 jitter를 둡니다.</p>
 *
 * <pre>
 * base=100ms, jitterFactor=0.1
 *   1번째 실패 → 100~110ms
 *   2번째 실패 → 200~220ms
 *   3번째 실패 → 400~440ms
 * </pre>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public final class BackoffCalculator {

    static final long DEFAULT_BASE_DELAY_MS = 100;
    static final long DEFAULT_MAX_DELAY_MS = 2_000;
    static final double DEFAULT_JITTER_FACTOR = 0.1;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * 기본값(100ms, 최대 2s, jitter 10%)으로 생성.
     */
    public BackoffCalculator() {
        this(DEFAULT_BASE_DELAY_MS, DEFAULT_MAX_DELAY_MS, DEFAULT_JITTER_FACTOR);
    }

    /**
     * @param baseDelayMs 첫 재시도 전 대기 (밀리초, 양수)
     * @param maxDelayMs 대기 상한 (밀리초, baseDelayMs 이상)
     * @param jitterFactor 지수값 대비 jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 인자가 범위를 벗어난 경우
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        this(baseDelayMs, maxDelayMs, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive (current: " + baseDelayMs + ")");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * Duration 기반 팩토리.
     *
     * @param baseDelay 첫 재시도 전 대기
     * @param maxDelay 대기 상한
     * @param jitterFactor jitter 비율
     * @return 계산기
     */
    public static BackoffCalculator of(Duration baseDelay, Duration maxDelay, double jitterFactor) {
        if (baseDelay == null || maxDelay == null) {
            throw new IllegalArgumentException("baseDelay and maxDelay cannot be null");
        }
        return new BackoffCalculator(baseDelay.toMillis(), maxDelay.toMillis(), jitterFactor);
    }

    /**
     * 재시도 전 대기 시간.
     *
     * @param attemptCount 지금까지 실패한 시도 수 (1부터)
     * @return 대기 시간 (밀리초)
     * @throws IllegalArgumentException attemptCount가 양수가 아닌 경우
     */
    public long calculate(int attemptCount) {
        if (attemptCount <= 0) {
            throw new IllegalArgumentException("attemptCount must be positive (current: " + attemptCount + ")");
        }
        long delay = baseDelayMs;
        for (int i = 1; i < attemptCount && delay < maxDelayMs; i++) {
            delay = delay > maxDelayMs / 2 ? maxDelayMs : delay * 2;
        }
        long jitter = (long) (delay * jitterFactor * random.getAsDouble());
        return Math.min(delay + jitter, maxDelayMs);
    }

    public Duration delayFor(int attemptCount) {
        return Duration.ofMillis(calculate(attemptCount));
    }

    public long baseDelayMs() {
        return baseDelayMs;
    }

    public long maxDelayMs() {
        return maxDelayMs;
    }

    public double jitterFactor() {
        return jitterFactor;
    }
}
