package com.ryuqq.cryptogateway.testkit.fault;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 테스트가 직접 움직이는 시계.
 *
 * <p>브레이커 timeout과 풀의 idleTimeout을 실제로 기다리지 않고 검증할 때 사용합니다.
 * 여러 스레드에서 읽어도 안전합니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public final class ManualClock extends Clock {

    private final ZoneId zone;
    private volatile Instant now;

    public ManualClock() {
        this(Instant.parse("2026-01-01T00:00:00Z"));
    }

    public ManualClock(Instant start) {
        this(start, ZoneOffset.UTC);
    }

    private ManualClock(Instant start, ZoneId zone) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.now = start;
        this.zone = zone;
    }

    /**
     * 시계를 앞으로 이동.
     *
     * @param duration 이동량 (음수 불가)
     */
    public synchronized void advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration must be zero or positive (current: " + duration + ")");
        }
        now = now.plus(duration);
    }

    public void set(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        now = instant;
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new ManualClock(now, zone);
    }

    @Override
    public Instant instant() {
        return now;
    }
}
