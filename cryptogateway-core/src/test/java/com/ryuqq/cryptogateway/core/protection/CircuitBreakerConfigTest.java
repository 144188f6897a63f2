package com.ryuqq.cryptogateway.core.protection;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CircuitBreakerConfig 테스트.
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
class CircuitBreakerConfigTest {

    @Test
    void 기본값() {
        CircuitBreakerConfig config = new CircuitBreakerConfig();

        assertEquals(5, config.failureThreshold());
        assertEquals(Duration.ofSeconds(60), config.timeout());
        assertEquals(3, config.halfOpenMaxCalls());
        assertEquals(0.6, config.successThreshold());
    }

    @Test
    void 잘못된_값은_거부() {
        CircuitBreakerConfig config = new CircuitBreakerConfig();

        assertThrows(IllegalArgumentException.class, () -> config.withFailureThreshold(0));
        assertThrows(IllegalArgumentException.class, () -> config.withTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> config.withTimeout(null));
        assertThrows(IllegalArgumentException.class, () -> config.withHalfOpenMaxCalls(0));
        assertThrows(IllegalArgumentException.class, () -> config.withSuccessThreshold(0.0));
        assertThrows(IllegalArgumentException.class, () -> config.withSuccessThreshold(1.5));
        assertThrows(IllegalArgumentException.class, () -> config.withSuccessThreshold(Double.NaN));
    }

    @Test
    void with_메서드는_해당_값만_변경() {
        CircuitBreakerConfig config = new CircuitBreakerConfig().withFailureThreshold(2);

        assertEquals(2, config.failureThreshold());
        assertEquals(3, config.halfOpenMaxCalls());
    }
}
