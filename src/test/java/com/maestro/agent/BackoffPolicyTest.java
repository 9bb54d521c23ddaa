package com.maestro.agent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BackoffPolicyTest {

    @Test
    @DisplayName("delay grows exponentially and is capped")
    void exponentialWithCap() {
        var policy = new BackoffPolicy(Duration.ofMillis(100), Duration.ofMillis(500), 2.0, false);

        assertEquals(Duration.ofMillis(100), policy.delayFor(1));
        assertEquals(Duration.ofMillis(200), policy.delayFor(2));
        assertEquals(Duration.ofMillis(400), policy.delayFor(3));
        assertEquals(Duration.ofMillis(500), policy.delayFor(4));
        assertEquals(Duration.ofMillis(500), policy.delayFor(10));
    }

    @RepeatedTest(20)
    @DisplayName("jitter stays between a tenth of the initial delay and the computed delay")
    void jitterBounds() {
        var policy = new BackoffPolicy(Duration.ofMillis(100), Duration.ofSeconds(5), 2.0, true);

        long delay = policy.delayFor(3).toMillis();

        assertTrue(delay >= 10 && delay <= 400, "delay " + delay);
    }

    @Test
    @DisplayName("built from dispatch properties")
    void fromProperties() {
        var properties = new DispatchProperties();
        properties.setInitialBackoff(Duration.ofMillis(50));
        properties.setMaxBackoff(Duration.ofMillis(60));
        properties.setJitter(false);

        var policy = BackoffPolicy.from(properties);

        assertEquals(Duration.ofMillis(50), policy.delayFor(1));
        assertEquals(Duration.ofMillis(60), policy.delayFor(2));
    }
}
