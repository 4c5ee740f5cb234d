package com.questrail.fathom.protocol.internal.exec;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ReconnectionPolicyTest
 * -----------------------------------------------------------------------------
 * First retry is immediate, then the delay doubles from the base up to the cap.
 */
class ReconnectionPolicyTest {

    private final ReconnectionPolicy policy = ReconnectionPolicy.defaults();

    @Test
    void firstAttemptIsImmediate() {
        assertEquals(Duration.ZERO, policy.nextDelay(0));
    }

    @Test
    void delayDoublesFromBase() {
        assertEquals(Duration.ofMillis(100), policy.nextDelay(1));
        assertEquals(Duration.ofMillis(200), policy.nextDelay(2));
        assertEquals(Duration.ofMillis(400), policy.nextDelay(3));
        assertEquals(Duration.ofMillis(25_600), policy.nextDelay(9));
    }

    @Test
    void delayIsCapped() {
        assertEquals(Duration.ofSeconds(30), policy.nextDelay(10));
        assertEquals(Duration.ofSeconds(30), policy.nextDelay(63));
        assertEquals(Duration.ofSeconds(30), policy.nextDelay(Integer.MAX_VALUE));
    }

    @Test
    void rejectsBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> policy.nextDelay(-1));
        assertThrows(IllegalArgumentException.class,
                () -> new ReconnectionPolicy(Duration.ZERO, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new ReconnectionPolicy(Duration.ofSeconds(2), Duration.ofSeconds(1)));
    }

    @Test
    void backoffAdvancesAndResets() {
        ReconnectBackoff backoff = new ReconnectBackoff(
                new ReconnectionPolicy(Duration.ofMillis(50), Duration.ofMillis(150)));

        assertEquals(Duration.ZERO, backoff.next());
        assertEquals(Duration.ofMillis(50), backoff.next());
        assertEquals(Duration.ofMillis(100), backoff.next());
        assertEquals(Duration.ofMillis(150), backoff.next());
        assertEquals(Duration.ofMillis(150), backoff.next());
        assertEquals(5, backoff.attempt());

        backoff.reset();

        assertEquals(0, backoff.attempt());
        assertEquals(Duration.ZERO, backoff.next());
    }
}
