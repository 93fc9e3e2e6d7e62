package com.questrail.gateway.session;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ExchangeFailureTrackerTest
 * -----------------------------------------------------------------------------
 * Consecutive-failure counting per session.
 */
class ExchangeFailureTrackerTest {

    @Test
    void thresholdIsReportedOnTheNthConsecutiveFailure() {
        ExchangeFailureTracker tracker = new ExchangeFailureTracker(3);

        assertFalse(tracker.recordFailure("a"));
        assertFalse(tracker.recordFailure("a"));
        assertTrue(tracker.recordFailure("a"));
        assertEquals(3, tracker.failuresFor("a"));
    }

    @Test
    void successResetsTheCount() {
        ExchangeFailureTracker tracker = new ExchangeFailureTracker(2);

        tracker.recordFailure("a");
        tracker.reset("a");

        assertEquals(0, tracker.failuresFor("a"));
        assertFalse(tracker.recordFailure("a"));
    }

    @Test
    void sessionsAreCountedIndependently() {
        ExchangeFailureTracker tracker = new ExchangeFailureTracker(2);

        tracker.recordFailure("a");
        assertFalse(tracker.recordFailure("b"));
        assertTrue(tracker.recordFailure("a"));
        assertEquals(1, tracker.failuresFor("b"));
    }

    @Test
    void thresholdOfOneTripsImmediately() {
        assertTrue(new ExchangeFailureTracker(1).recordFailure("a"));
        assertThrows(IllegalArgumentException.class, () -> new ExchangeFailureTracker(0));
    }
}
