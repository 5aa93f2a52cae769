package com.example.sos.location;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.sos.support.FakeLocation;
import com.example.sos.support.TestRig;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class LocationAcquirerTest {

    private final FakeLocation capability = new FakeLocation(TestRig.HOME);
    private final LocationAcquirer acquirer = new LocationAcquirer(capability, Duration.ofMillis(100));

    @Test
    void returnsTheFix() {
        assertEquals(TestRig.HOME, acquirer.acquire().orElseThrow());
    }

    @Test
    void emptyWhenCapabilityUnavailable() {
        capability.available = false;

        assertTrue(acquirer.acquire().isEmpty());
        assertEquals(0, capability.requests.get());
    }

    @Test
    void emptyWhenPermissionDenied() {
        capability.mode = FakeLocation.Mode.DENIED;

        assertTrue(acquirer.acquire().isEmpty());
    }

    @Test
    void emptyWhenNoFixProduced() {
        capability.mode = FakeLocation.Mode.NO_FIX;

        assertTrue(acquirer.acquire().isEmpty());
    }

    @Test
    void boundedByMaxWait() {
        capability.mode = FakeLocation.Mode.HANG;

        long start = System.nanoTime();
        assertTrue(acquirer.acquire(Duration.ofMillis(50)).isEmpty());
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() < 2_000);
    }
}
