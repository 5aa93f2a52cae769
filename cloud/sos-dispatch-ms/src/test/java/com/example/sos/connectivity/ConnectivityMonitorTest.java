package com.example.sos.connectivity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.sos.capabilities.Subscription;
import com.example.sos.support.FakeConnectivity;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConnectivityMonitorTest {

    private final FakeConnectivity network = new FakeConnectivity(ConnectivityStatus.OFFLINE);
    private final ConnectivityMonitor monitor = new ConnectivityMonitor(network);

    @Test
    void reportsRestoredOnlyOnOfflineToOnline() {
        List<Boolean> restored = new ArrayList<>();
        monitor.subscribe((status, wasRestored) -> restored.add(wasRestored));
        monitor.start();

        network.goOnline();
        network.emit(new ConnectivityStatus(true, true, "cellular", "4g"));
        network.goOffline();
        network.goOnline();

        assertEquals(List.of(true, false, false, true), restored);
    }

    @Test
    void reachabilityFalseMeansOffline() {
        monitor.start();

        network.emit(new ConnectivityStatus(true, false, "wifi", null));

        assertFalse(monitor.isOnline());
        assertEquals(ConnectionQuality.EXCELLENT, ConnectionQuality.of(monitor.status()));
    }

    @Test
    void unknownReachabilityCountsAsOnline() {
        monitor.start();

        network.emit(new ConnectivityStatus(true, null, "cellular", null));

        assertTrue(monitor.isOnline());
    }

    @Test
    void qualityFollowsTypeAndGeneration() {
        monitor.start();

        assertEquals(ConnectionQuality.NONE, monitor.quality());
        network.emit(new ConnectivityStatus(true, true, "cellular", "3g"));
        assertEquals(ConnectionQuality.FAIR, monitor.quality());
        network.emit(new ConnectivityStatus(true, true, "cellular", "5g"));
        assertEquals(ConnectionQuality.EXCELLENT, monitor.quality());
        network.emit(new ConnectivityStatus(true, true, "cellular", "2g"));
        assertEquals(ConnectionQuality.POOR, monitor.quality());
    }

    @Test
    void assumesOnlineWithoutCapability() {
        network.available = false;

        monitor.start();

        assertTrue(monitor.isOnline());
        assertEquals(0, network.subscribers());
    }

    @Test
    void failingListenerDoesNotStarveOthers() {
        List<ConnectivityStatus> seen = new ArrayList<>();
        monitor.subscribe((s, r) -> {
            throw new IllegalStateException("boom");
        });
        monitor.subscribe((s, r) -> seen.add(s));
        monitor.start();

        network.goOnline();

        assertEquals(List.of(FakeConnectivity.WIFI), seen);
    }

    @Test
    void closedSubscriptionAndStopEndUpdates() {
        List<ConnectivityStatus> seen = new ArrayList<>();
        Subscription sub = monitor.subscribe((s, r) -> seen.add(s));
        monitor.start();
        sub.close();
        network.goOnline();
        assertTrue(seen.isEmpty());

        monitor.stop();
        assertEquals(0, network.subscribers());
    }
}
