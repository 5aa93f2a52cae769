package com.example.sos.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.sos.connectivity.ConnectivityMonitor;
import com.example.sos.model.AlertEnvelope;
import com.example.sos.model.AlertKind;
import com.example.sos.model.ContactRole;
import com.example.sos.model.Recipient;
import com.example.sos.queue.OfflineQueue;
import com.example.sos.scheduling.ScheduledTask;
import com.example.sos.scheduling.TaskScheduler;
import com.example.sos.support.TestRig;
import io.quarkus.runtime.StartupEvent;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class SosLifecycleTest {

    private static final Recipient MUM = new Recipient(1L, "Mum", "+33600000001", ContactRole.PRIMARY);

    /** Holds background work until the test releases it. */
    private static final class HeldScheduler implements TaskScheduler {

        private final TaskScheduler timers;
        final List<Runnable> held = new ArrayList<>();

        HeldScheduler(TaskScheduler timers) {
            this.timers = timers;
        }

        @Override
        public ScheduledTask schedule(Duration delay, Runnable task) {
            return timers.schedule(delay, task);
        }

        @Override
        public void execute(Runnable task) {
            held.add(task);
        }

        void runHeld() {
            List<Runnable> batch = new ArrayList<>(held);
            held.clear();
            batch.forEach(Runnable::run);
        }
    }

    @Test
    void leftoverAlertsAreReplayedOffTheStartupThread() {
        TestRig previousRun = new TestRig().started();
        previousRun.cutOff();
        previousRun.queue.enqueue(AlertKind.SOS, envelope(), List.of(MUM));
        previousRun.queue.stop();
        previousRun.network.goOnline();

        HeldScheduler scheduler = new HeldScheduler(previousRun.scheduler);
        ConnectivityMonitor monitor = new ConnectivityMonitor(previousRun.network);
        OfflineQueue queue = new OfflineQueue(
            previousRun.store,
            previousRun.codec,
            previousRun.chain,
            monitor,
            previousRun.signals,
            scheduler,
            previousRun.clock,
            3,
            Duration.ZERO
        );
        SosLifecycle lifecycle = new SosLifecycle(monitor, queue, scheduler);

        lifecycle.onStart(new StartupEvent());

        assertEquals(1, queue.size());
        assertTrue(previousRun.cloud.sent.isEmpty());
        assertEquals(1, scheduler.held.size());

        scheduler.runHeld();

        assertEquals(0, queue.size());
        assertEquals(1, previousRun.signals.replayed.size());
    }

    private static AlertEnvelope envelope() {
        return new AlertEnvelope(
            "e1",
            "Alex",
            "user-1",
            Instant.parse("2024-05-01T10:00:00Z"),
            "EMERGENCY ALERT",
            "Alex needs help!",
            TestRig.HOME,
            "voice-7",
            "https://maps.example.com/?q=48.856600,2.352200"
        );
    }
}
