package com.example.sos.delivery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.sos.error.ErrorCategory;
import com.example.sos.model.AlertEnvelope;
import com.example.sos.model.AlertKind;
import com.example.sos.model.ContactRole;
import com.example.sos.model.Recipient;
import com.example.sos.queue.OfflineQueue;
import com.example.sos.support.InMemoryByteStore;
import com.example.sos.support.TestRig;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class DeliveryOrchestratorTest {

    private static final List<Recipient> TARGETS = List.of(
        new Recipient(1L, "Mum", "+33600000001", ContactRole.PRIMARY),
        new Recipient(2L, "Dad", "+33600000002", ContactRole.SECONDARY)
    );

    private static AlertEnvelope envelope(String id) {
        return new AlertEnvelope(
            id,
            "Alex",
            "user-1",
            Instant.parse("2024-05-01T10:00:00Z"),
            "EMERGENCY ALERT",
            "Alex needs help!",
            null,
            null,
            null
        );
    }

    @Test
    void emptyTargetsReportNoContacts() {
        TestRig rig = new TestRig().started();

        DispatchOutcome outcome = rig.orchestrator.dispatch(AlertKind.SOS, List.of(), envelope("e1"));

        assertEquals(DispatchStatus.NO_CONTACTS, outcome.status());
        assertEquals(0, rig.queue.size());
        assertTrue(rig.cloud.sent.isEmpty());
        assertEquals(List.of(outcome), rig.signals.dispatched);
    }

    @Test
    void deliveredAlertIsSent() {
        TestRig rig = new TestRig().started();

        DispatchOutcome outcome = rig.orchestrator.dispatch(AlertKind.SOS, TARGETS, envelope("e1"));

        assertEquals(DispatchStatus.SENT, outcome.status());
        assertEquals(ChannelId.CLOUD, outcome.channel());
        assertEquals(2, outcome.accepted());
        assertEquals(0, rig.queue.size());
    }

    @Test
    void undeliverableAlertIsQueued() {
        TestRig rig = new TestRig().started();
        rig.cutOff();

        DispatchOutcome outcome = rig.orchestrator.dispatch(AlertKind.SOS, TARGETS, envelope("e1"));

        assertEquals(DispatchStatus.QUEUED, outcome.status());
        assertEquals(ErrorCategory.TRANSIENT_DELIVERY, outcome.errorCategory());
        assertNotNull(outcome.queuedAlertId());
        assertEquals(1, rig.queue.size());
        assertEquals("e1", rig.queue.snapshot().get(0).envelope.id());
        assertEquals(TARGETS, rig.queue.snapshot().get(0).recipients);
    }

    @Test
    void followUpCallGoesToTopPriorityContact() {
        TestRig rig = new TestRig(3, Duration.ZERO, true).started();

        rig.orchestrator.dispatch(AlertKind.SOS, TARGETS, envelope("e1"));

        assertEquals(List.of("+33600000001"), rig.phone.calls);
    }

    @Test
    void queuedAlertStillGetsFollowUpCall() {
        TestRig rig = new TestRig(3, Duration.ZERO, true).started();
        rig.cutOff();

        rig.orchestrator.dispatch(AlertKind.SOS, TARGETS, envelope("e1"));

        assertEquals(List.of("+33600000001"), rig.phone.calls);
    }

    @Test
    void noCallUnlessConfigured() {
        TestRig rig = new TestRig().started();

        rig.orchestrator.dispatch(AlertKind.SOS, TARGETS, envelope("e1"));

        assertTrue(rig.phone.calls.isEmpty());
    }

    @Test
    void failedEnqueueIsReportedNotThrown() {
        TestRig rig = new TestRig().started();
        rig.cutOff();
        InMemoryByteStore broken = new InMemoryByteStore() {
            @Override
            public void set(String key, byte[] value) {
                throw new IllegalStateException("disk full");
            }
        };
        OfflineQueue queue = new OfflineQueue(
            broken,
            rig.codec,
            rig.chain,
            rig.monitor,
            rig.signals,
            rig.scheduler,
            rig.clock,
            3,
            Duration.ZERO
        );
        DeliveryOrchestrator orchestrator = new DeliveryOrchestrator(
            rig.chain,
            queue,
            rig.signals,
            rig.phone,
            rig.scheduler,
            true
        );

        DispatchOutcome outcome = orchestrator.dispatch(AlertKind.SOS, TARGETS, envelope("e1"));

        assertEquals(DispatchStatus.FAILED, outcome.status());
        assertEquals(ErrorCategory.TERMINAL_DELIVERY, outcome.errorCategory());
        assertTrue(rig.phone.calls.isEmpty());
        assertEquals(outcome, rig.signals.dispatched.get(0));
    }
}
