package com.example.sos.delivery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.sos.capabilities.SmsCapability;
import com.example.sos.model.AlertEnvelope;
import com.example.sos.model.ContactRole;
import com.example.sos.model.Recipient;
import com.example.sos.support.FakeCloudMessaging;
import com.example.sos.support.TestRig;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChannelChainTest {

    private static final List<Recipient> TWO = List.of(
        new Recipient(1L, "Mum", "+33600000001", ContactRole.PRIMARY),
        new Recipient(2L, "Dad", "+33600000002", ContactRole.SECONDARY)
    );

    private TestRig rig;
    private AlertEnvelope envelope;

    @BeforeEach
    void setUp() {
        rig = new TestRig().started();
        envelope = new AlertEnvelope(
            "env-1",
            "Alex",
            "user-1",
            Instant.parse("2024-05-01T10:00:00Z"),
            "EMERGENCY ALERT",
            "Alex needs help!",
            TestRig.HOME,
            null,
            "https://maps.example.com/?q=48.856600,2.352200"
        );
    }

    @Test
    void cloudMessagingFirstWhenOnline() {
        DeliveryReport report = rig.chain.deliver(TWO, envelope);

        assertTrue(report.delivered());
        assertEquals(ChannelId.CLOUD, report.channel());
        assertEquals(2, report.accepted());
        assertEquals(2, report.targeted());
        assertTrue(rig.sms.sent.isEmpty());
        assertEquals("env-1", rig.cloud.lastParam("alertId"));
        assertEquals("alert", rig.cloud.lastParam("template"));
    }

    @Test
    void oneAcceptingRecipientIsEnough() {
        rig.cloud.rejectedNumbers.add("+33600000002");

        DeliveryReport report = rig.chain.deliver(TWO, envelope);

        assertTrue(report.delivered());
        assertEquals(1, report.accepted());
        assertEquals(2, report.targeted());
    }

    @Test
    void offlineSkipsCloudAndUsesSms() {
        rig.network.goOffline();

        DeliveryReport report = rig.chain.deliver(TWO, envelope);

        assertEquals(ChannelId.SMS, report.channel());
        assertTrue(rig.cloud.sent.isEmpty());
        assertEquals(ChannelId.SMS, report.attempts().get(0).channel());
        assertEquals(List.of("+33600000001", "+33600000002"), rig.sms.sent.get(0).numbers());
        assertTrue(rig.sms.sent.get(0).text().contains("Location: https://maps.example.com/"));
    }

    @Test
    void rejectedCloudFallsThroughToSms() {
        rig.cloud.mode = FakeCloudMessaging.Mode.REJECT;

        DeliveryReport report = rig.chain.deliver(TWO, envelope);

        assertEquals(ChannelId.SMS, report.channel());
        DeliveryAttempt cloud = report.attempts().get(0);
        assertEquals(ChannelId.CLOUD, cloud.channel());
        assertEquals(AttemptOutcome.FAILED, cloud.outcome());
    }

    @Test
    void throwingCloudIsAFailedAttempt() {
        rig.cloud.mode = FakeCloudMessaging.Mode.THROW;

        DeliveryReport report = rig.chain.deliver(TWO, envelope);

        assertEquals(AttemptOutcome.FAILED, report.attempts().get(0).outcome());
        assertEquals(ChannelId.SMS, report.channel());
    }

    @Test
    void hangingCloudTimesOutAndFallsThrough() {
        rig.cloud.mode = FakeCloudMessaging.Mode.HANG;

        DeliveryReport report = rig.chain.deliver(TWO, envelope);

        assertEquals(AttemptOutcome.TIMED_OUT, report.attempts().get(0).outcome());
        assertTrue(report.delivered());
        assertEquals(ChannelId.SMS, report.channel());
    }

    @Test
    void hangingSmsTimesOut() {
        rig.network.goOffline();
        rig.sms.hang = true;

        DeliveryReport report = rig.chain.deliver(TWO, envelope);

        assertFalse(report.delivered());
        assertEquals(AttemptOutcome.TIMED_OUT, report.attempts().get(0).outcome());
    }

    @Test
    void pushNeverCountsAsDelivery() {
        rig.network.goOffline();
        rig.sms.result = SmsCapability.Result.CANCELLED;

        DeliveryReport report = rig.chain.deliver(TWO, envelope);

        assertFalse(report.delivered());
        assertNull(report.channel());
        assertEquals(0, report.accepted());
        DeliveryAttempt push = report.attempts().get(report.attempts().size() - 1);
        assertEquals(ChannelId.PUSH, push.channel());
        assertEquals(AttemptOutcome.SENT, push.outcome());
        assertEquals(1, rig.push.scheduled.size());
    }

    @Test
    void pushAlsoFollowsSuccessfulDelivery() {
        DeliveryReport report = rig.chain.deliver(TWO, envelope);

        assertEquals(2, report.attempts().size());
        assertEquals(ChannelId.PUSH, report.attempts().get(1).channel());
        assertEquals(List.of("EMERGENCY ALERT"), rig.push.titles());
    }

    @Test
    void unknownSmsResultIsNotDelivery() {
        rig.network.goOffline();
        rig.sms.result = SmsCapability.Result.UNKNOWN;
        rig.push.available = false;

        DeliveryReport report = rig.chain.deliver(TWO, envelope);

        assertFalse(report.delivered());
        assertEquals(1, report.attempts().size());
        assertEquals("result unknown", report.attempts().get(0).detail());
    }
}
