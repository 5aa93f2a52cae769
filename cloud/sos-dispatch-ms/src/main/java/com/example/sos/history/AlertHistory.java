package com.example.sos.history;

import com.example.sos.delivery.DeliveryReport;
import com.example.sos.delivery.DeliverySignals;
import com.example.sos.delivery.DispatchOutcome;
import com.example.sos.model.AlertRecord;
import com.example.sos.model.AlertStatus;
import com.example.sos.model.QueuedAlert;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@ApplicationScoped
public class AlertHistory implements DeliverySignals {

    private static final Logger LOG = Logger.getLogger(AlertHistory.class);

    private final Clock clock;
    private final int capacity;
    private final Deque<AlertRecord> records = new ArrayDeque<>();

    public AlertHistory(
        Clock clock,
        @ConfigProperty(
            name = "sos.history.capacity",
            defaultValue = "100"
        ) int capacity
    ) {
        this.clock = clock;
        this.capacity = capacity;
    }

    @Override
    public void onDispatched(DispatchOutcome outcome) {
        AlertStatus status = switch (outcome.status()) {
            case SENT -> AlertStatus.SENT;
            case QUEUED -> AlertStatus.QUEUED;
            case NO_CONTACTS -> AlertStatus.NO_CONTACTS;
            case FAILED -> AlertStatus.FAILED;
        };
        if (status == AlertStatus.FAILED) {
            LOG.errorf("Alert %s was neither delivered nor queued", outcome.envelopeId());
        }
        add(
            new AlertRecord(
                outcome.envelopeId(),
                outcome.kind(),
                status,
                outcome.channel() == null ? null : outcome.channel().name(),
                outcome.accepted(),
                outcome.targeted(),
                clock.instant()
            )
        );
    }

    @Override
    public void onReplayDelivered(QueuedAlert alert, DeliveryReport report) {
        LOG.infof(
            "Queued alert %s delivered via %s after %d failed replay(s)",
            alert.id,
            report.channel(),
            alert.retryCount
        );
        add(
            new AlertRecord(
                alert.envelope.id(),
                alert.kind,
                AlertStatus.DELIVERED_FROM_QUEUE,
                report.channel().name(),
                report.accepted(),
                report.targeted(),
                clock.instant()
            )
        );
    }

    @Override
    public void onTerminalFailure(QueuedAlert alert, DeliveryReport report) {
        LOG.errorf(
            "DEGRADED DELIVERY: alert %s (%s) dropped after %d attempt(s), %d recipient(s) never reached",
            alert.envelope.id(),
            alert.kind,
            alert.retryCount,
            alert.recipients.size()
        );
        add(
            new AlertRecord(
                alert.envelope.id(),
                alert.kind,
                AlertStatus.TERMINAL_FAILURE,
                null,
                0,
                alert.recipients.size(),
                clock.instant()
            )
        );
    }

    public synchronized List<AlertRecord> latest(int limit) {
        List<AlertRecord> out = new ArrayList<>();
        Iterator<AlertRecord> it = records.iterator();
        while (it.hasNext() && out.size() < limit) {
            out.add(it.next());
        }
        return out;
    }

    public synchronized Optional<AlertStatus> statusOf(String envelopeId) {
        return records
            .stream()
            .filter(r -> r.envelopeId().equals(envelopeId))
            .map(AlertRecord::status)
            .findFirst();
    }

    private synchronized void add(AlertRecord record) {
        records.addFirst(record);
        while (records.size() > capacity) {
            records.removeLast();
        }
    }
}
