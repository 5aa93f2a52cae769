package com.example.sos.delivery;

import com.example.sos.capabilities.PhoneCallCapability;
import com.example.sos.model.AlertEnvelope;
import com.example.sos.model.AlertKind;
import com.example.sos.model.Recipient;
import com.example.sos.queue.OfflineQueue;
import com.example.sos.scheduling.TaskScheduler;
import com.example.sos.util.PhoneNumbers;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@ApplicationScoped
public class DeliveryOrchestrator {

    private static final Logger LOG = Logger.getLogger(
        DeliveryOrchestrator.class
    );

    private final ChannelChain chain;
    private final OfflineQueue queue;
    private final DeliverySignals signals;
    private final PhoneCallCapability phone;
    private final TaskScheduler scheduler;
    private final boolean callPrimaryContact;

    public DeliveryOrchestrator(
        ChannelChain chain,
        OfflineQueue queue,
        DeliverySignals signals,
        PhoneCallCapability phone,
        TaskScheduler scheduler,
        @ConfigProperty(
            name = "sos.delivery.call-primary-contact",
            defaultValue = "false"
        ) boolean callPrimaryContact
    ) {
        this.chain = chain;
        this.queue = queue;
        this.signals = signals;
        this.phone = phone;
        this.scheduler = scheduler;
        this.callPrimaryContact = callPrimaryContact;
    }

    public DispatchOutcome dispatch(
        AlertKind kind,
        List<Recipient> targets,
        AlertEnvelope envelope
    ) {
        if (targets == null || targets.isEmpty()) {
            LOG.errorf("Alert %s has no recipients, nothing sent", envelope.id());
            DispatchOutcome outcome = DispatchOutcome.noContacts(envelope.id(), kind);
            signals.onDispatched(outcome);
            return outcome;
        }

        LOG.infof(
            "Dispatching %s alert %s to %d recipient(s)",
            kind,
            envelope.id(),
            targets.size()
        );
        DeliveryReport report = chain.deliver(targets, envelope);

        DispatchOutcome outcome;
        if (report.delivered()) {
            outcome = DispatchOutcome.sent(envelope.id(), kind, report);
            LOG.infof(
                "Alert %s sent via %s to %d of %d recipient(s)",
                envelope.id(),
                report.channel(),
                report.accepted(),
                report.targeted()
            );
        } else {
            outcome = enqueue(kind, targets, envelope, report);
        }
        signals.onDispatched(outcome);

        if (outcome.status() != DispatchStatus.FAILED) {
            followUpCall(targets.get(0));
        }
        return outcome;
    }

    private DispatchOutcome enqueue(
        AlertKind kind,
        List<Recipient> targets,
        AlertEnvelope envelope,
        DeliveryReport report
    ) {
        try {
            String queuedId = queue.enqueue(kind, envelope, targets);
            LOG.warnf(
                "Alert %s not delivered, queued as %s for retry",
                envelope.id(),
                queuedId
            );
            return DispatchOutcome.queued(envelope.id(), kind, report, queuedId);
        } catch (RuntimeException e) {
            LOG.errorf(
                e,
                "Alert %s not delivered and could not be queued",
                envelope.id()
            );
            return DispatchOutcome.failed(envelope.id(), kind, report);
        }
    }

    // Runs off the alert path; a failed call never changes the outcome.
    private void followUpCall(Recipient top) {
        if (!callPrimaryContact || !phone.available()) {
            return;
        }
        scheduler.execute(() -> {
            boolean started = phone.call(top.phoneNumber());
            if (started) {
                LOG.infof("Calling %s", PhoneNumbers.mask(top.phoneNumber()));
            } else {
                LOG.warnf(
                    "Could not start call to %s",
                    PhoneNumbers.mask(top.phoneNumber())
                );
            }
        });
    }
}
