package com.example.sos.processing;

import com.example.sos.contacts.ContactResolver;
import com.example.sos.contacts.ContactRoster;
import com.example.sos.contacts.Resolution;
import com.example.sos.delivery.DeliveryOrchestrator;
import com.example.sos.delivery.DispatchOutcome;
import com.example.sos.error.SosValidationException;
import com.example.sos.location.LocationAcquirer;
import com.example.sos.model.AlertEnvelope;
import com.example.sos.model.AlertKind;
import com.example.sos.model.CheckInTimer;
import com.example.sos.model.LocationSnapshot;
import com.example.sos.model.Recipient;
import com.example.sos.scheduling.TaskScheduler;
import com.example.sos.trigger.ActivationHandler;
import com.example.sos.trigger.TriggerSource;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * The one path every alert takes: resolve who to tell, locate, compose, dispatch. Trigger
 * activations are moved onto the scheduler so the trigger machine never waits on the network.
 */
@ApplicationScoped
public class SosCoordinator implements ActivationHandler {

    private static final Logger LOG = Logger.getLogger(SosCoordinator.class);

    private final ContactRoster roster;
    private final ContactResolver resolver;
    private final LocationAcquirer locator;
    private final AlertComposer composer;
    private final DeliveryOrchestrator orchestrator;
    private final TaskScheduler scheduler;

    public SosCoordinator(
        ContactRoster roster,
        ContactResolver resolver,
        LocationAcquirer locator,
        AlertComposer composer,
        DeliveryOrchestrator orchestrator,
        TaskScheduler scheduler
    ) {
        this.roster = roster;
        this.resolver = resolver;
        this.locator = locator;
        this.composer = composer;
        this.orchestrator = orchestrator;
        this.scheduler = scheduler;
    }

    @Override
    public void onActivated(TriggerSource source) {
        scheduler.execute(() -> {
            try {
                raiseSos(source);
            } catch (RuntimeException e) {
                LOG.errorf(e, "SOS from %s trigger could not be dispatched", source);
            }
        });
    }

    @Override
    public void onDeactivated() {
        LOG.infof("SOS deactivated");
    }

    public DispatchOutcome raiseSos(TriggerSource source) {
        return raiseSos(source, null);
    }

    public DispatchOutcome raiseSos(TriggerSource source, String voiceNoteRef) {
        LOG.infof("Raising SOS from %s trigger", source);
        return alert(AlertKind.SOS, AlertReason.MANUAL_SOS, null, null, voiceNoteRef);
    }

    public DispatchOutcome shareLocation() {
        return alert(AlertKind.LOCATION_SHARE, AlertReason.LOCATION_SHARE, null, null, null);
    }

    public DispatchOutcome sendMessage(String text) {
        if (text == null || text.isBlank()) {
            throw new SosValidationException("Message text must not be empty");
        }
        return alert(AlertKind.MESSAGE, AlertReason.MESSAGE, null, text.strip(), null);
    }

    // the timer's own location when it has one, a fresh fix otherwise
    public DispatchOutcome escalateMissedCheckIn(CheckInTimer timer) {
        LOG.warnf("Escalating missed check-in %s", timer.id);
        return alert(
            AlertKind.SOS,
            AlertReason.MISSED_CHECK_IN,
            timer.location,
            timer.destination,
            null
        );
    }

    private DispatchOutcome alert(
        AlertKind kind,
        AlertReason reason,
        LocationSnapshot knownLocation,
        String detail,
        String voiceNoteRef
    ) {
        Resolution resolution = resolver.resolve(roster.contacts());
        List<Recipient> targets = resolution
            .contacts()
            .stream()
            .map(Recipient::of)
            .toList();

        LocationSnapshot location = knownLocation;
        if (location == null && !targets.isEmpty()) {
            location = locator.acquire().orElse(null);
        }
        AlertEnvelope envelope = composer.compose(reason, location, detail, voiceNoteRef);
        return orchestrator.dispatch(kind, targets, envelope);
    }
}
