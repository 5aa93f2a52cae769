package com.example.sos.web;

import com.example.sos.delivery.DispatchOutcome;
import com.example.sos.error.SosValidationException;
import com.example.sos.history.AlertHistory;
import com.example.sos.model.AlertRecord;
import com.example.sos.model.AlertStatus;
import com.example.sos.model.QueuedAlert;
import com.example.sos.processing.SosCoordinator;
import com.example.sos.queue.OfflineQueue;
import com.example.sos.queue.ReplaySummary;
import com.example.sos.trigger.TriggerSource;
import com.example.sos.trigger.TriggerStateMachine;
import com.example.sos.trigger.VoiceCommand;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import java.util.List;
import java.util.Map;

@Path("/sos")
@Produces(MediaType.APPLICATION_JSON)
public class SosResource {

    public record Acceleration(double x, double y, double z) {}

    public record Speech(String transcript) {}

    public record VoiceResult(VoiceCommand command, TriggerView trigger) {}

    public record RaiseRequest(String voiceNoteRef) {}

    public record MessageRequest(String text) {}

    private final TriggerStateMachine trigger;
    private final SosCoordinator coordinator;
    private final AlertHistory history;
    private final OfflineQueue queue;

    public SosResource(
        TriggerStateMachine trigger,
        SosCoordinator coordinator,
        AlertHistory history,
        OfflineQueue queue
    ) {
        this.trigger = trigger;
        this.coordinator = coordinator;
        this.history = history;
        this.queue = queue;
    }

    @GET
    @Path("/state")
    public TriggerView state() {
        return TriggerView.of(true, trigger);
    }

    @POST
    @Path("/tap")
    public TriggerView tap() {
        return TriggerView.of(trigger.tap(), trigger);
    }

    @POST
    @Path("/confirm")
    public TriggerView confirm() {
        return TriggerView.of(trigger.confirm(), trigger);
    }

    @POST
    @Path("/cancel")
    public TriggerView cancel() {
        return TriggerView.of(trigger.cancel(), trigger);
    }

    @POST
    @Path("/press")
    public TriggerView press() {
        return TriggerView.of(trigger.press(), trigger);
    }

    @POST
    @Path("/release")
    public TriggerView release() {
        return TriggerView.of(trigger.release(), trigger);
    }

    @POST
    @Path("/shake")
    public TriggerView shake(Acceleration sample) {
        if (sample == null) {
            throw new SosValidationException("Acceleration sample is required");
        }
        return TriggerView.of(
            trigger.onAcceleration(sample.x(), sample.y(), sample.z()),
            trigger
        );
    }

    @POST
    @Path("/voice")
    public VoiceResult voice(Speech speech) {
        if (speech == null || speech.transcript() == null) {
            throw new SosValidationException("Transcript is required");
        }
        VoiceCommand command = trigger.onSpeech(speech.transcript());
        return new VoiceResult(
            command,
            TriggerView.of(command != VoiceCommand.NONE, trigger)
        );
    }

    @POST
    @Path("/deactivate")
    public TriggerView deactivate() {
        return TriggerView.of(trigger.deactivate(), trigger);
    }

    @POST
    @Path("/raise")
    public DispatchOutcome raise(RaiseRequest request) {
        return coordinator.raiseSos(
            TriggerSource.TAP,
            request == null ? null : request.voiceNoteRef()
        );
    }

    @POST
    @Path("/share-location")
    public DispatchOutcome shareLocation() {
        return coordinator.shareLocation();
    }

    @POST
    @Path("/message")
    public DispatchOutcome message(MessageRequest request) {
        return coordinator.sendMessage(request == null ? null : request.text());
    }

    @GET
    @Path("/history")
    public List<AlertRecord> history(@QueryParam("limit") @DefaultValue("20") int limit) {
        if (limit < 1) {
            throw new SosValidationException("limit must be positive");
        }
        return history.latest(limit);
    }

    @GET
    @Path("/history/{envelopeId}")
    public Map<String, Object> status(@PathParam("envelopeId") String envelopeId) {
        AlertStatus status = history
            .statusOf(envelopeId)
            .orElseThrow(() -> new NotFoundException("Unknown alert " + envelopeId));
        return Map.of("envelopeId", envelopeId, "status", status);
    }

    @GET
    @Path("/queue")
    public List<QueuedAlert> queued() {
        return queue.snapshot();
    }

    @POST
    @Path("/queue/replay")
    public ReplaySummary replay() {
        return queue.onConnectivityRestored();
    }
}
