package com.example.sos.processing;

import com.example.sos.model.AlertEnvelope;
import com.example.sos.model.LocationSnapshot;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Clock;
import java.util.Locale;
import java.util.UUID;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class AlertComposer {

    private final Clock clock;
    private final String senderName;
    private final String senderId;
    private final String trackingBaseUrl;

    public AlertComposer(
        Clock clock,
        @ConfigProperty(
            name = "sos.sender.display-name",
            defaultValue = "Your contact"
        ) String senderName,
        @ConfigProperty(name = "sos.sender.id", defaultValue = "anonymous") String senderId,
        @ConfigProperty(
            name = "sos.tracking.base-url",
            defaultValue = "https://maps.google.com/?q="
        ) String trackingBaseUrl
    ) {
        this.clock = clock;
        this.senderName = senderName;
        this.senderId = senderId;
        this.trackingBaseUrl = trackingBaseUrl;
    }

    public AlertEnvelope compose(
        AlertReason reason,
        LocationSnapshot location,
        String detail,
        String voiceNoteRef
    ) {
        return new AlertEnvelope(
            UUID.randomUUID().toString(),
            senderName,
            senderId,
            clock.instant(),
            buildTitle(reason),
            buildMessage(reason, detail, location != null),
            location,
            voiceNoteRef,
            trackingUrl(location)
        );
    }

    String trackingUrl(LocationSnapshot location) {
        if (location == null) return null;
        String coordinates = String.format(
            Locale.ROOT,
            "%.6f,%.6f",
            location.latitude(),
            location.longitude()
        );
        return trackingBaseUrl + coordinates;
    }

    private String buildTitle(AlertReason reason) {
        return switch (reason) {
            case MANUAL_SOS -> "EMERGENCY ALERT";
            case MISSED_CHECK_IN -> "Missed Check-in";
            case LOCATION_SHARE -> "Location Shared";
            case MESSAGE -> "Message from %s".formatted(senderName);
        };
    }

    private String buildMessage(AlertReason reason, String detail, boolean located) {
        String text = switch (reason) {
            case MANUAL_SOS -> "%s needs help! This is an automated emergency alert.".formatted(
                senderName
            );
            case MISSED_CHECK_IN -> (detail == null || detail.isBlank())
                ? "%s missed a scheduled check-in.".formatted(senderName)
                : "%s missed a scheduled check-in on the way to %s.".formatted(
                    senderName,
                    detail
                );
            case LOCATION_SHARE -> "%s shared their current location with you.".formatted(
                senderName
            );
            case MESSAGE -> detail == null ? "" : detail;
        };
        if (!located && reason != AlertReason.MESSAGE) {
            text += " Location unavailable.";
        }
        return text;
    }
}
