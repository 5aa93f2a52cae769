package com.example.sos.model;

import java.time.Instant;

public record AlertEnvelope(
    String id,
    String senderName,
    String senderId,
    Instant createdAt,
    String title,
    String message,
    LocationSnapshot location,
    String voiceNoteRef,
    String trackingUrl
) {
    public boolean hasLocation() {
        return location != null;
    }
}
