package com.example.sos.model;

import java.time.Instant;

public record AlertRecord(
    String envelopeId,
    AlertKind kind,
    AlertStatus status,
    String channel,     // null when no channel accepted the alert
    int accepted,
    int targeted,
    Instant recordedAt
) {}
