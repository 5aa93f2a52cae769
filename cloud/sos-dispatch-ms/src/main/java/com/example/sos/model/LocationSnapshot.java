package com.example.sos.model;

import java.time.Instant;

public record LocationSnapshot(
    double latitude,
    double longitude,
    Double accuracyMeters, // null when the fix carries no accuracy
    Instant capturedAt
) {}
