package com.example.sos.delivery;

import java.time.Instant;

public record DeliveryAttempt(
    ChannelId channel,
    AttemptOutcome outcome,
    Instant attemptedAt,
    int accepted,
    String detail
) {}
