package com.example.sos.delivery;

import java.util.List;

public record DeliveryReport(
    boolean delivered,
    ChannelId channel,   // the confirming channel that succeeded, null otherwise
    int accepted,
    int targeted,
    List<DeliveryAttempt> attempts
) {}
