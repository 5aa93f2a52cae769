package com.example.sos.model;

import java.time.Instant;
import java.util.Map;

public class OutboundMessage {
    public String messageId;   // idempotency key for the backend
    public String to;          // E.164 number
    public String template;    // emergency, location_share, message, otp
    public Map<String, String> params;
    public Instant createdAt;

    public OutboundMessage() {}
}
