package com.example.sos.delivery;

import com.example.sos.model.AlertEnvelope;
import java.util.HashMap;
import java.util.Map;

final class AlertParams {

    static final String TEMPLATE = "alert";

    private AlertParams() {}

    static Map<String, String> of(AlertEnvelope envelope) {
        Map<String, String> p = new HashMap<>();
        p.put("template", TEMPLATE);
        p.put("alertId", envelope.id());
        p.put("senderName", envelope.senderName());
        p.put("senderId", envelope.senderId());
        p.put("title", envelope.title());
        p.put("message", envelope.message());
        p.put("createdAt", envelope.createdAt().toString());
        if (envelope.hasLocation()) {
            p.put("latitude", Double.toString(envelope.location().latitude()));
            p.put("longitude", Double.toString(envelope.location().longitude()));
        }
        if (envelope.trackingUrl() != null) {
            p.put("trackingUrl", envelope.trackingUrl());
        }
        if (envelope.voiceNoteRef() != null) {
            p.put("voiceNoteRef", envelope.voiceNoteRef());
        }
        return p;
    }
}
