package com.example.sos.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class QueuedAlert {
    public String id;
    public AlertKind kind;
    public AlertEnvelope envelope;
    public List<Recipient> recipients = new ArrayList<>();
    public Instant enqueuedAt;
    public int retryCount;
    public Instant lastAttemptAt; // null until the first replay

    public QueuedAlert() {}

    public QueuedAlert copy() {
        QueuedAlert q = new QueuedAlert();
        q.id = id;
        q.kind = kind;
        q.envelope = envelope;
        q.recipients = new ArrayList<>(recipients);
        q.enqueuedAt = enqueuedAt;
        q.retryCount = retryCount;
        q.lastAttemptAt = lastAttemptAt;
        return q;
    }
}
