package com.example.sos.model;

import java.time.Duration;
import java.time.Instant;

public class CheckInTimer {
    public String id;
    public Duration duration;
    public Instant startedAt;
    public Instant endsAt;
    public String destination;         // optional label shown to contacts
    public LocationSnapshot location;  // optional, last known position
    public CheckInStatus status;

    public CheckInTimer() {}

    public CheckInTimer copy() {
        CheckInTimer t = new CheckInTimer();
        t.id = id;
        t.duration = duration;
        t.startedAt = startedAt;
        t.endsAt = endsAt;
        t.destination = destination;
        t.location = location;
        t.status = status;
        return t;
    }
}
