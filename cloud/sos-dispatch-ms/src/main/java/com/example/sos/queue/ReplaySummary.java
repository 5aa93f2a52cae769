package com.example.sos.queue;

public record ReplaySummary(
    int attempted,
    int delivered,
    int retained,
    int dropped,
    int deferred,
    boolean skipped
) {
    public static ReplaySummary alreadyRunning() {
        return new ReplaySummary(0, 0, 0, 0, 0, true);
    }
}
