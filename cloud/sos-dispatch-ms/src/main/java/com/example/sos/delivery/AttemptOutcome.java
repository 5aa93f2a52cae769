package com.example.sos.delivery;

public enum AttemptOutcome {
    SENT,
    FAILED,
    TIMED_OUT
}
