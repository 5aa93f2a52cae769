package com.example.sos.error;

public enum ErrorCategory {
    VALIDATION,
    TRANSIENT_DELIVERY,
    RATE_LIMIT,
    ATTEMPTS_EXCEEDED,
    TERMINAL_DELIVERY
}
