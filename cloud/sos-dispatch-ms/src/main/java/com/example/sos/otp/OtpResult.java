package com.example.sos.otp;

import com.example.sos.error.ErrorCategory;
import java.time.Duration;
import java.time.Instant;

public record OtpResult(
    OtpStatus status,
    String message,
    Integer remainingAttempts, // INVALID_CODE only
    Duration retryAfter,       // RATE_LIMITED only
    Instant expiresAt          // SENT only
) {
    public boolean success() {
        return status == OtpStatus.SENT || status == OtpStatus.VERIFIED;
    }

    public ErrorCategory category() {
        return status.category();
    }

    static OtpResult sent(String message, Instant expiresAt) {
        return new OtpResult(OtpStatus.SENT, message, null, null, expiresAt);
    }

    static OtpResult verified(String message) {
        return new OtpResult(OtpStatus.VERIFIED, message, null, null, null);
    }

    static OtpResult rateLimited(String message, Duration retryAfter) {
        return new OtpResult(OtpStatus.RATE_LIMITED, message, null, retryAfter, null);
    }

    static OtpResult invalidCode(String message, int remainingAttempts) {
        return new OtpResult(
            OtpStatus.INVALID_CODE,
            message,
            remainingAttempts,
            null,
            null
        );
    }

    static OtpResult failure(OtpStatus status, String message) {
        return new OtpResult(status, message, null, null, null);
    }
}
