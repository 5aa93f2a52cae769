package com.example.sos.otp;

import com.example.sos.error.ErrorCategory;

public enum OtpStatus {
    SENT(null),
    VERIFIED(null),
    INVALID_FORMAT(ErrorCategory.VALIDATION),
    RATE_LIMITED(ErrorCategory.RATE_LIMIT),
    NOT_FOUND(ErrorCategory.VALIDATION),
    EXPIRED(ErrorCategory.VALIDATION),
    ATTEMPTS_EXCEEDED(ErrorCategory.ATTEMPTS_EXCEEDED),
    INVALID_CODE(ErrorCategory.VALIDATION);

    private final ErrorCategory category;

    OtpStatus(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }
}
