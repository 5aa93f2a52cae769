package com.example.sos.error;

public class SosValidationException extends RuntimeException {

    public SosValidationException(String message) {
        super(message);
    }

    public ErrorCategory category() {
        return ErrorCategory.VALIDATION;
    }
}
