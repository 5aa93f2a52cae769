package com.example.sos.model;

public enum CheckInStatus {
    ACTIVE,
    COMPLETED,
    MISSED,
    CANCELLED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
