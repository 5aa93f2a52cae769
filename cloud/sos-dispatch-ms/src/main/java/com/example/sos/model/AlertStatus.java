package com.example.sos.model;

public enum AlertStatus {
    SENT,
    QUEUED,
    DELIVERED_FROM_QUEUE,
    TERMINAL_FAILURE,
    NO_CONTACTS,
    FAILED
}
