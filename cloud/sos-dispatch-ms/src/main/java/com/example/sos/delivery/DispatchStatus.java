package com.example.sos.delivery;

public enum DispatchStatus {
    SENT,
    QUEUED,
    NO_CONTACTS,
    FAILED
}
