package com.example.sos.processing;

public enum AlertReason {
    MANUAL_SOS,
    MISSED_CHECK_IN,
    LOCATION_SHARE,
    MESSAGE
}
