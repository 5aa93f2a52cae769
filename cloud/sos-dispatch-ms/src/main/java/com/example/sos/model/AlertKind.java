package com.example.sos.model;

public enum AlertKind {
    SOS,
    LOCATION_SHARE,
    MESSAGE
}
