package com.example.sos.trigger;

public enum TriggerState {
    IDLE,
    ARMING,
    CONFIRMING,
    ACTIVATED,
    DEACTIVATED
}
