package com.example.sos.trigger;

public enum TriggerSource {
    TAP,
    LONG_PRESS,
    SHAKE,
    VOICE
}
