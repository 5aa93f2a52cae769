package com.example.sos.trigger;

public enum VoiceCommand {
    TRIGGER,
    CANCEL,
    CONFIRM,
    NONE
}
