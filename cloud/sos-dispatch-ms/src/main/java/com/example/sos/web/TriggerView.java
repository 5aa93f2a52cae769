package com.example.sos.web;

import com.example.sos.trigger.TriggerSource;
import com.example.sos.trigger.TriggerState;
import com.example.sos.trigger.TriggerStateMachine;

public record TriggerView(
    boolean accepted,
    TriggerState state,
    TriggerSource source,
    double progress,
    int remainingSeconds
) {
    static TriggerView of(boolean accepted, TriggerStateMachine machine) {
        return new TriggerView(
            accepted,
            machine.state(),
            machine.source(),
            machine.progress(),
            machine.remainingSeconds()
        );
    }
}
