package com.example.sos.trigger;

/**
 * Receives activations from the trigger machine. Invoked while the machine holds its lock, so
 * implementations hand real work to another thread.
 */
public interface ActivationHandler {
    void onActivated(TriggerSource source);

    void onDeactivated();
}
