package com.example.sos.trigger;

public interface TriggerListener {
    void onStateChanged(TriggerState previous, TriggerState current, TriggerSource source);

    default void onProgress(double progress) {}
}
