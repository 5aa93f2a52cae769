package com.example.sos.scheduling;

@FunctionalInterface
public interface ScheduledTask {

    boolean cancel();
}
