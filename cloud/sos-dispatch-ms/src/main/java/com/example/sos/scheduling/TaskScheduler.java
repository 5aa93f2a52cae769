package com.example.sos.scheduling;

import java.time.Duration;

/**
 * Runs countdown ticks, reminders, expiries and background work. Production uses a scheduled
 * executor; tests drive a virtual clock instead.
 */
public interface TaskScheduler {

    ScheduledTask schedule(Duration delay, Runnable task);

    void execute(Runnable task);
}
