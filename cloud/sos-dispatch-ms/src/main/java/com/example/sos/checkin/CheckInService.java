package com.example.sos.checkin;

import com.example.sos.capabilities.PushCapability;
import com.example.sos.error.SosValidationException;
import com.example.sos.model.CheckInStatus;
import com.example.sos.model.CheckInTimer;
import com.example.sos.model.LocationSnapshot;
import com.example.sos.processing.SosCoordinator;
import com.example.sos.scheduling.ScheduledTask;
import com.example.sos.scheduling.TaskScheduler;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Dead-man's switch. A timer that is neither checked in nor cancelled before it ends turns
 * into an SOS through the coordinator, exactly like a manual trigger.
 */
@ApplicationScoped
public class CheckInService {

    static final String CATEGORY = "check-in";

    private static final Logger LOG = Logger.getLogger(CheckInService.class);

    private final PushCapability push;
    private final SosCoordinator coordinator;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final double reminderRatio;
    private final Duration retention;

    private final Map<String, Entry> timers = new ConcurrentHashMap<>();

    public CheckInService(
        PushCapability push,
        SosCoordinator coordinator,
        TaskScheduler scheduler,
        Clock clock,
        @ConfigProperty(
            name = "sos.checkin.reminder-ratio",
            defaultValue = "0.75"
        ) double reminderRatio,
        @ConfigProperty(
            name = "sos.checkin.retention",
            defaultValue = "PT1H"
        ) Duration retention
    ) {
        if (reminderRatio <= 0.0 || reminderRatio >= 1.0) {
            throw new IllegalArgumentException(
                "sos.checkin.reminder-ratio must be between 0 and 1"
            );
        }
        this.push = push;
        this.coordinator = coordinator;
        this.scheduler = scheduler;
        this.clock = clock;
        this.reminderRatio = reminderRatio;
        this.retention = retention;
    }

    public String start(Duration duration, String destination, LocationSnapshot location) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new SosValidationException("Check-in duration must be positive");
        }
        Instant now = clock.instant();
        CheckInTimer timer = new CheckInTimer();
        timer.id = UUID.randomUUID().toString();
        timer.duration = duration;
        timer.startedAt = now;
        timer.endsAt = now.plus(duration);
        timer.destination = destination;
        timer.location = location;
        timer.status = CheckInStatus.ACTIVE;

        Entry entry = new Entry(timer);
        timers.put(timer.id, entry);
        Duration reminderDelay = Duration.ofMillis(
            (long) (duration.toMillis() * reminderRatio)
        );
        synchronized (entry) {
            entry.reminder = scheduler.schedule(reminderDelay, () -> remind(entry));
            entry.deadline = scheduler.schedule(duration, () -> expire(entry));
        }
        LOG.infof(
            "Check-in %s started for %d min%s",
            timer.id,
            duration.toMinutes(),
            destination == null ? "" : " to " + destination
        );
        return timer.id;
    }

    public boolean checkIn(String id) {
        return finish(id, CheckInStatus.COMPLETED);
    }

    public boolean cancel(String id) {
        return finish(id, CheckInStatus.CANCELLED);
    }

    public Optional<CheckInTimer> find(String id) {
        Entry entry = timers.get(id);
        if (entry == null) return Optional.empty();
        synchronized (entry) {
            return Optional.of(entry.timer.copy());
        }
    }

    public List<CheckInTimer> activeTimers() {
        return timers
            .values()
            .stream()
            .map(e -> {
                synchronized (e) {
                    return e.timer.copy();
                }
            })
            .filter(t -> t.status == CheckInStatus.ACTIVE)
            .sorted(Comparator.comparing(t -> t.endsAt))
            .toList();
    }

    public Duration timeRemaining(String id) {
        Entry entry = require(id);
        synchronized (entry) {
            if (entry.timer.status != CheckInStatus.ACTIVE) return Duration.ZERO;
            Duration left = Duration.between(clock.instant(), entry.timer.endsAt);
            return left.isNegative() ? Duration.ZERO : left;
        }
    }

    private boolean finish(String id, CheckInStatus outcome) {
        Entry entry = require(id);
        synchronized (entry) {
            if (entry.timer.status != CheckInStatus.ACTIVE) {
                LOG.infof(
                    "Check-in %s already %s, %s ignored",
                    id,
                    entry.timer.status,
                    outcome
                );
                return false;
            }
            entry.timer.status = outcome;
            entry.cancelTasks();
        }
        scheduleEviction(entry);
        LOG.infof("Check-in %s %s", id, outcome);
        return true;
    }

    private void remind(Entry entry) {
        long minutes;
        synchronized (entry) {
            if (entry.timer.status != CheckInStatus.ACTIVE) return;
            Duration left = Duration.between(clock.instant(), entry.timer.endsAt);
            minutes = Math.max(1, left.toMinutes());
        }
        notifyUser(
            "Check-in Reminder",
            "Please check in within %d minute(s)".formatted(minutes)
        );
    }

    private void expire(Entry entry) {
        CheckInTimer missed;
        synchronized (entry) {
            if (entry.timer.status != CheckInStatus.ACTIVE) return;
            entry.timer.status = CheckInStatus.MISSED;
            entry.cancelTasks();
            missed = entry.timer.copy();
        }
        scheduleEviction(entry);
        LOG.warnf("Check-in %s missed", missed.id);
        notifyUser("Check-in Missed!", "Emergency contacts will be notified");
        try {
            coordinator.escalateMissedCheckIn(missed);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Escalation of missed check-in %s failed", missed.id);
        }
    }

    // ended timers stay queryable for a while, then are forgotten
    private void scheduleEviction(Entry entry) {
        scheduler.schedule(
            retention,
            () -> {
                if (timers.remove(entry.timer.id, entry)) {
                    LOG.debugf("Check-in %s evicted", entry.timer.id);
                }
            }
        );
    }

    private void notifyUser(String title, String body) {
        if (!push.available()) {
            LOG.debugf("Push unavailable, dropping notification '%s'", title);
            return;
        }
        try {
            push.schedule(
                new PushCapability.Content(title, body, CATEGORY, List.of()),
                PushCapability.Trigger.now()
            );
        } catch (RuntimeException e) {
            LOG.errorf(e, "Could not schedule notification '%s'", title);
        }
    }

    private Entry require(String id) {
        Entry entry = timers.get(id);
        if (entry == null) {
            throw new SosValidationException("Unknown check-in timer: " + id);
        }
        return entry;
    }

    // guarded by its own monitor
    private static final class Entry {

        final CheckInTimer timer;
        ScheduledTask reminder;
        ScheduledTask deadline;

        Entry(CheckInTimer timer) {
            this.timer = timer;
        }

        void cancelTasks() {
            if (reminder != null) reminder.cancel();
            if (deadline != null) deadline.cancel();
        }
    }
}
