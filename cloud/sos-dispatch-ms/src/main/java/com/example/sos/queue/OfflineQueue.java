package com.example.sos.queue;

import com.example.sos.capabilities.ByteStore;
import com.example.sos.capabilities.Subscription;
import com.example.sos.connectivity.ConnectivityMonitor;
import com.example.sos.delivery.ChannelChain;
import com.example.sos.delivery.DeliveryReport;
import com.example.sos.delivery.DeliverySignals;
import com.example.sos.error.StoreException;
import com.example.sos.model.AlertEnvelope;
import com.example.sos.model.AlertKind;
import com.example.sos.model.QueuedAlert;
import com.example.sos.model.Recipient;
import com.example.sos.scheduling.TaskScheduler;
import com.example.sos.serde.JsonCodec;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Durable list of alerts that no confirming channel could deliver. Replayed one entry at a
 * time whenever connectivity comes back; an entry is dropped, with a terminal-failure signal,
 * once it has failed {@code maxRetries} replays.
 */
@ApplicationScoped
public class OfflineQueue {

    public static final String QUEUE_KEY = "alert_queue";
    static final String CORRUPT_SUFFIX = ".corrupt";

    private static final Logger LOG = Logger.getLogger(OfflineQueue.class);
    private static final TypeReference<List<QueuedAlert>> LIST_TYPE =
        new TypeReference<>() {};

    private final ByteStore store;
    private final JsonCodec codec;
    private final ChannelChain chain;
    private final ConnectivityMonitor connectivity;
    private final DeliverySignals signals;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final int maxRetries;
    private final Duration retryBackoff;

    // guarded by itself; every change is written through to the store
    private final List<QueuedAlert> entries = new ArrayList<>();
    private final ReentrantLock replayLock = new ReentrantLock();
    private final AtomicLong sequence = new AtomicLong();
    private Subscription connectivitySubscription;

    public OfflineQueue(
        ByteStore store,
        JsonCodec codec,
        ChannelChain chain,
        ConnectivityMonitor connectivity,
        DeliverySignals signals,
        TaskScheduler scheduler,
        Clock clock,
        @ConfigProperty(
            name = "sos.queue.max-retries",
            defaultValue = "3"
        ) int maxRetries,
        @ConfigProperty(
            name = "sos.queue.retry-backoff",
            defaultValue = "PT0S"
        ) Duration retryBackoff
    ) {
        this.store = store;
        this.codec = codec;
        this.chain = chain;
        this.connectivity = connectivity;
        this.signals = signals;
        this.scheduler = scheduler;
        this.clock = clock;
        this.maxRetries = maxRetries;
        this.retryBackoff = retryBackoff;
    }

    public void start() {
        load();
        synchronized (this) {
            if (connectivitySubscription == null) {
                connectivitySubscription = connectivity.subscribe(
                    (status, restored) -> {
                        if (restored) {
                            scheduler.execute(this::onConnectivityRestored);
                        }
                    }
                );
            }
        }
    }

    public void stop() {
        synchronized (this) {
            if (connectivitySubscription != null) {
                connectivitySubscription.close();
                connectivitySubscription = null;
            }
        }
    }

    // the same envelope twice returns the id already queued
    public String enqueue(
        AlertKind kind,
        AlertEnvelope envelope,
        List<Recipient> recipients
    ) {
        synchronized (entries) {
            for (QueuedAlert existing : entries) {
                if (existing.envelope.id().equals(envelope.id())) {
                    LOG.infof(
                        "Alert %s already queued as %s",
                        envelope.id(),
                        existing.id
                    );
                    return existing.id;
                }
            }
            Instant now = clock.instant();
            QueuedAlert alert = new QueuedAlert();
            alert.id = "%d_%d".formatted(now.toEpochMilli(), sequence.incrementAndGet());
            alert.kind = kind;
            alert.envelope = envelope;
            alert.recipients = new ArrayList<>(recipients);
            alert.enqueuedAt = now;
            alert.retryCount = 0;
            entries.add(alert);
            try {
                persist();
            } catch (RuntimeException e) {
                entries.remove(alert);
                throw e;
            }
            LOG.infof("Alert queued: %s (%s) for envelope %s", alert.id, kind, envelope.id());
            return alert.id;
        }
    }

    // replays a snapshot in order; a concurrent call returns immediately
    public ReplaySummary onConnectivityRestored() {
        if (!replayLock.tryLock()) {
            LOG.infof("Queue replay already running, skipping");
            return ReplaySummary.alreadyRunning();
        }
        try {
            List<QueuedAlert> batch = snapshot();
            if (batch.isEmpty()) {
                return new ReplaySummary(0, 0, 0, 0, 0, false);
            }
            LOG.infof("Processing %d queued alert(s)...", batch.size());
            int delivered = 0, retained = 0, dropped = 0, deferred = 0;
            for (QueuedAlert alert : batch) {
                if (!due(alert)) {
                    deferred++;
                    continue;
                }
                try {
                    switch (replayOne(alert)) {
                        case DELIVERED -> delivered++;
                        case RETAINED -> retained++;
                        case DROPPED -> dropped++;
                        case GONE -> {}
                    }
                } catch (RuntimeException e) {
                    retained++;
                    LOG.errorf(e, "Replay of queued alert %s failed, moving on", alert.id);
                }
            }
            return new ReplaySummary(
                delivered + retained + dropped,
                delivered,
                retained,
                dropped,
                deferred,
                false
            );
        } finally {
            replayLock.unlock();
        }
    }

    private enum Replayed {
        DELIVERED,
        RETAINED,
        DROPPED,
        GONE
    }

    private Replayed replayOne(QueuedAlert alert) {
        DeliveryReport report = replay(alert);
        if (report != null && report.delivered()) {
            remove(alert.id);
            signals.onReplayDelivered(alert, report);
            return Replayed.DELIVERED;
        }
        QueuedAlert updated = recordFailure(alert.id);
        if (updated == null) {
            return Replayed.GONE; // cleared while we were sending
        }
        if (updated.retryCount < maxRetries) {
            return Replayed.RETAINED;
        }
        remove(alert.id);
        LOG.errorf(
            "Alert %s exceeded %d retries, removing from queue",
            alert.id,
            maxRetries
        );
        signals.onTerminalFailure(updated, report);
        return Replayed.DROPPED;
    }

    public List<QueuedAlert> snapshot() {
        synchronized (entries) {
            return entries.stream().map(QueuedAlert::copy).toList();
        }
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public void clear() {
        synchronized (entries) {
            entries.clear();
            store.delete(QUEUE_KEY);
        }
    }

    private DeliveryReport replay(QueuedAlert alert) {
        LOG.infof("Sending queued alert: %s (%s)", alert.id, alert.kind);
        try {
            return chain.deliver(alert.recipients, alert.envelope);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Error processing queued alert %s", alert.id);
            return null;
        }
    }

    // Without a backoff, retries happen on every restored-connectivity event.
    private boolean due(QueuedAlert alert) {
        if (retryBackoff.isZero() || alert.lastAttemptAt == null) {
            return true;
        }
        long factor = 1L << Math.min(alert.retryCount - 1, 16);
        Instant next = alert.lastAttemptAt.plus(retryBackoff.multipliedBy(factor));
        return !clock.instant().isBefore(next);
    }

    private QueuedAlert recordFailure(String id) {
        synchronized (entries) {
            for (QueuedAlert e : entries) {
                if (e.id.equals(id)) {
                    e.retryCount++;
                    e.lastAttemptAt = clock.instant();
                    persistAfterReplay(id);
                    return e.copy();
                }
            }
            return null;
        }
    }

    private void remove(String id) {
        synchronized (entries) {
            if (entries.removeIf(e -> e.id.equals(id))) {
                persistAfterReplay(id);
            }
        }
    }

    // The in-memory list stays authoritative; the next successful write catches the store up.
    private void persistAfterReplay(String id) {
        try {
            persist();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Queue not persisted after replaying %s", id);
        }
    }

    private void persist() {
        store.set(QUEUE_KEY, codec.write(entries));
    }

    static long sequenceOf(String id) {
        int sep = id == null ? -1 : id.lastIndexOf('_');
        if (sep < 0) return 0L;
        try {
            return Long.parseLong(id.substring(sep + 1));
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    private void load() {
        byte[] raw = store.get(QUEUE_KEY);
        synchronized (entries) {
            entries.clear();
            if (raw == null) {
                return;
            }
            try {
                entries.addAll(codec.read(raw, LIST_TYPE));
                // ids minted after a restart must not collide with reloaded ones
                sequence.set(
                    Math.max(
                        sequence.get(),
                        entries.stream().mapToLong(e -> sequenceOf(e.id)).max().orElse(0L)
                    )
                );
                LOG.infof("Loaded %d queued alert(s)", entries.size());
            } catch (StoreException e) {
                LOG.errorf(
                    e,
                    "Stored alert queue is unreadable, moved to %s",
                    QUEUE_KEY + CORRUPT_SUFFIX
                );
                store.set(QUEUE_KEY + CORRUPT_SUFFIX, raw);
                store.delete(QUEUE_KEY);
            }
        }
    }
}
