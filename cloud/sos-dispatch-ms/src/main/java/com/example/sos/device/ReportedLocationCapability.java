package com.example.sos.device;

import com.example.sos.capabilities.LocationCapability;
import com.example.sos.capabilities.Subscription;
import com.example.sos.model.LocationSnapshot;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@DefaultBean
@ApplicationScoped
public class ReportedLocationCapability implements LocationCapability {

    private static final double EARTH_RADIUS_M = 6_371_000d;

    private final Clock clock;
    private final Duration maxAge;
    private final List<CompletableFuture<LocationSnapshot>> waiting =
        new CopyOnWriteArrayList<>();
    private final List<Watch> watches = new CopyOnWriteArrayList<>();
    private volatile LocationSnapshot latest;

    public ReportedLocationCapability(
        Clock clock,
        @ConfigProperty(
            name = "sos.location.max-age",
            defaultValue = "PT2M"
        ) Duration maxAge
    ) {
        this.clock = clock;
        this.maxAge = maxAge;
    }

    @Override
    public boolean available() {
        return true;
    }

    @Override
    public CompletionStage<LocationSnapshot> currentFix(Duration timeout) {
        LocationSnapshot fix = latest;
        if (fix != null && isFresh(fix)) {
            return CompletableFuture.completedFuture(fix);
        }
        CompletableFuture<LocationSnapshot> next = new CompletableFuture<>();
        waiting.add(next);
        next.whenComplete((f, e) -> waiting.remove(next));
        return next.completeOnTimeout(null, timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public Subscription watch(
        Consumer<LocationSnapshot> listener,
        Duration minInterval,
        double minDistanceMeters
    ) {
        Watch w = new Watch(listener, minInterval, minDistanceMeters);
        watches.add(w);
        return () -> watches.remove(w);
    }

    public void report(LocationSnapshot fix) {
        latest = fix;
        for (CompletableFuture<LocationSnapshot> f : waiting) {
            f.complete(fix);
        }
        for (Watch w : watches) {
            w.offer(fix);
        }
    }

    public LocationSnapshot latest() {
        return latest;
    }

    private boolean isFresh(LocationSnapshot fix) {
        return fix.capturedAt() != null &&
            !fix.capturedAt().plus(maxAge).isBefore(clock.instant());
    }

    static double distanceMeters(LocationSnapshot a, LocationSnapshot b) {
        double dLat = Math.toRadians(b.latitude() - a.latitude());
        double dLon = Math.toRadians(b.longitude() - a.longitude());
        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2) +
            Math.cos(Math.toRadians(a.latitude())) *
            Math.cos(Math.toRadians(b.latitude())) *
            Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return 2 * EARTH_RADIUS_M * Math.asin(Math.sqrt(h));
    }

    private static final class Watch {

        private final Consumer<LocationSnapshot> listener;
        private final Duration minInterval;
        private final double minDistanceMeters;
        private LocationSnapshot lastDelivered;

        Watch(
            Consumer<LocationSnapshot> listener,
            Duration minInterval,
            double minDistanceMeters
        ) {
            this.listener = listener;
            this.minInterval = minInterval;
            this.minDistanceMeters = minDistanceMeters;
        }

        synchronized void offer(LocationSnapshot fix) {
            if (lastDelivered != null) {
                boolean tooSoon = fix.capturedAt() != null &&
                    lastDelivered.capturedAt() != null &&
                    fix.capturedAt().isBefore(
                        lastDelivered.capturedAt().plus(minInterval)
                    );
                if (tooSoon || distanceMeters(lastDelivered, fix) < minDistanceMeters) {
                    return;
                }
            }
            lastDelivered = fix;
            listener.accept(fix);
        }
    }
}
