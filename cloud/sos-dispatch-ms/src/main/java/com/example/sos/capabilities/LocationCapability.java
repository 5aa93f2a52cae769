package com.example.sos.capabilities;

import com.example.sos.model.LocationSnapshot;
import java.time.Duration;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

public interface LocationCapability {

    boolean available();

    /**
     * Requests a high-accuracy fix. The stage completes with {@code null} when no fix can be
     * produced within {@code timeout}, and exceptionally when the platform denies access.
     */
    CompletionStage<LocationSnapshot> currentFix(Duration timeout);

    Subscription watch(
        Consumer<LocationSnapshot> listener,
        Duration minInterval,
        double minDistanceMeters
    );
}
