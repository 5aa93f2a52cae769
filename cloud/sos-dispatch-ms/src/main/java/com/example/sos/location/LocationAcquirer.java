package com.example.sos.location;

import com.example.sos.capabilities.LocationCapability;
import com.example.sos.model.LocationSnapshot;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@ApplicationScoped
public class LocationAcquirer {

    private static final Logger LOG = Logger.getLogger(LocationAcquirer.class);

    private final LocationCapability capability;
    private final Duration defaultMaxWait;

    public LocationAcquirer(
        LocationCapability capability,
        @ConfigProperty(
            name = "sos.location.max-wait",
            defaultValue = "PT5S"
        ) Duration defaultMaxWait
    ) {
        this.capability = capability;
        this.defaultMaxWait = defaultMaxWait;
    }

    public Optional<LocationSnapshot> acquire() {
        return acquire(defaultMaxWait);
    }

    public Optional<LocationSnapshot> acquire(Duration maxWait) {
        if (!capability.available()) {
            LOG.infof("Location capability unavailable, continuing without a fix");
            return Optional.empty();
        }
        try {
            LocationSnapshot fix = capability
                .currentFix(maxWait)
                .toCompletableFuture()
                .get(maxWait.toMillis(), TimeUnit.MILLISECONDS);
            if (fix == null) {
                LOG.warnf("No location fix within %d ms", maxWait.toMillis());
            }
            return Optional.ofNullable(fix);
        } catch (TimeoutException e) {
            LOG.warnf("No location fix within %d ms", maxWait.toMillis());
            return Optional.empty();
        } catch (ExecutionException e) {
            LOG.warnf(
                "Location request failed: %s",
                e.getCause() == null ? e.getMessage() : e.getCause().getMessage()
            );
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Location capability threw");
            return Optional.empty();
        }
    }
}
