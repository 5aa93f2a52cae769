package com.example.sos.config;

import com.example.sos.connectivity.ConnectivityMonitor;
import com.example.sos.queue.OfflineQueue;
import com.example.sos.scheduling.TaskScheduler;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import org.jboss.logging.Logger;

@ApplicationScoped
public class SosLifecycle {

    private static final Logger LOG = Logger.getLogger(SosLifecycle.class);

    private final ConnectivityMonitor connectivity;
    private final OfflineQueue queue;
    private final TaskScheduler scheduler;

    public SosLifecycle(ConnectivityMonitor connectivity, OfflineQueue queue, TaskScheduler scheduler) {
        this.connectivity = connectivity;
        this.queue = queue;
        this.scheduler = scheduler;
    }

    void onStart(@Observes StartupEvent event) {
        connectivity.start();
        queue.start();
        LOG.infof(
            "SOS dispatch started, %s, %d queued alert(s)",
            connectivity.isOnline() ? "online" : "offline",
            queue.size()
        );
        if (connectivity.isOnline() && queue.size() > 0) {
            // alerts left over from a previous run, replayed off the startup thread
            scheduler.execute(queue::onConnectivityRestored);
        }
    }

    void onStop(@Observes ShutdownEvent event) {
        queue.stop();
        connectivity.stop();
    }
}
