package com.example.sos.connectivity;

import com.example.sos.capabilities.ConnectivityCapability;
import com.example.sos.capabilities.Subscription;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.jboss.logging.Logger;

@ApplicationScoped
public class ConnectivityMonitor {

    private static final Logger LOG = Logger.getLogger(
        ConnectivityMonitor.class
    );

    private final ConnectivityCapability capability;
    private final List<ConnectivityListener> listeners =
        new CopyOnWriteArrayList<>();

    private volatile ConnectivityStatus status = ConnectivityStatus.OFFLINE;
    private Subscription upstream;

    public ConnectivityMonitor(ConnectivityCapability capability) {
        this.capability = capability;
    }

    public synchronized void start() {
        if (upstream != null) return;
        if (!capability.available()) {
            LOG.warnf("Connectivity capability unavailable, assuming online");
            status = ConnectivityStatus.UNKNOWN_ONLINE;
            return;
        }
        status = capability.current();
        upstream = capability.subscribe(this::update);
        LOG.infof(
            "Connectivity monitor started: online=%s type=%s",
            status.online(),
            status.type()
        );
    }

    public synchronized void stop() {
        if (upstream != null) {
            upstream.close();
            upstream = null;
        }
    }

    public ConnectivityStatus status() {
        return status;
    }

    public boolean isOnline() {
        return status.online();
    }

    public ConnectionQuality quality() {
        return ConnectionQuality.of(status);
    }

    public Subscription subscribe(ConnectivityListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    void update(ConnectivityStatus next) {
        boolean restored;
        synchronized (this) {
            boolean wasOnline = status.online();
            status = next;
            restored = !wasOnline && next.online();
        }
        if (restored) {
            LOG.infof("Connectivity restored (%s)", next.type());
        } else if (!next.online()) {
            LOG.warnf("Device offline (%s)", next.type());
        }
        for (ConnectivityListener l : listeners) {
            try {
                l.onChange(next, restored);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Connectivity listener failed");
            }
        }
    }
}
