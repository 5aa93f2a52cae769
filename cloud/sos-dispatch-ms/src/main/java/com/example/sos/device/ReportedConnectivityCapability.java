package com.example.sos.device;

import com.example.sos.capabilities.ConnectivityCapability;
import com.example.sos.capabilities.Subscription;
import com.example.sos.connectivity.ConnectivityStatus;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@DefaultBean
@ApplicationScoped
public class ReportedConnectivityCapability implements ConnectivityCapability {

    private final List<Consumer<ConnectivityStatus>> listeners =
        new CopyOnWriteArrayList<>();
    private volatile ConnectivityStatus current;

    public ReportedConnectivityCapability(
        @ConfigProperty(
            name = "sos.connectivity.initially-online",
            defaultValue = "true"
        ) boolean initiallyOnline
    ) {
        this.current = initiallyOnline
            ? ConnectivityStatus.UNKNOWN_ONLINE
            : ConnectivityStatus.OFFLINE;
    }

    @Override
    public boolean available() {
        return true;
    }

    @Override
    public ConnectivityStatus current() {
        return current;
    }

    @Override
    public Subscription subscribe(Consumer<ConnectivityStatus> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void report(ConnectivityStatus status) {
        current = status;
        listeners.forEach(l -> l.accept(status));
    }
}
