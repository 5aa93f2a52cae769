package com.example.sos.kafka;

import com.example.sos.connectivity.ConnectivityStatus;
import com.example.sos.device.ReportedConnectivityCapability;
import com.example.sos.model.ConnectivityEvent;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.jboss.logging.Logger;

@ApplicationScoped
public class ConnectivityEventConsumer {

    private static final Logger LOG = Logger.getLogger(
        ConnectivityEventConsumer.class
    );

    private final ReportedConnectivityCapability connectivity;

    public ConnectivityEventConsumer(
        ReportedConnectivityCapability connectivity
    ) {
        this.connectivity = connectivity;
    }

    @Incoming("connectivity-events")
    public void consume(ConnectivityEvent in) {
        if (in == null) {
            LOG.warnf("Skipping unreadable connectivity event");
            return;
        }
        LOG.debugf(
            "Connectivity event: connected=%s reachable=%s type=%s",
            in.connected,
            in.reachable,
            in.type
        );
        connectivity.report(ConnectivityStatus.of(in));
    }
}
