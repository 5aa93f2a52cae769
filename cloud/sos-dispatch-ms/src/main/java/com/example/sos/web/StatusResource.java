package com.example.sos.web;

import com.example.sos.connectivity.ConnectionQuality;
import com.example.sos.connectivity.ConnectivityMonitor;
import com.example.sos.queue.OfflineQueue;
import com.example.sos.trigger.TriggerState;
import com.example.sos.trigger.TriggerStateMachine;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

@Path("/status")
public class StatusResource {

    public record ServiceStatus(
        boolean online,
        ConnectionQuality quality,
        int queuedAlerts,
        TriggerState trigger
    ) {}

    private final ConnectivityMonitor connectivity;
    private final OfflineQueue queue;
    private final TriggerStateMachine trigger;

    public StatusResource(
        ConnectivityMonitor connectivity,
        OfflineQueue queue,
        TriggerStateMachine trigger
    ) {
        this.connectivity = connectivity;
        this.queue = queue;
        this.trigger = trigger;
    }

    @GET
    @Produces(MediaType.TEXT_PLAIN)
    @Path("/ping")
    public String ping() {
        return "SOS dispatch is up";
    }

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    public ServiceStatus status() {
        return new ServiceStatus(
            connectivity.isOnline(),
            connectivity.quality(),
            queue.size(),
            trigger.state()
        );
    }
}
