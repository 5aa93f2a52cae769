package com.example.sos.web;

import com.example.sos.connectivity.ConnectionQuality;
import com.example.sos.connectivity.ConnectivityMonitor;
import com.example.sos.connectivity.ConnectivityStatus;
import com.example.sos.device.ReportedConnectivityCapability;
import com.example.sos.device.ReportedLocationCapability;
import com.example.sos.error.SosValidationException;
import com.example.sos.model.ConnectivityEvent;
import com.example.sos.model.LocationSnapshot;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.Clock;

@Path("/device")
@Produces(MediaType.APPLICATION_JSON)
public class DeviceResource {

    public record ConnectivityView(
        boolean online,
        String type,
        ConnectionQuality quality
    ) {}

    private final ReportedLocationCapability location;
    private final ReportedConnectivityCapability connectivity;
    private final ConnectivityMonitor monitor;
    private final Clock clock;

    public DeviceResource(
        ReportedLocationCapability location,
        ReportedConnectivityCapability connectivity,
        ConnectivityMonitor monitor,
        Clock clock
    ) {
        this.location = location;
        this.connectivity = connectivity;
        this.monitor = monitor;
        this.clock = clock;
    }

    @POST
    @Path("/location")
    public Response reportLocation(LocationSnapshot fix) {
        if (fix == null) {
            throw new SosValidationException("Location fix is required");
        }
        if (Math.abs(fix.latitude()) > 90 || Math.abs(fix.longitude()) > 180) {
            throw new SosValidationException("Coordinates out of range");
        }
        LocationSnapshot stamped = fix.capturedAt() != null
            ? fix
            : new LocationSnapshot(
                fix.latitude(),
                fix.longitude(),
                fix.accuracyMeters(),
                clock.instant()
            );
        location.report(stamped);
        return Response.noContent().build();
    }

    @POST
    @Path("/connectivity")
    public ConnectivityView reportConnectivity(ConnectivityEvent event) {
        if (event == null) {
            throw new SosValidationException("Connectivity event is required");
        }
        connectivity.report(ConnectivityStatus.of(event));
        return connectivity();
    }

    @GET
    @Path("/connectivity")
    public ConnectivityView connectivity() {
        ConnectivityStatus status = monitor.status();
        return new ConnectivityView(status.online(), status.type(), monitor.quality());
    }
}
