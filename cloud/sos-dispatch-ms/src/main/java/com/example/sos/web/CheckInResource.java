package com.example.sos.web;

import com.example.sos.checkin.CheckInService;
import com.example.sos.model.CheckInStatus;
import com.example.sos.model.CheckInTimer;
import com.example.sos.model.LocationSnapshot;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Path("/checkins")
@Produces(MediaType.APPLICATION_JSON)
public class CheckInResource {

    public record StartRequest(Duration duration, String destination, LocationSnapshot location) {}

    public record TimerView(
        String id,
        CheckInStatus status,
        String destination,
        Instant endsAt,
        long remainingSeconds
    ) {}

    public record Transition(String id, boolean accepted, CheckInStatus status) {}

    private final CheckInService checkIns;

    public CheckInResource(CheckInService checkIns) {
        this.checkIns = checkIns;
    }

    @POST
    public Response start(StartRequest request) {
        String id = checkIns.start(
            request == null ? null : request.duration(),
            request == null ? null : request.destination(),
            request == null ? null : request.location()
        );
        return Response.status(Response.Status.CREATED).entity(view(id)).build();
    }

    @GET
    public List<CheckInTimer> active() {
        return checkIns.activeTimers();
    }

    @GET
    @Path("/{id}")
    public TimerView get(@PathParam("id") String id) {
        return view(id);
    }

    @POST
    @Path("/{id}/check-in")
    public Transition checkIn(@PathParam("id") String id) {
        requireKnown(id);
        boolean accepted = checkIns.checkIn(id);
        return new Transition(id, accepted, view(id).status());
    }

    @DELETE
    @Path("/{id}")
    public Transition cancel(@PathParam("id") String id) {
        requireKnown(id);
        boolean accepted = checkIns.cancel(id);
        return new Transition(id, accepted, view(id).status());
    }

    private CheckInTimer requireKnown(String id) {
        return checkIns
            .find(id)
            .orElseThrow(() -> new NotFoundException("Unknown check-in " + id));
    }

    private TimerView view(String id) {
        CheckInTimer t = requireKnown(id);
        return new TimerView(
            t.id,
            t.status,
            t.destination,
            t.endsAt,
            checkIns.timeRemaining(id).toSeconds()
        );
    }
}
