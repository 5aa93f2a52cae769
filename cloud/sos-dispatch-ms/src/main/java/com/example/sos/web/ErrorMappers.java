package com.example.sos.web;

import com.example.sos.error.SosValidationException;
import com.example.sos.error.StoreException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

public class ErrorMappers {

    private static final Logger LOG = Logger.getLogger(ErrorMappers.class);

    @ServerExceptionMapper
    public Response mapValidation(SosValidationException e) {
        return Response
            .status(Response.Status.BAD_REQUEST)
            .type(MediaType.APPLICATION_JSON)
            .entity(new ErrorBody(e.category().name(), e.getMessage()))
            .build();
    }

    @ServerExceptionMapper
    public Response mapStore(StoreException e) {
        LOG.errorf(e, "Storage failure");
        return Response
            .serverError()
            .type(MediaType.APPLICATION_JSON)
            .entity(new ErrorBody("STORAGE", "Stored data could not be read or written"))
            .build();
    }
}
