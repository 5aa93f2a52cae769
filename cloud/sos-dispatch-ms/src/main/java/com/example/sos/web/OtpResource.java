package com.example.sos.web;

import com.example.sos.error.SosValidationException;
import com.example.sos.otp.OtpPurpose;
import com.example.sos.otp.OtpResult;
import com.example.sos.otp.OtpService;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

@Path("/otp")
@Produces(MediaType.APPLICATION_JSON)
public class OtpResource {

    public record SendRequest(String phoneNumber, OtpPurpose purpose) {}

    public record VerifyRequest(String phoneNumber, String code) {}

    public record VerificationView(String phoneNumber, boolean verified) {}

    private final OtpService otp;

    public OtpResource(OtpService otp) {
        this.otp = otp;
    }

    @POST
    @Path("/send")
    public Response send(SendRequest request) {
        requirePhone(request == null ? null : request.phoneNumber());
        return toResponse(otp.send(request.phoneNumber(), purposeOf(request)));
    }

    @POST
    @Path("/resend")
    public Response resend(SendRequest request) {
        requirePhone(request == null ? null : request.phoneNumber());
        return toResponse(otp.resend(request.phoneNumber(), purposeOf(request)));
    }

    @POST
    @Path("/verify")
    public Response verify(VerifyRequest request) {
        requirePhone(request == null ? null : request.phoneNumber());
        if (request.code() == null || request.code().isBlank()) {
            throw new SosValidationException("code is required");
        }
        return toResponse(otp.verify(request.phoneNumber(), request.code().trim()));
    }

    @GET
    @Path("/verified/{phoneNumber}")
    public VerificationView verified(@PathParam("phoneNumber") String phoneNumber) {
        return new VerificationView(phoneNumber, otp.isVerified(phoneNumber));
    }

    @DELETE
    @Path("/verified/{phoneNumber}")
    public Response clear(@PathParam("phoneNumber") String phoneNumber) {
        otp.clearVerification(phoneNumber);
        return Response.noContent().build();
    }

    static int httpStatus(OtpResult result) {
        return switch (result.status()) {
            case SENT, VERIFIED -> 200;
            case INVALID_FORMAT -> 400;
            case NOT_FOUND -> 404;
            case EXPIRED -> 410;
            case ATTEMPTS_EXCEEDED -> 403;
            case INVALID_CODE -> 422;
            case RATE_LIMITED -> 429;
        };
    }

    private static Response toResponse(OtpResult result) {
        return Response
            .status(httpStatus(result))
            .type(MediaType.APPLICATION_JSON)
            .entity(result)
            .build();
    }

    private static OtpPurpose purposeOf(SendRequest request) {
        return request.purpose() == null ? OtpPurpose.VERIFICATION : request.purpose();
    }

    private static void requirePhone(String phoneNumber) {
        if (phoneNumber == null || phoneNumber.isBlank()) {
            throw new SosValidationException("phoneNumber is required");
        }
    }
}
