package com.example.sos.web;

import com.example.sos.contacts.ContactResolver;
import com.example.sos.contacts.ContactRoster;
import com.example.sos.contacts.Resolution;
import com.example.sos.error.SosValidationException;
import com.example.sos.model.Contact;
import com.example.sos.model.ContactRole;
import com.example.sos.util.PhoneNumbers;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;

@Path("/contacts")
@Produces(MediaType.APPLICATION_JSON)
public class ContactResource {

    public record ContactRequest(
        String name,
        String phoneNumber,
        String relationship,
        ContactRole role,
        boolean favorite,
        String email,
        String notes
    ) {}

    private final ContactRoster roster;
    private final ContactResolver resolver;

    public ContactResource(ContactRoster roster, ContactResolver resolver) {
        this.roster = roster;
        this.resolver = resolver;
    }

    @GET
    public List<Contact> list() {
        return roster.contacts();
    }

    @GET
    @Path("/targets")
    public Resolution targets() {
        return resolver.resolve(roster.contacts());
    }

    @POST
    public Response add(ContactRequest request) {
        if (request == null || request.name() == null || request.name().isBlank()) {
            throw new SosValidationException("name is required");
        }
        if (!PhoneNumbers.isValid(request.phoneNumber())) {
            throw new SosValidationException(
                "Invalid phone number format. Use international format (e.g., +1234567890)"
            );
        }
        Contact c = new Contact();
        c.name = request.name().trim();
        c.phoneNumber = request.phoneNumber();
        c.relationship = request.relationship();
        c.role = request.role();
        c.favorite = request.favorite();
        c.email = request.email();
        c.notes = request.notes();
        c.verified = false; // only a verified OTP promotes a contact
        return Response.status(Response.Status.CREATED).entity(roster.addContact(c)).build();
    }

    @DELETE
    @Path("/{id}")
    public Response remove(@PathParam("id") long id) {
        if (!roster.removeContact(id)) {
            throw new NotFoundException("Unknown contact " + id);
        }
        return Response.noContent().build();
    }
}
