package com.example.sos.model;

public record Recipient(Long contactId, String name, String phoneNumber, ContactRole role) {

    public static Recipient of(Contact contact) {
        return new Recipient(contact.id, contact.name, contact.phoneNumber, contact.role);
    }
}
