package com.example.sos.contacts;

import com.example.sos.model.Contact;
import java.util.List;

public record Resolution(List<Contact> contacts, ResolutionTier tier) {

    public static Resolution noContacts() {
        return new Resolution(List.of(), ResolutionTier.NO_CONTACTS);
    }

    public boolean isEmpty() {
        return contacts.isEmpty();
    }

    public Contact topPriority() {
        return contacts.isEmpty() ? null : contacts.get(0);
    }
}
