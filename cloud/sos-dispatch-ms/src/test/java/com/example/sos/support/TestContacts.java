package com.example.sos.support;

import com.example.sos.model.Contact;
import com.example.sos.model.ContactRole;

public final class TestContacts {

    private TestContacts() {}

    public static Contact contact(
        String name,
        String phone,
        ContactRole role,
        boolean verified,
        boolean favorite
    ) {
        Contact c = new Contact();
        c.name = name;
        c.phoneNumber = phone;
        c.role = role;
        c.verified = verified;
        c.favorite = favorite;
        c.relationship = "friend";
        return c;
    }

    public static Contact plain(String name, String phone) {
        return contact(name, phone, null, false, false);
    }
}
