package com.example.sos.contacts;

import com.example.sos.model.Contact;
import java.util.List;

public interface ContactRoster {

    List<Contact> contacts();

    // rejects a second PRIMARY contact
    Contact addContact(Contact contact);

    boolean removeContact(long id);

    int markVerified(String phoneNumber);
}
