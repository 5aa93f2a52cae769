package com.example.sos.repositories;

import com.example.sos.contacts.ContactRoster;
import com.example.sos.error.SosValidationException;
import com.example.sos.model.Contact;
import com.example.sos.model.ContactRole;
import io.quarkus.hibernate.orm.panache.PanacheRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import java.util.List;
import org.jboss.logging.Logger;

@ApplicationScoped
public class ContactRepository
    implements PanacheRepository<Contact>, ContactRoster {

    private static final Logger LOG = Logger.getLogger(ContactRepository.class);

    @Override
    @Transactional
    public List<Contact> contacts() {
        return listAll();
    }

    @Override
    @Transactional
    public Contact addContact(Contact contact) {
        if (
            contact.role == ContactRole.PRIMARY &&
            count("role", ContactRole.PRIMARY) > 0
        ) {
            throw new SosValidationException(
                "A primary contact already exists"
            );
        }
        persist(contact);
        LOG.infof("Added contact %d (%s)", contact.id, contact.role);
        return contact;
    }

    @Override
    @Transactional
    public boolean removeContact(long id) {
        return deleteById(id);
    }

    @Override
    @Transactional
    public int markVerified(String phoneNumber) {
        int updated = update(
            "verified = true where phoneNumber = ?1 and verified = false",
            phoneNumber
        );
        LOG.infof("Promoted %d contact(s) to verified", updated);
        return updated;
    }
}
