package com.example.sos.contacts;

import com.example.sos.model.Contact;
import com.example.sos.model.ContactRole;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.jboss.logging.Logger;

/**
 * Picks who receives an alert: favorites, else verified contacts, else everyone. Tiers are
 * never merged.
 */
@ApplicationScoped
public class ContactResolver {

    private static final Logger LOG = Logger.getLogger(ContactResolver.class);

    private static final Comparator<Contact> BY_ROLE = Comparator.comparingInt(
        c -> ContactRole.rank(c.role)
    );

    public Resolution resolve(List<Contact> roster) {
        if (roster == null || roster.isEmpty()) {
            LOG.warnf("Roster is empty, nobody to alert");
            return Resolution.noContacts();
        }
        long primaries = roster
            .stream()
            .filter(c -> c.role == ContactRole.PRIMARY)
            .count();
        if (primaries > 1) {
            LOG.warnf("Roster has %d primary contacts", primaries);
        }

        List<Contact> favorites = tier(roster, c -> c.favorite);
        if (!favorites.isEmpty()) {
            return resolved(favorites, ResolutionTier.FAVORITES);
        }
        List<Contact> verified = tier(roster, c -> c.verified);
        if (!verified.isEmpty()) {
            return resolved(verified, ResolutionTier.VERIFIED);
        }
        return resolved(tier(roster, c -> true), ResolutionTier.ALL);
    }

    private static List<Contact> tier(
        List<Contact> roster,
        Predicate<Contact> filter
    ) {
        // stable sort, roster order breaks ties
        return roster
            .stream()
            .filter(filter)
            .sorted(BY_ROLE)
            .collect(Collectors.toList());
    }

    private static Resolution resolved(List<Contact> contacts, ResolutionTier tier) {
        LOG.infof("Resolved %d contact(s) from tier %s", contacts.size(), tier);
        return new Resolution(List.copyOf(contacts), tier);
    }
}
