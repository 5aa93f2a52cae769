package com.example.sos.contacts;

import static com.example.sos.support.TestContacts.contact;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.sos.model.Contact;
import com.example.sos.model.ContactRole;
import java.util.List;
import org.junit.jupiter.api.Test;

class ContactResolverTest {

    private final ContactResolver resolver = new ContactResolver();

    @Test
    void favoritesWinOverVerified() {
        Contact fav = contact("Fay", "+33600000001", ContactRole.TERTIARY, false, true);
        Contact ver = contact("Vic", "+33600000002", ContactRole.PRIMARY, true, false);

        Resolution r = resolver.resolve(List.of(ver, fav));

        assertEquals(ResolutionTier.FAVORITES, r.tier());
        assertEquals(List.of(fav), r.contacts());
    }

    @Test
    void verifiedUsedWhenNoFavorites() {
        Contact a = contact("Ann", "+33600000001", null, true, false);
        Contact b = contact("Bob", "+33600000002", null, false, false);
        Contact c = contact("Cat", "+33600000003", null, true, false);

        Resolution r = resolver.resolve(List.of(a, b, c));

        assertEquals(ResolutionTier.VERIFIED, r.tier());
        assertEquals(List.of(a, c), r.contacts());
    }

    @Test
    void wholeRosterWhenNobodyFavoriteOrVerified() {
        Contact a = contact("Ann", "+33600000001", null, false, false);
        Contact b = contact("Bob", "+33600000002", null, false, false);

        Resolution r = resolver.resolve(List.of(a, b));

        assertEquals(ResolutionTier.ALL, r.tier());
        assertEquals(List.of(a, b), r.contacts());
    }

    @Test
    void emptyRosterResolvesToNoContacts() {
        Resolution r = resolver.resolve(List.of());

        assertTrue(r.isEmpty());
        assertEquals(ResolutionTier.NO_CONTACTS, r.tier());
        assertNull(r.topPriority());
    }

    @Test
    void tiersAreNeverMerged() {
        Contact fav = contact("Fay", "+33600000001", null, false, true);
        Contact ver = contact("Vic", "+33600000002", null, true, false);
        Contact other = contact("Oli", "+33600000003", null, false, false);

        Resolution r = resolver.resolve(List.of(other, ver, fav));

        assertEquals(1, r.contacts().size());
        assertEquals("Fay", r.contacts().get(0).name);
    }

    @Test
    void orderedByRoleKeepingRosterOrderForTies() {
        Contact t = contact("Tom", "+33600000001", ContactRole.TERTIARY, true, false);
        Contact s1 = contact("Sam", "+33600000002", ContactRole.SECONDARY, true, false);
        Contact none = contact("Nia", "+33600000003", null, true, false);
        Contact p = contact("Pat", "+33600000004", ContactRole.PRIMARY, true, false);
        Contact s2 = contact("Sue", "+33600000005", ContactRole.SECONDARY, true, false);

        Resolution r = resolver.resolve(List.of(t, s1, none, p, s2));

        assertEquals(List.of(p, s1, s2, t, none), r.contacts());
        assertEquals(p, r.topPriority());
    }

    @Test
    void toleratesSeveralPrimaries() {
        Contact p1 = contact("Pat", "+33600000001", ContactRole.PRIMARY, false, false);
        Contact p2 = contact("Pia", "+33600000002", ContactRole.PRIMARY, false, false);

        Resolution r = resolver.resolve(List.of(p1, p2));

        assertEquals(List.of(p1, p2), r.contacts());
    }
}
