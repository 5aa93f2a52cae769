package com.example.sos.contacts;

public enum ResolutionTier {
    FAVORITES,
    VERIFIED,
    ALL,
    NO_CONTACTS
}
