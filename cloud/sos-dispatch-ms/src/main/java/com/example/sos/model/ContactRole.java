package com.example.sos.model;

public enum ContactRole {
    PRIMARY,
    SECONDARY,
    TERTIARY;

    // a missing role sorts last
    public static int rank(ContactRole role) {
        return role == null ? values().length : role.ordinal();
    }
}
