package com.example.sos.model;

import java.time.Instant;

public class OtpRecord {
    public String phoneNumber;
    public String code;
    public Instant createdAt;
    public Instant expiresAt;
    public boolean verified;
    public int attempts;

    public OtpRecord() {}

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }
}
