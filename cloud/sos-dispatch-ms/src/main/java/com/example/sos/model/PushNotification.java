package com.example.sos.model;

import java.time.Instant;
import java.util.List;

public class PushNotification {
    public String notificationId;
    public String title;
    public String body;
    public String category;          // sos, check-in
    public List<String> recipients;  // phone numbers, empty for the device owner
    public Instant createdAt;

    public PushNotification() {}
}
