package com.example.sos.capabilities;

import java.time.Duration;
import java.util.List;

public interface PushCapability {

    record Content(String title, String body, String category, List<String> recipients) {}

    record Trigger(Duration delay) {
        public static Trigger now() {
            return new Trigger(Duration.ZERO);
        }

        public static Trigger after(Duration delay) {
            return new Trigger(delay);
        }
    }

    boolean available();

    String schedule(Content content, Trigger trigger);

    void cancel(String notificationId);
}
