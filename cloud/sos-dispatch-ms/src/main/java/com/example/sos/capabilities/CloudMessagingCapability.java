package com.example.sos.capabilities;

import java.util.Map;
import java.util.concurrent.CompletionStage;

public interface CloudMessagingCapability {

    record SendResult(boolean success, String messageId, String error) {
        public static SendResult sent(String messageId) {
            return new SendResult(true, messageId, null);
        }

        public static SendResult failed(String error) {
            return new SendResult(false, null, error);
        }
    }

    boolean available();

    CompletionStage<SendResult> send(String number, Map<String, String> templateParams);
}
