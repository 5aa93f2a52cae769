package com.example.sos.capabilities;

import java.util.List;
import java.util.concurrent.CompletionStage;

public interface SmsCapability {

    enum Result {
        SENT,
        CANCELLED,
        UNKNOWN
    }

    boolean available();

    CompletionStage<Result> send(List<String> numbers, String text);
}
