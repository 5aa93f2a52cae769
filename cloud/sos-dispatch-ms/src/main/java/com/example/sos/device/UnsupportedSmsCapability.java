package com.example.sos.device;

import com.example.sos.capabilities.SmsCapability;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

@DefaultBean
@ApplicationScoped
public class UnsupportedSmsCapability implements SmsCapability {

    @Override
    public boolean available() {
        return false;
    }

    @Override
    public CompletionStage<Result> send(List<String> numbers, String text) {
        return CompletableFuture.failedFuture(
            new UnsupportedOperationException("SMS is not available on this platform")
        );
    }
}
