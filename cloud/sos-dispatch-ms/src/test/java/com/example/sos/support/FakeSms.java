package com.example.sos.support;

import com.example.sos.capabilities.SmsCapability;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;

public class FakeSms implements SmsCapability {

    public record Sent(List<String> numbers, String text) {}

    public volatile boolean available = true;
    public volatile Result result = Result.SENT;
    public volatile boolean hang;
    public final List<Sent> sent = new CopyOnWriteArrayList<>();

    @Override
    public boolean available() {
        return available;
    }

    @Override
    public CompletionStage<Result> send(List<String> numbers, String text) {
        sent.add(new Sent(List.copyOf(numbers), text));
        return hang ? new CompletableFuture<>() : CompletableFuture.completedFuture(result);
    }
}
