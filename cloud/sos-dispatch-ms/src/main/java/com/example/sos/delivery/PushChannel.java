package com.example.sos.delivery;

import com.example.sos.capabilities.PushCapability;
import com.example.sos.model.AlertEnvelope;
import com.example.sos.model.Recipient;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class PushChannel implements DeliveryChannel {

    private final PushCapability push;
    private final Duration timeout;

    public PushChannel(
        PushCapability push,
        @ConfigProperty(
            name = "sos.delivery.push.timeout",
            defaultValue = "PT5S"
        ) Duration timeout
    ) {
        this.push = push;
        this.timeout = timeout;
    }

    @Override
    public ChannelId id() {
        return ChannelId.PUSH;
    }

    @Override
    public boolean available() {
        return push.available();
    }

    @Override
    public boolean confirmsDelivery() {
        return false;
    }

    @Override
    public Duration timeout() {
        return timeout;
    }

    @Override
    public CompletionStage<ChannelResult> send(
        List<Recipient> recipients,
        AlertEnvelope envelope,
        Duration timeout
    ) {
        List<String> numbers = recipients
            .stream()
            .map(Recipient::phoneNumber)
            .toList();
        try {
            String id = push.schedule(
                new PushCapability.Content(
                    envelope.title(),
                    envelope.message(),
                    "sos",
                    numbers
                ),
                PushCapability.Trigger.now()
            );
            return CompletableFuture.completedFuture(
                id == null
                    ? ChannelResult.failed(numbers.size(), "not scheduled")
                    : ChannelResult.accepted(numbers.size(), numbers.size())
            );
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
