package com.example.sos.delivery;

import com.example.sos.capabilities.SmsCapability;
import com.example.sos.model.AlertEnvelope;
import com.example.sos.model.Recipient;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class SmsChannel implements DeliveryChannel {

    private final SmsCapability sms;
    private final Duration timeout;

    public SmsChannel(
        SmsCapability sms,
        @ConfigProperty(
            name = "sos.delivery.sms.timeout",
            defaultValue = "PT30S"
        ) Duration timeout
    ) {
        this.sms = sms;
        this.timeout = timeout;
    }

    @Override
    public ChannelId id() {
        return ChannelId.SMS;
    }

    @Override
    public boolean available() {
        return sms.available();
    }

    @Override
    public boolean confirmsDelivery() {
        return true;
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
        int n = numbers.size();
        CompletionStage<SmsCapability.Result> sent;
        try {
            sent = sms.send(numbers, smsText(envelope));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return sent.thenApply(result ->
            switch (result) {
                case SENT -> ChannelResult.accepted(n, n);
                case CANCELLED -> ChannelResult.failed(n, "cancelled by user");
                case UNKNOWN -> ChannelResult.failed(n, "result unknown");
            }
        );
    }

    static String smsText(AlertEnvelope envelope) {
        StringBuilder sb = new StringBuilder(envelope.title())
            .append("\n\n")
            .append(envelope.message());
        if (envelope.trackingUrl() != null) {
            sb.append("\n\nLocation: ").append(envelope.trackingUrl());
        }
        return sb.toString();
    }
}
