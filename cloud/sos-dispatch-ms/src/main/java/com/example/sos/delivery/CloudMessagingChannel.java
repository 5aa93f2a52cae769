package com.example.sos.delivery;

import com.example.sos.capabilities.CloudMessagingCapability;
import com.example.sos.capabilities.CloudMessagingCapability.SendResult;
import com.example.sos.connectivity.ConnectivityMonitor;
import com.example.sos.model.AlertEnvelope;
import com.example.sos.model.Recipient;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@ApplicationScoped
public class CloudMessagingChannel implements DeliveryChannel {

    private static final Logger LOG = Logger.getLogger(
        CloudMessagingChannel.class
    );
    private static final String TIMEOUT = "timeout";

    private final CloudMessagingCapability cloud;
    private final ConnectivityMonitor connectivity;
    private final Duration timeout;

    public CloudMessagingChannel(
        CloudMessagingCapability cloud,
        ConnectivityMonitor connectivity,
        @ConfigProperty(
            name = "sos.delivery.cloud.timeout",
            defaultValue = "PT10S"
        ) Duration timeout
    ) {
        this.cloud = cloud;
        this.connectivity = connectivity;
        this.timeout = timeout;
    }

    @Override
    public ChannelId id() {
        return ChannelId.CLOUD;
    }

    @Override
    public boolean available() {
        return cloud.available() && connectivity.isOnline();
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
    public CompletableFuture<ChannelResult> send(
        List<Recipient> recipients,
        AlertEnvelope envelope,
        Duration timeout
    ) {
        Map<String, String> params = AlertParams.of(envelope);
        List<CompletableFuture<SendResult>> sends = recipients
            .stream()
            .map(r -> sendOne(r, params, timeout))
            .toList();
        return CompletableFuture
            .allOf(sends.toArray(CompletableFuture[]::new))
            .thenApply(v -> summarize(sends, recipients.size()));
    }

    private CompletableFuture<SendResult> sendOne(
        Recipient recipient,
        Map<String, String> params,
        Duration timeout
    ) {
        CompletableFuture<SendResult> f;
        try {
            f = cloud.send(recipient.phoneNumber(), params).toCompletableFuture();
        } catch (RuntimeException e) {
            f = CompletableFuture.failedFuture(e);
        }
        return f
            .completeOnTimeout(
                SendResult.failed(TIMEOUT),
                timeout.toMillis(),
                TimeUnit.MILLISECONDS
            )
            .exceptionally(e -> SendResult.failed(e.getMessage()));
    }

    private static ChannelResult summarize(
        List<CompletableFuture<SendResult>> sends,
        int targeted
    ) {
        int accepted = 0;
        int timedOut = 0;
        for (CompletableFuture<SendResult> f : sends) {
            SendResult r = f.join();
            if (r.success()) {
                accepted++;
            } else if (TIMEOUT.equals(r.error())) {
                timedOut++;
            }
        }
        if (accepted == 0 && timedOut == targeted && targeted > 0) {
            return ChannelResult.timedOut(targeted);
        }
        if (accepted < targeted) {
            LOG.warnf("Cloud messaging accepted %d of %d", accepted, targeted);
        }
        return accepted > 0
            ? ChannelResult.accepted(accepted, targeted)
            : ChannelResult.failed(targeted, "no recipient accepted");
    }
}
