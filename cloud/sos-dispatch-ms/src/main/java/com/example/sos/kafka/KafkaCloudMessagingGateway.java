package com.example.sos.kafka;

import com.example.sos.capabilities.CloudMessagingCapability;
import com.example.sos.model.OutboundMessage;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import org.eclipse.microprofile.reactive.messaging.Channel;
import org.eclipse.microprofile.reactive.messaging.Emitter;
import org.jboss.logging.Logger;

@ApplicationScoped
public class KafkaCloudMessagingGateway implements CloudMessagingCapability {

    private static final Logger LOG = Logger.getLogger(
        KafkaCloudMessagingGateway.class
    );

    private final Emitter<OutboundMessage> emitter;
    private final Clock clock;

    public KafkaCloudMessagingGateway(
        @Channel("sos-outbound") Emitter<OutboundMessage> emitter,
        Clock clock
    ) {
        this.emitter = emitter;
        this.clock = clock;
    }

    @Override
    public boolean available() {
        return !emitter.isCancelled();
    }

    @Override
    public CompletionStage<SendResult> send(
        String number,
        Map<String, String> templateParams
    ) {
        OutboundMessage out = new OutboundMessage();
        out.messageId = UUID.randomUUID().toString();
        out.to = number;
        Map<String, String> params = new HashMap<>(templateParams);
        out.template = params.remove("template");
        out.params = params;
        out.createdAt = clock.instant();
        try {
            return emitter
                .send(out)
                .thenApply(v -> SendResult.sent(out.messageId));
        } catch (RuntimeException e) {
            // overflow or a terminated channel
            LOG.errorf(e, "Cloud message %s not accepted", out.messageId);
            return CompletableFuture.completedFuture(
                SendResult.failed(e.getMessage())
            );
        }
    }
}
