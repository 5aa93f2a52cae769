package com.example.sos.delivery;

import com.example.sos.model.AlertEnvelope;
import com.example.sos.model.Recipient;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletionStage;

public interface DeliveryChannel {

    ChannelId id();

    boolean available();

    /**
     * Whether success on this channel means the alert reached someone. Channels that cannot
     * confirm are attempted as a supplement and never stop the fallback chain.
     */
    boolean confirmsDelivery();

    Duration timeout();

    CompletionStage<ChannelResult> send(
        List<Recipient> recipients,
        AlertEnvelope envelope,
        Duration timeout
    );
}
