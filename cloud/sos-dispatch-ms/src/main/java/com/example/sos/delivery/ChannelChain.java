package com.example.sos.delivery;

import com.example.sos.model.AlertEnvelope;
import com.example.sos.model.Recipient;
import io.quarkus.arc.All;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jboss.logging.Logger;

/**
 * Runs an envelope through the delivery channels in priority order. Confirming channels stop
 * at the first success; supplementary channels are always tried afterwards. Never enqueues:
 * callers decide what a failed report means.
 */
@ApplicationScoped
public class ChannelChain {

    private static final Logger LOG = Logger.getLogger(ChannelChain.class);

    // slack on top of a channel's own timeout before the chain gives up waiting
    private static final long GRACE_MS = 250L;

    private final List<DeliveryChannel> confirming;
    private final List<DeliveryChannel> supplementary;
    private final Clock clock;

    public ChannelChain(@All List<DeliveryChannel> channels, Clock clock) {
        List<DeliveryChannel> ordered = new ArrayList<>(channels);
        ordered.sort(Comparator.comparing(DeliveryChannel::id));
        this.confirming = ordered
            .stream()
            .filter(DeliveryChannel::confirmsDelivery)
            .toList();
        this.supplementary = ordered
            .stream()
            .filter(c -> !c.confirmsDelivery())
            .toList();
        this.clock = clock;
    }

    public DeliveryReport deliver(
        List<Recipient> recipients,
        AlertEnvelope envelope
    ) {
        List<DeliveryAttempt> attempts = new ArrayList<>();
        DeliveryAttempt success = null;

        for (DeliveryChannel channel : confirming) {
            if (!channel.available()) {
                LOG.infof(
                    "Alert %s: channel %s unavailable, skipping",
                    envelope.id(),
                    channel.id()
                );
                continue;
            }
            DeliveryAttempt attempt = attempt(channel, recipients, envelope);
            attempts.add(attempt);
            if (attempt.outcome() == AttemptOutcome.SENT) {
                success = attempt;
                break;
            }
        }

        for (DeliveryChannel channel : supplementary) {
            if (channel.available()) {
                attempts.add(attempt(channel, recipients, envelope));
            }
        }

        if (success == null) {
            LOG.warnf(
                "Alert %s: no confirming channel delivered (%d attempt(s))",
                envelope.id(),
                attempts.size()
            );
            return new DeliveryReport(false, null, 0, recipients.size(), attempts);
        }
        return new DeliveryReport(
            true,
            success.channel(),
            success.accepted(),
            recipients.size(),
            attempts
        );
    }

    private DeliveryAttempt attempt(
        DeliveryChannel channel,
        List<Recipient> recipients,
        AlertEnvelope envelope
    ) {
        Instant at = clock.instant();
        try {
            ChannelResult r = channel
                .send(recipients, envelope, channel.timeout())
                .toCompletableFuture()
                .get(channel.timeout().toMillis() + GRACE_MS, TimeUnit.MILLISECONDS);
            AttemptOutcome outcome = r.sent()
                ? AttemptOutcome.SENT
                : r.timedOut() ? AttemptOutcome.TIMED_OUT : AttemptOutcome.FAILED;
            LOG.infof(
                "Alert %s: %s %s (%d/%d accepted)",
                envelope.id(),
                channel.id(),
                outcome,
                r.accepted(),
                r.targeted()
            );
            return new DeliveryAttempt(channel.id(), outcome, at, r.accepted(), r.detail());
        } catch (TimeoutException e) {
            LOG.warnf(
                "Alert %s: %s timed out after %d ms",
                envelope.id(),
                channel.id(),
                channel.timeout().toMillis()
            );
            return new DeliveryAttempt(
                channel.id(),
                AttemptOutcome.TIMED_OUT,
                at,
                0,
                "timed out"
            );
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOG.warnf(
                "Alert %s: %s failed: %s",
                envelope.id(),
                channel.id(),
                cause.getMessage()
            );
            return new DeliveryAttempt(
                channel.id(),
                AttemptOutcome.FAILED,
                at,
                0,
                cause.getMessage()
            );
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new DeliveryAttempt(
                channel.id(),
                AttemptOutcome.FAILED,
                at,
                0,
                "interrupted"
            );
        } catch (RuntimeException e) {
            LOG.errorf(e, "Alert %s: %s threw", envelope.id(), channel.id());
            return new DeliveryAttempt(
                channel.id(),
                AttemptOutcome.FAILED,
                at,
                0,
                e.getMessage()
            );
        }
    }
}
