package com.example.sos.kafka;

import com.example.sos.capabilities.PushCapability;
import com.example.sos.model.PushNotification;
import com.example.sos.scheduling.ScheduledTask;
import com.example.sos.scheduling.TaskScheduler;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.eclipse.microprofile.reactive.messaging.Channel;
import org.eclipse.microprofile.reactive.messaging.Emitter;
import org.jboss.logging.Logger;

@ApplicationScoped
public class KafkaPushGateway implements PushCapability {

    private static final Logger LOG = Logger.getLogger(KafkaPushGateway.class);

    private final Emitter<PushNotification> emitter;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Map<String, ScheduledTask> pending = new ConcurrentHashMap<>();

    public KafkaPushGateway(
        @Channel("sos-push") Emitter<PushNotification> emitter,
        TaskScheduler scheduler,
        Clock clock
    ) {
        this.emitter = emitter;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @Override
    public boolean available() {
        return !emitter.isCancelled();
    }

    @Override
    public String schedule(Content content, Trigger trigger) {
        String id = UUID.randomUUID().toString();
        if (trigger.delay().isZero() || trigger.delay().isNegative()) {
            publish(id, content);
        } else {
            pending.put(
                id,
                scheduler.schedule(
                    trigger.delay(),
                    () -> {
                        pending.remove(id);
                        publish(id, content);
                    }
                )
            );
        }
        return id;
    }

    @Override
    public void cancel(String notificationId) {
        ScheduledTask task = pending.remove(notificationId);
        if (task != null) {
            task.cancel();
        }
    }

    private void publish(String id, Content content) {
        PushNotification n = new PushNotification();
        n.notificationId = id;
        n.title = content.title();
        n.body = content.body();
        n.category = content.category();
        n.recipients = content.recipients() == null
            ? List.of()
            : content.recipients();
        n.createdAt = clock.instant();
        try {
            emitter
                .send(n)
                .whenComplete((v, e) -> {
                    if (e != null) {
                        LOG.warnf("Push %s not acknowledged: %s", id, e.getMessage());
                    }
                });
        } catch (RuntimeException e) {
            LOG.errorf(e, "Push %s not accepted", id);
        }
    }
}
