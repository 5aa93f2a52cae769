package com.example.sos.kafka;

import com.example.sos.model.PushNotification;
import io.quarkus.kafka.client.serialization.ObjectMapperSerializer;

public class PushNotificationSerializer extends ObjectMapperSerializer<PushNotification> {
}
