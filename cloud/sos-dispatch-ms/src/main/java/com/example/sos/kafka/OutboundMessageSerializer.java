package com.example.sos.kafka;

import com.example.sos.model.OutboundMessage;
import io.quarkus.kafka.client.serialization.ObjectMapperSerializer;

public class OutboundMessageSerializer extends ObjectMapperSerializer<OutboundMessage> {
}
