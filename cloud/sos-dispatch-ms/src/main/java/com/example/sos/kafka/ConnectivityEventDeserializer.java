package com.example.sos.kafka;

import com.example.sos.model.ConnectivityEvent;
import io.quarkus.kafka.client.serialization.ObjectMapperDeserializer;

public class ConnectivityEventDeserializer extends ObjectMapperDeserializer<ConnectivityEvent> {
  public ConnectivityEventDeserializer() { super(ConnectivityEvent.class); }
}
