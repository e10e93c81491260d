package com.authplatform.infra.kafka.consumer;

import java.util.Map;

/**
 * One decoded record. A single instance is shared by every handler bound to the record's topic, so
 * handlers must treat it (and the decoded value) as read-only.
 */
public record DeserializedMessage<T>(
    Object key,
    T value,
    Map<String, String> headers,
    String topic,
    int partition,
    long offset,
    long timestamp) {
  public DeserializedMessage {
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }

  public String header(String name) {
    return headers.get(name);
  }
}
