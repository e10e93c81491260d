package com.authplatform.infra.kafka.producer;

import java.util.Map;

public record OutboundMessage<T>(T data, Object key, Map<String, String> headers) {
  public OutboundMessage {
    headers = headers == null ? Map.of() : headers;
  }

  public static <T> OutboundMessage<T> of(T data, Object key) {
    return new OutboundMessage<>(data, key, Map.of());
  }
}
