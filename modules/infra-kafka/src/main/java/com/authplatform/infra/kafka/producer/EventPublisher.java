package com.authplatform.infra.kafka.producer;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.apache.kafka.clients.producer.RecordMetadata;

public interface EventPublisher {
  CompletableFuture<RecordMetadata> emit(
      String topic, Object data, Object key, Map<String, String> headers, PublishOptions options);

  default CompletableFuture<RecordMetadata> emit(String topic, Object data, Object key) {
    return emit(topic, data, key, Map.of(), PublishOptions.defaults());
  }

  default CompletableFuture<RecordMetadata> send(
      String topic, Object data, Object key, Map<String, String> headers, PublishOptions options) {
    return emit(topic, data, key, headers, options);
  }

  /**
   * Emits every message concurrently. Completes when all complete, or exceptionally with the first
   * failure; publishes already in flight are not cancelled.
   */
  <T> CompletableFuture<List<RecordMetadata>> sendBatch(
      String topic, List<OutboundMessage<T>> messages, PublishOptions options);
}
