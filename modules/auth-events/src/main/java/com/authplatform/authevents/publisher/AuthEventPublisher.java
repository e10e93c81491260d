package com.authplatform.authevents.publisher;

import com.authplatform.authevents.contract.payload.OtpRequestedPayload;
import com.authplatform.authevents.contract.payload.UserCreatedPayload;
import com.authplatform.infra.kafka.producer.OutboundMessage;
import com.authplatform.infra.kafka.producer.PublishOptions;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.apache.kafka.clients.producer.RecordMetadata;

/** Outbound side of the auth service, so other services can react to account changes. */
public interface AuthEventPublisher {
  <T> CompletableFuture<RecordMetadata> publish(
      String topic, T data, Object key, Map<String, String> headers, PublishOptions options);

  default <T> CompletableFuture<RecordMetadata> publish(String topic, T data, Object key) {
    return publish(topic, data, key, Map.of(), PublishOptions.defaults());
  }

  <T> CompletableFuture<List<RecordMetadata>> publishBatch(
      String topic, List<OutboundMessage<T>> messages, PublishOptions options);

  CompletableFuture<RecordMetadata> publishUserCreated(
      UserCreatedPayload payload, String correlationId);

  CompletableFuture<RecordMetadata> publishOtpRequested(
      OtpRequestedPayload payload, String correlationId);
}
