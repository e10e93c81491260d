package com.authplatform.authevents.publisher;

import com.authplatform.authevents.contract.AuthEventHeaders;
import com.authplatform.authevents.contract.AuthEventTypes;
import com.authplatform.authevents.contract.BaseEvent;
import com.authplatform.authevents.contract.payload.OtpRequestedPayload;
import com.authplatform.authevents.contract.payload.UserCreatedPayload;
import com.authplatform.authevents.topics.AuthTopics;
import com.authplatform.infra.kafka.manager.KafkaManager;
import com.authplatform.infra.kafka.producer.EventPublisher;
import com.authplatform.infra.kafka.producer.OutboundMessage;
import com.authplatform.infra.kafka.producer.PublishOptions;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.apache.kafka.clients.producer.RecordMetadata;

/**
 * Publishes through the manager's {@link EventPublisher}, resolved on first use because the manager
 * only hands it out once initialized.
 */
public class KafkaAuthEventPublisher implements AuthEventPublisher {
  private final KafkaManager kafkaManager;
  private final Clock clock;
  private volatile EventPublisher publisher;

  public KafkaAuthEventPublisher(KafkaManager kafkaManager) {
    this(kafkaManager, Clock.systemUTC());
  }

  public KafkaAuthEventPublisher(KafkaManager kafkaManager, Clock clock) {
    this.kafkaManager = Objects.requireNonNull(kafkaManager, "kafkaManager must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  @Override
  public <T> CompletableFuture<RecordMetadata> publish(
      String topic, T data, Object key, Map<String, String> headers, PublishOptions options) {
    return publisher().send(topic, data, key, headers, options);
  }

  @Override
  public <T> CompletableFuture<List<RecordMetadata>> publishBatch(
      String topic, List<OutboundMessage<T>> messages, PublishOptions options) {
    return publisher().sendBatch(topic, messages, options);
  }

  @Override
  public CompletableFuture<RecordMetadata> publishUserCreated(
      UserCreatedPayload payload, String correlationId) {
    Objects.requireNonNull(payload, "payload must not be null");
    String key = requireKey(payload.userId(), "payload.userId");
    BaseEvent<UserCreatedPayload> event =
        BaseEvent.create(AuthEventTypes.AUTH_USER_CREATED, clock.millis(), correlationId, payload);
    return publish(
        AuthTopics.AUTH_USER_CREATED, event, key, headers(event), PublishOptions.defaults());
  }

  @Override
  public CompletableFuture<RecordMetadata> publishOtpRequested(
      OtpRequestedPayload payload, String correlationId) {
    Objects.requireNonNull(payload, "payload must not be null");
    String key = requireKey(payload.userId(), "payload.userId");
    BaseEvent<OtpRequestedPayload> event =
        BaseEvent.create(AuthEventTypes.OTP_REQUESTED, clock.millis(), correlationId, payload);
    return publish(
        AuthTopics.AUTH_OTP_REQUESTED, event, key, headers(event), PublishOptions.defaults());
  }

  private EventPublisher publisher() {
    EventPublisher resolved = publisher;
    if (resolved == null) {
      resolved = kafkaManager.getPublisher();
      publisher = resolved;
    }
    return resolved;
  }

  private static Map<String, String> headers(BaseEvent<?> event) {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put(AuthEventHeaders.X_EVENT_TYPE, event.eventType());
    headers.put(AuthEventHeaders.X_EVENT_VERSION, event.eventVersion());
    if (event.correlationId() != null && !event.correlationId().isBlank()) {
      headers.put(AuthEventHeaders.X_CORRELATION_ID, event.correlationId());
    }
    return headers;
  }

  private static String requireKey(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " must not be blank");
    }
    return value;
  }
}
