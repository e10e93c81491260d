package com.authplatform.infra.kafka.consumer;

import com.authplatform.infra.kafka.config.RetryPolicyFactory;
import com.authplatform.infra.kafka.errors.RetryExecutor;
import com.authplatform.infra.kafka.observability.KafkaTelemetry;
import com.authplatform.infra.kafka.registry.HandlerBinding;
import com.authplatform.infra.kafka.registry.HandlerRegistry;
import com.authplatform.infra.kafka.serde.SerializationCodec;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands one record to every matching binding, in registration order, one after the other. A
 * failing binding is logged and skipped; it never stops the siblings or the consumption loop.
 */
public class MessageDispatcher {
  private static final Logger log = LoggerFactory.getLogger(MessageDispatcher.class);

  private final HandlerRegistry registry;
  private final SerializationCodec codec;
  private final PayloadBinder payloadBinder;
  private final RetryExecutor retryExecutor;
  private final KafkaTelemetry telemetry;

  public MessageDispatcher(
      HandlerRegistry registry,
      SerializationCodec codec,
      PayloadBinder payloadBinder,
      RetryExecutor retryExecutor,
      KafkaTelemetry telemetry) {
    this.registry = Objects.requireNonNull(registry, "registry must not be null");
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
    this.payloadBinder = Objects.requireNonNull(payloadBinder, "payloadBinder must not be null");
    this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
  }

  public void dispatch(ConsumerRecord<byte[], byte[]> record) {
    List<HandlerBinding> bindings = registry.getBindings(record.topic());
    if (bindings.isEmpty()) {
      log.warn(
          "Dropping Kafka record without handlers topic={} partition={} offset={}",
          record.topic(),
          record.partition(),
          record.offset());
      return;
    }

    DeserializedMessage<Object> message = null;
    for (HandlerBinding binding : bindings) {
      if (!binding.pattern().matchesPartition(record.partition())) {
        continue;
      }
      if (message == null) {
        message = codec.deserialize(record);
      }
      invoke(binding, message);
    }
  }

  private void invoke(HandlerBinding binding, DeserializedMessage<Object> message) {
    EventPattern pattern = binding.pattern();
    String handlerName = binding.description();
    long started = System.nanoTime();
    try {
      EventHandler<Object> bound =
          (value, shared) ->
              binding.handler().handle(payloadBinder.bind(value, pattern.schemaType()), shared);
      retryExecutor
          .wrap(
              handlerName,
              bound,
              RetryPolicyFactory.create(pattern.retryConfig()),
              pattern.timeout())
          .invoke(message.value(), message)
          .join();
      telemetry.onConsumeSuccess(
          message.topic(), handlerName, message.partition(), System.nanoTime() - started);
      log.debug(
          "Handled Kafka record topic={} partition={} offset={} handler={}",
          message.topic(),
          message.partition(),
          message.offset(),
          handlerName);
    } catch (RuntimeException ex) {
      Throwable cause = unwrap(ex);
      telemetry.onConsumeFailure(message.topic(), handlerName, message.partition(), cause);
      log.error(
          "Kafka handler failed topic={} partition={} offset={} handler={}",
          message.topic(),
          message.partition(),
          message.offset(),
          handlerName,
          cause);
    }
  }

  private static Throwable unwrap(Throwable throwable) {
    if (throwable instanceof CompletionException completionException
        && completionException.getCause() != null) {
      return completionException.getCause();
    }
    return throwable;
  }
}
