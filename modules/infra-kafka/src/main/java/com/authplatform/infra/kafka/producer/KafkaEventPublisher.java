package com.authplatform.infra.kafka.producer;

import com.authplatform.infra.kafka.client.KafkaClient;
import com.authplatform.infra.kafka.observability.KafkaTelemetry;
import com.authplatform.infra.kafka.serde.SerializationCodec;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Each emit runs encode, registry lookup and send on a publish thread, so the timeout covers the
 * whole operation. A timed-out emit is not cancelled and may still reach the broker.
 */
public class KafkaEventPublisher implements EventPublisher, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(KafkaEventPublisher.class);

  private final KafkaClient client;
  private final SerializationCodec codec;
  private final KafkaTelemetry telemetry;
  private final Duration defaultTimeout;
  private final ExecutorService publishExecutor;

  public KafkaEventPublisher(
      KafkaClient client,
      SerializationCodec codec,
      KafkaTelemetry telemetry,
      Duration defaultTimeout) {
    this(
        client,
        codec,
        telemetry,
        defaultTimeout,
        Executors.newCachedThreadPool(publishThreadFactory()));
  }

  public KafkaEventPublisher(
      KafkaClient client,
      SerializationCodec codec,
      KafkaTelemetry telemetry,
      Duration defaultTimeout,
      ExecutorService publishExecutor) {
    this.client = Objects.requireNonNull(client, "client must not be null");
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    this.defaultTimeout = defaultTimeout == null ? Duration.ZERO : defaultTimeout;
    this.publishExecutor =
        Objects.requireNonNull(publishExecutor, "publishExecutor must not be null");
  }

  @Override
  public CompletableFuture<RecordMetadata> emit(
      String topic, Object data, Object key, Map<String, String> headers, PublishOptions options) {
    if (topic == null || topic.isBlank()) {
      throw new IllegalArgumentException("topic must not be blank");
    }
    PublishOptions effective = options == null ? PublishOptions.defaults() : options;
    long started = System.nanoTime();

    CompletableFuture<RecordMetadata> sendFuture;
    try {
      CompletableFuture<RecordMetadata> operation =
          CompletableFuture.supplyAsync(
                  () -> toRecord(topic, data, key, headers, effective.schema()), publishExecutor)
              .thenCompose(client::send);
      sendFuture = applyTimeout(operation, effective.timeout());
    } catch (RuntimeException ex) {
      sendFuture = CompletableFuture.failedFuture(ex);
    }

    CompletableFuture<RecordMetadata> result = new CompletableFuture<>();
    sendFuture.whenComplete(
        (metadata, throwable) -> {
          if (throwable == null) {
            telemetry.onPublishSuccess(topic, System.nanoTime() - started);
            log.debug(
                "Published Kafka event topic={} key={} partition={} offset={}",
                topic,
                key,
                metadata == null ? null : metadata.partition(),
                metadata == null ? null : metadata.offset());
            result.complete(metadata);
            return;
          }

          KafkaPublishException publishException = wrapPublishException(topic, key, throwable);
          telemetry.onPublishFailure(
              topic,
              publishException.getCause() == null ? publishException : publishException.getCause());
          log.error(
              "Failed to publish Kafka event topic={} key={} error={}",
              topic,
              key,
              publishException.getMessage());
          result.completeExceptionally(publishException);
        });
    return result;
  }

  @Override
  public <T> CompletableFuture<List<RecordMetadata>> sendBatch(
      String topic, List<OutboundMessage<T>> messages, PublishOptions options) {
    if (messages == null || messages.isEmpty()) {
      return CompletableFuture.completedFuture(List.of());
    }
    List<CompletableFuture<RecordMetadata>> publishes = new ArrayList<>(messages.size());
    for (OutboundMessage<T> message : messages) {
      publishes.add(emit(topic, message.data(), message.key(), message.headers(), options));
    }

    CompletableFuture<List<RecordMetadata>> result = new CompletableFuture<>();
    for (CompletableFuture<RecordMetadata> publish : publishes) {
      publish.whenComplete(
          (metadata, throwable) -> {
            if (throwable != null) {
              result.completeExceptionally(unwrap(throwable));
            }
          });
    }
    CompletableFuture.allOf(publishes.toArray(new CompletableFuture<?>[0]))
        .whenComplete(
            (ignored, throwable) -> {
              if (throwable != null) {
                return;
              }
              List<RecordMetadata> metadata = publishes.stream().map(CompletableFuture::join).toList();
              log.info("Published Kafka batch topic={} size={}", topic, metadata.size());
              result.complete(metadata);
            });
    return result;
  }

  private ProducerRecord<byte[], byte[]> toRecord(
      String topic, Object data, Object key, Map<String, String> headers, SchemaOptions schema) {
    byte[] keyBytes = codec.encode(key, schema.keySchema());
    byte[] valueBytes = codec.encode(data, schema.valueSchema());
    ProducerRecord<byte[], byte[]> record = new ProducerRecord<>(topic, keyBytes, valueBytes);
    codec.encodeHeaders(headers, record.headers());
    return record;
  }

  private CompletableFuture<RecordMetadata> applyTimeout(
      CompletableFuture<RecordMetadata> sendFuture, Duration requested) {
    Duration timeout = requested == null ? defaultTimeout : requested;
    if (timeout.isZero() || timeout.isNegative()) {
      return sendFuture;
    }
    return sendFuture.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  private KafkaPublishException wrapPublishException(String topic, Object key, Throwable throwable) {
    Throwable cause = unwrap(throwable);
    if (cause instanceof KafkaPublishException existing) {
      return existing;
    }

    String message;
    if (cause instanceof TimeoutException) {
      message = "Timed out publishing event to Kafka topic=" + topic + " key=" + key;
    } else {
      message = "Failed to publish event to Kafka topic=" + topic + " key=" + key;
    }
    return new KafkaPublishException(topic, key, message, cause);
  }

  private static Throwable unwrap(Throwable throwable) {
    if (throwable instanceof CompletionException completionException
        && completionException.getCause() != null) {
      return completionException.getCause();
    }
    return throwable;
  }

  @Override
  public void close() {
    // publishes already running are left to finish
    publishExecutor.shutdown();
  }

  private static ThreadFactory publishThreadFactory() {
    AtomicInteger sequence = new AtomicInteger();
    return new ThreadFactory() {
      @Override
      public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, "kafka-publish-" + sequence.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      }
    };
  }
}
