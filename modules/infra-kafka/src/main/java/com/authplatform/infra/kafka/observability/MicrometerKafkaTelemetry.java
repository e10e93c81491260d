package com.authplatform.infra.kafka.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;

public class MicrometerKafkaTelemetry implements KafkaTelemetry {
  private final MeterRegistry meterRegistry;

  public MicrometerKafkaTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void onConnect(String role, boolean success) {
    Counter.builder("infra.kafka.connection.total")
        .description("Kafka client connection attempts by role and outcome")
        .tag("role", safeValue(role))
        .tag("outcome", success ? "success" : "failure")
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onPublishSuccess(String topic, long durationNanos) {
    Counter.builder("infra.kafka.publish.total")
        .description("Total Kafka publish attempts by outcome")
        .tag("topic", safeValue(topic))
        .tag("outcome", "success")
        .tag("error", "none")
        .register(meterRegistry)
        .increment();

    Timer.builder("infra.kafka.publish.duration")
        .description("Kafka publish latency")
        .tag("topic", safeValue(topic))
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onPublishFailure(String topic, Throwable error) {
    Counter.builder("infra.kafka.publish.total")
        .description("Total Kafka publish attempts by outcome")
        .tag("topic", safeValue(topic))
        .tag("outcome", "failure")
        .tag("error", safeError(error))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onConsumeSuccess(String topic, String handler, int partition, long durationNanos) {
    Counter.builder("infra.kafka.consume.total")
        .description("Total Kafka handler invocations by outcome")
        .tag("topic", safeValue(topic))
        .tag("handler", safeValue(handler))
        .tag("outcome", "success")
        .tag("error", "none")
        .register(meterRegistry)
        .increment();

    Timer.builder("infra.kafka.consume.duration")
        .description("Kafka handler processing latency")
        .tag("topic", safeValue(topic))
        .tag("handler", safeValue(handler))
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onConsumeFailure(String topic, String handler, int partition, Throwable error) {
    Counter.builder("infra.kafka.consume.total")
        .description("Total Kafka handler invocations by outcome")
        .tag("topic", safeValue(topic))
        .tag("handler", safeValue(handler))
        .tag("outcome", "failure")
        .tag("error", safeError(error))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onDeserializationFallback(String topic, String part, Throwable error) {
    Counter.builder("infra.kafka.deserialization.fallback.total")
        .description("Schema registry decode failures that fell back to JSON")
        .tag("topic", safeValue(topic))
        .tag("part", safeValue(part))
        .register(meterRegistry)
        .increment();
  }

  private static String safeValue(String value) {
    if (value == null || value.isBlank()) {
      return "unknown";
    }
    return value;
  }

  private static String safeError(Throwable error) {
    if (error == null) {
      return "none";
    }
    return error.getClass().getSimpleName();
  }
}
