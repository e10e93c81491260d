package com.authplatform.infra.kafka.observability;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class MicrometerKafkaTelemetryTest {
  @Test
  void shouldRecordPublishAndConsumeMetrics() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    MicrometerKafkaTelemetry telemetry = new MicrometerKafkaTelemetry(registry);

    telemetry.onPublishSuccess("auth.user.created", 5_000_000L);
    telemetry.onPublishFailure("auth.user.created", new IllegalStateException("boom"));
    telemetry.onConsumeSuccess("user.updated", "AuthEventConsumer#handleUserUpdated", 0, 8_000_000L);
    telemetry.onConsumeFailure(
        "user.updated", "AuthEventConsumer#handleUserUpdated", 0, new RuntimeException("bad"));

    assertEquals(
        1.0d,
        registry
            .get("infra.kafka.publish.total")
            .tag("topic", "auth.user.created")
            .tag("outcome", "success")
            .counter()
            .count());
    assertEquals(
        1.0d,
        registry
            .get("infra.kafka.publish.total")
            .tag("topic", "auth.user.created")
            .tag("outcome", "failure")
            .tag("error", "IllegalStateException")
            .counter()
            .count());
    assertEquals(
        1.0d,
        registry
            .get("infra.kafka.consume.total")
            .tag("handler", "AuthEventConsumer#handleUserUpdated")
            .tag("outcome", "success")
            .counter()
            .count());
    assertEquals(
        1.0d,
        registry
            .get("infra.kafka.consume.total")
            .tag("handler", "AuthEventConsumer#handleUserUpdated")
            .tag("outcome", "failure")
            .tag("error", "RuntimeException")
            .counter()
            .count());

    Timer publishTimer =
        registry.get("infra.kafka.publish.duration").tag("topic", "auth.user.created").timer();
    Timer consumeTimer =
        registry
            .get("infra.kafka.consume.duration")
            .tag("topic", "user.updated")
            .tag("handler", "AuthEventConsumer#handleUserUpdated")
            .timer();
    assertEquals(1L, publishTimer.count());
    assertEquals(1L, consumeTimer.count());
  }

  @Test
  void shouldRecordConnectionAndFallbackMetrics() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    MicrometerKafkaTelemetry telemetry = new MicrometerKafkaTelemetry(registry);

    telemetry.onConnect("producer", true);
    telemetry.onConnect("consumer", false);
    telemetry.onDeserializationFallback("user.updated", "value", new IllegalStateException("x"));
    telemetry.onDeserializationFallback(null, "key", new IllegalStateException("x"));

    assertEquals(
        1.0d,
        registry
            .get("infra.kafka.connection.total")
            .tag("role", "producer")
            .tag("outcome", "success")
            .counter()
            .count());
    assertEquals(
        1.0d,
        registry
            .get("infra.kafka.connection.total")
            .tag("role", "consumer")
            .tag("outcome", "failure")
            .counter()
            .count());
    assertEquals(
        1.0d,
        registry
            .get("infra.kafka.deserialization.fallback.total")
            .tag("topic", "user.updated")
            .tag("part", "value")
            .counter()
            .count());
    assertEquals(
        1.0d,
        registry
            .get("infra.kafka.deserialization.fallback.total")
            .tag("topic", "unknown")
            .tag("part", "key")
            .counter()
            .count());
  }
}
