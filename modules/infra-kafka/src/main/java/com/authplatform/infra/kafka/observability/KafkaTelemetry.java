package com.authplatform.infra.kafka.observability;

public interface KafkaTelemetry {
  void onConnect(String role, boolean success);

  void onPublishSuccess(String topic, long durationNanos);

  void onPublishFailure(String topic, Throwable error);

  void onConsumeSuccess(String topic, String handler, int partition, long durationNanos);

  void onConsumeFailure(String topic, String handler, int partition, Throwable error);

  void onDeserializationFallback(String topic, String part, Throwable error);
}
