package com.authplatform.infra.kafka.observability;

public class NoOpKafkaTelemetry implements KafkaTelemetry {
    @Override
    public void onConnect(String role, boolean success) {
    }

    @Override
    public void onPublishSuccess(String topic, long durationNanos) {
    }

    @Override
    public void onPublishFailure(String topic, Throwable error) {
    }

    @Override
    public void onConsumeSuccess(String topic, String handler, int partition, long durationNanos) {
    }

    @Override
    public void onConsumeFailure(String topic, String handler, int partition, Throwable error) {
    }

    @Override
    public void onDeserializationFallback(String topic, String part, Throwable error) {
    }
}
