package com.authplatform.infra.kafka.consumer;

import java.lang.reflect.Type;
import java.time.Duration;

/**
 * What a handler subscribes to and how it is invoked. {@code partition}, {@code schemaType},
 * {@code timeout} and {@code retryConfig} are optional and may be {@code null}.
 */
public record EventPattern(
    String topic,
    Integer partition,
    boolean fromBeginning,
    Type schemaType,
    Duration timeout,
    RetryConfig retryConfig) {
  public EventPattern {
    if (topic == null || topic.isBlank()) {
      throw new IllegalArgumentException("topic must not be blank");
    }
    if (partition != null && partition < 0) {
      throw new IllegalArgumentException("partition must be >= 0");
    }
    if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
      timeout = null;
    }
  }

  public static EventPattern of(String topic) {
    return new EventPattern(topic, null, false, null, null, null);
  }

  public EventPattern withPartition(Integer partition) {
    return new EventPattern(topic, partition, fromBeginning, schemaType, timeout, retryConfig);
  }

  public EventPattern withFromBeginning(boolean fromBeginning) {
    return new EventPattern(topic, partition, fromBeginning, schemaType, timeout, retryConfig);
  }

  public EventPattern withSchemaType(Type schemaType) {
    return new EventPattern(topic, partition, fromBeginning, schemaType, timeout, retryConfig);
  }

  public EventPattern withTimeout(Duration timeout) {
    return new EventPattern(topic, partition, fromBeginning, schemaType, timeout, retryConfig);
  }

  public EventPattern withRetry(RetryConfig retryConfig) {
    return new EventPattern(topic, partition, fromBeginning, schemaType, timeout, retryConfig);
  }

  public boolean matchesPartition(int recordPartition) {
    return partition == null || partition == recordPartition;
  }
}
