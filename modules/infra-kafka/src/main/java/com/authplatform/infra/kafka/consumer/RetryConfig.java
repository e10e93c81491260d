package com.authplatform.infra.kafka.consumer;

import java.time.Duration;
import java.util.Objects;

public record RetryConfig(
    int maxAttempts, double backoffFactor, Duration initialDelay, boolean jitter) {
  public RetryConfig {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (backoffFactor < 1.0d) {
      throw new IllegalArgumentException("backoffFactor must be >= 1.0");
    }
    Objects.requireNonNull(initialDelay, "initialDelay must not be null");
    if (initialDelay.isNegative()) {
      throw new IllegalArgumentException("initialDelay must not be negative");
    }
  }

  public static RetryConfig of(int maxAttempts, Duration initialDelay, double backoffFactor) {
    return new RetryConfig(maxAttempts, backoffFactor, initialDelay, false);
  }

  public RetryConfig withJitter(boolean jitter) {
    return new RetryConfig(maxAttempts, backoffFactor, initialDelay, jitter);
  }
}
