package com.authplatform.infra.kafka.config;

import com.authplatform.infra.kafka.consumer.RetryConfig;
import com.authplatform.infra.kafka.errors.ExponentialBackoffRetryPolicy;
import com.authplatform.infra.kafka.errors.RetryPolicy;
import java.time.Duration;

public final class RetryPolicyFactory {
  static final Duration MAX_BACKOFF = Duration.ofMinutes(5);

  private RetryPolicyFactory() {}

  public static RetryPolicy create(RetryConfig retryConfig) {
    if (retryConfig == null || retryConfig.maxAttempts() <= 1) {
      return RetryPolicy.NONE;
    }
    return new ExponentialBackoffRetryPolicy(
        retryConfig.maxAttempts(),
        retryConfig.initialDelay(),
        MAX_BACKOFF,
        retryConfig.backoffFactor(),
        retryConfig.jitter());
  }
}
