package com.authplatform.infra.kafka.errors;

import java.time.Duration;

public interface RetryPolicy {
  RetryPolicy NONE =
      new RetryPolicy() {
        @Override
        public boolean shouldRetry(int attempt, Exception exception) {
          return false;
        }

        @Override
        public Duration backoffForAttempt(int attempt) {
          return Duration.ZERO;
        }
      };

  boolean shouldRetry(int attempt, Exception exception);

  /** Delay before the attempt that follows {@code attempt} (1-based). */
  Duration backoffForAttempt(int attempt);

  default boolean isRetryable(Exception exception) {
    return true;
  }
}
