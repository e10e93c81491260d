package com.authplatform.infra.kafka.errors;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/** Bounded attempts with exponentially growing delays, optionally with full jitter. */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final int maxAttempts;
  private final Duration initialDelay;
  private final Duration maxDelay;
  private final double backoffFactor;
  private final boolean jitter;
  private final DoubleSupplier jitterSource;

  public ExponentialBackoffRetryPolicy(
      int maxAttempts, Duration initialDelay, Duration maxDelay, double backoffFactor) {
    this(maxAttempts, initialDelay, maxDelay, backoffFactor, false, () -> 1.0d);
  }

  public ExponentialBackoffRetryPolicy(
      int maxAttempts,
      Duration initialDelay,
      Duration maxDelay,
      double backoffFactor,
      boolean jitter) {
    this(
        maxAttempts,
        initialDelay,
        maxDelay,
        backoffFactor,
        jitter,
        () -> ThreadLocalRandom.current().nextDouble());
  }

  public ExponentialBackoffRetryPolicy(
      int maxAttempts,
      Duration initialDelay,
      Duration maxDelay,
      double backoffFactor,
      boolean jitter,
      DoubleSupplier jitterSource) {
    this.maxAttempts = Math.max(1, maxAttempts);
    this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay must not be null");
    this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay must not be null");
    this.backoffFactor = Math.max(1.0d, backoffFactor);
    this.jitter = jitter;
    this.jitterSource = Objects.requireNonNull(jitterSource, "jitterSource must not be null");
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  @Override
  public boolean shouldRetry(int attempt, Exception exception) {
    return attempt < maxAttempts;
  }

  @Override
  public Duration backoffForAttempt(int attempt) {
    long deterministic = exponentialDelayMillis(attempt);
    if (!jitter || deterministic == 0L) {
      return Duration.ofMillis(deterministic);
    }
    // full jitter: uniform in [0, deterministic]
    double factor = Math.max(0.0d, Math.min(0.999999999d, jitterSource.getAsDouble()));
    long jittered = (long) Math.floor(factor * (deterministic + 1L));
    return Duration.ofMillis(Math.max(0L, Math.min(deterministic, jittered)));
  }

  private long exponentialDelayMillis(int attempt) {
    long initialDelayMillis = Math.max(0L, initialDelay.toMillis());
    long maxDelayMillis = Math.max(initialDelayMillis, maxDelay.toMillis());
    if (initialDelayMillis == 0L) {
      return 0L;
    }

    // initialDelay * backoffFactor^(attempt - 1), capped
    double delay = initialDelayMillis * Math.pow(backoffFactor, Math.max(0, attempt - 1));
    return Math.max(0L, (long) Math.min(maxDelayMillis, delay));
  }
}
