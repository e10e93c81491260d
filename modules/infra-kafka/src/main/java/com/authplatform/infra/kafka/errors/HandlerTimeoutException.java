package com.authplatform.infra.kafka.errors;

import java.time.Duration;

public class HandlerTimeoutException extends RuntimeException {
  private final Duration timeout;

  public HandlerTimeoutException(String handler, Duration timeout) {
    super("Handler timed out handler=" + handler + " timeoutMs=" + timeout.toMillis());
    this.timeout = timeout;
  }

  public Duration getTimeout() {
    return timeout;
  }
}
