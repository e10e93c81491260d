package com.authplatform.infra.kafka.registry;

import com.authplatform.infra.kafka.consumer.EventHandler;
import com.authplatform.infra.kafka.consumer.EventPattern;
import java.util.Objects;

public record HandlerBinding(
    EventPattern pattern, EventHandler<Object> handler, Object owner, String methodName) {
  public HandlerBinding {
    Objects.requireNonNull(pattern, "pattern must not be null");
    Objects.requireNonNull(handler, "handler must not be null");
    if (methodName == null || methodName.isBlank()) {
      methodName = "handle";
    }
  }

  /** Stable label used in logs and metrics, e.g. {@code AuthEventConsumer#handleUserBlocked}. */
  public String description() {
    String ownerName = owner == null ? "anonymous" : owner.getClass().getSimpleName();
    return ownerName + "#" + methodName;
  }
}
