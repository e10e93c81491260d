package com.authplatform.infra.kafka.client;

import java.util.Map;

public record KafkaHealth(Status status, Map<String, Object> details) {
  public enum Status {
    HEALTHY,
    UNHEALTHY
  }

  public KafkaHealth {
    details = details == null ? Map.of() : Map.copyOf(details);
  }

  public static KafkaHealth healthy(Map<String, Object> details) {
    return new KafkaHealth(Status.HEALTHY, details);
  }

  public static KafkaHealth unhealthy(String error) {
    return new KafkaHealth(Status.UNHEALTHY, Map.of("error", error == null ? "unknown" : error));
  }

  public boolean isHealthy() {
    return status == Status.HEALTHY;
  }
}
