package com.authplatform.infra.kafka.errors;

public class KafkaConnectionException extends RuntimeException {
  private final String role;

  public KafkaConnectionException(String role, String message, Throwable cause) {
    super(message, cause);
    this.role = role;
  }

  /** {@code producer} or {@code consumer}. */
  public String getRole() {
    return role;
  }
}
