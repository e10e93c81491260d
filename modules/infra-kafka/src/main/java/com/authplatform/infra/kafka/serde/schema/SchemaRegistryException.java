package com.authplatform.infra.kafka.serde.schema;

public class SchemaRegistryException extends RuntimeException {
  private final int statusCode;

  public SchemaRegistryException(String message) {
    this(message, -1, null);
  }

  public SchemaRegistryException(String message, Throwable cause) {
    this(message, -1, cause);
  }

  public SchemaRegistryException(String message, int statusCode, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  /** HTTP status returned by the registry, or -1 when the failure happened locally. */
  public int getStatusCode() {
    return statusCode;
  }
}
