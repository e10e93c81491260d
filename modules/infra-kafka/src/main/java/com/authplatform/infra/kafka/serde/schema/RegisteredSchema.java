package com.authplatform.infra.kafka.serde.schema;

import java.util.Objects;

public record RegisteredSchema(int id, SchemaType type, String schema) {
  public RegisteredSchema {
    Objects.requireNonNull(type, "type must not be null");
    if (schema == null || schema.isBlank()) {
      throw new IllegalArgumentException("schema must not be blank");
    }
  }
}
