package com.authplatform.infra.kafka.serde.schema;

public enum SchemaType {
  AVRO,
  JSON,
  PROTOBUF;

  public static SchemaType fromRegistryValue(String value) {
    if (value == null || value.isBlank()) {
      return AVRO;
    }
    return SchemaType.valueOf(value.trim().toUpperCase());
  }
}
