package com.authplatform.infra.kafka.producer;

/** Registry subjects for the key and the value; either may be {@code null} for plain JSON. */
public record SchemaOptions(String keySchema, String valueSchema) {
  public static final SchemaOptions NONE = new SchemaOptions(null, null);

  public static SchemaOptions value(String valueSchema) {
    return new SchemaOptions(null, valueSchema);
  }
}
