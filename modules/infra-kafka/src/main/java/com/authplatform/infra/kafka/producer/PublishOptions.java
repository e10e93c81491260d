package com.authplatform.infra.kafka.producer;

import java.time.Duration;

public record PublishOptions(SchemaOptions schema, Duration timeout) {
  public PublishOptions {
    schema = schema == null ? SchemaOptions.NONE : schema;
  }

  public static PublishOptions defaults() {
    return new PublishOptions(SchemaOptions.NONE, null);
  }

  public static PublishOptions withTimeout(Duration timeout) {
    return new PublishOptions(SchemaOptions.NONE, timeout);
  }

  public PublishOptions withSchema(SchemaOptions schema) {
    return new PublishOptions(schema, timeout);
  }
}
