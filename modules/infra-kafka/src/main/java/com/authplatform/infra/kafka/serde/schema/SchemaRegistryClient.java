package com.authplatform.infra.kafka.serde.schema;

public interface SchemaRegistryClient {
  RegisteredSchema getLatestSchema(String subject);

  RegisteredSchema getSchemaById(int id);

  int register(String subject, String schema, SchemaType schemaType);
}
