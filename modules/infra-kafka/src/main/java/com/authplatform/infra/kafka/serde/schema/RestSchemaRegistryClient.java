package com.authplatform.infra.kafka.serde.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

public class RestSchemaRegistryClient implements SchemaRegistryClient {
  private static final Logger log = LoggerFactory.getLogger(RestSchemaRegistryClient.class);

  static final MediaType SCHEMA_REGISTRY_JSON =
      MediaType.parseMediaType("application/vnd.schemaregistry.v1+json");

  private final RestClient restClient;
  private final ObjectMapper objectMapper;
  private final Map<Integer, RegisteredSchema> schemasById = new ConcurrentHashMap<>();

  public RestSchemaRegistryClient(RestClient restClient, ObjectMapper objectMapper) {
    this.restClient = Objects.requireNonNull(restClient, "restClient must not be null");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
  }

  @Override
  public RegisteredSchema getLatestSchema(String subject) {
    requireSubject(subject);
    String body = get("/subjects/{subject}/versions/latest", subject);
    JsonNode root = parseJson(body);
    RegisteredSchema schema =
        new RegisteredSchema(
            requiredInt(root, "id"),
            SchemaType.fromRegistryValue(root.path("schemaType").asText(null)),
            requiredText(root, "schema"));
    schemasById.putIfAbsent(schema.id(), schema);
    return schema;
  }

  @Override
  public RegisteredSchema getSchemaById(int id) {
    RegisteredSchema cached = schemasById.get(id);
    if (cached != null) {
      return cached;
    }
    String body = get("/schemas/ids/{id}", id);
    JsonNode root = parseJson(body);
    RegisteredSchema schema =
        new RegisteredSchema(
            id,
            SchemaType.fromRegistryValue(root.path("schemaType").asText(null)),
            requiredText(root, "schema"));
    schemasById.put(id, schema);
    return schema;
  }

  @Override
  public int register(String subject, String schema, SchemaType schemaType) {
    requireSubject(subject);
    if (schema == null || schema.isBlank()) {
      throw new IllegalArgumentException("schema must not be blank");
    }
    SchemaType effectiveType = schemaType == null ? SchemaType.AVRO : schemaType;

    ObjectNode request = objectMapper.createObjectNode();
    request.put("schema", schema);
    if (effectiveType != SchemaType.AVRO) {
      request.put("schemaType", effectiveType.name());
    }

    String body;
    try {
      body =
          restClient
              .post()
              .uri("/subjects/{subject}/versions", subject)
              .contentType(SCHEMA_REGISTRY_JSON)
              .accept(SCHEMA_REGISTRY_JSON, MediaType.APPLICATION_JSON)
              .body(request.toString())
              .retrieve()
              .onStatus(HttpStatusCode::isError, (req, response) -> raiseRegistryException(response))
              .body(String.class);
    } catch (RestClientException ex) {
      throw new SchemaRegistryException("Schema registry request failed subject=" + subject, ex);
    }

    int id = requiredInt(parseJson(body), "id");
    schemasById.put(id, new RegisteredSchema(id, effectiveType, schema));
    log.info("Registered schema subject={} schemaType={} id={}", subject, effectiveType, id);
    return id;
  }

  private String get(String uriTemplate, Object variable) {
    try {
      return restClient
          .get()
          .uri(uriTemplate, variable)
          .accept(SCHEMA_REGISTRY_JSON, MediaType.APPLICATION_JSON)
          .retrieve()
          .onStatus(HttpStatusCode::isError, (req, response) -> raiseRegistryException(response))
          .body(String.class);
    } catch (RestClientException ex) {
      throw new SchemaRegistryException(
          "Schema registry request failed path=" + uriTemplate + " value=" + variable, ex);
    }
  }

  private void raiseRegistryException(ClientHttpResponse response) throws IOException {
    int status = response.getStatusCode().value();
    String body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
    throw new SchemaRegistryException(
        "Schema registry responded status=" + status + " message=" + errorMessage(body),
        status,
        null);
  }

  private String errorMessage(String body) {
    if (body == null || body.isBlank()) {
      return "<empty>";
    }
    try {
      JsonNode node = objectMapper.readTree(body);
      return node.hasNonNull("message") ? node.get("message").asText() : body;
    } catch (IOException ex) {
      return body;
    }
  }

  private JsonNode parseJson(String body) {
    if (body == null || body.isBlank()) {
      throw new SchemaRegistryException("Schema registry returned an empty body");
    }
    try {
      return objectMapper.readTree(body);
    } catch (IOException ex) {
      throw new SchemaRegistryException("Schema registry returned malformed JSON", ex);
    }
  }

  private static int requiredInt(JsonNode root, String field) {
    JsonNode node = root.get(field);
    if (node == null || !node.canConvertToInt()) {
      throw new SchemaRegistryException("Schema registry response is missing field: " + field);
    }
    return node.intValue();
  }

  private static String requiredText(JsonNode root, String field) {
    JsonNode node = root.get(field);
    if (node == null || node.isNull() || node.asText().isBlank()) {
      throw new SchemaRegistryException("Schema registry response is missing field: " + field);
    }
    return node.asText();
  }

  private static void requireSubject(String subject) {
    if (subject == null || subject.isBlank()) {
      throw new IllegalArgumentException("subject must not be blank");
    }
  }
}
