package com.authplatform.infra.kafka.serde;

import com.authplatform.infra.kafka.consumer.DeserializedMessage;
import com.authplatform.infra.kafka.observability.KafkaTelemetry;
import com.authplatform.infra.kafka.observability.NoOpKafkaTelemetry;
import com.authplatform.infra.kafka.serde.schema.SchemaRegistryCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SerializationCodec {
  private static final Logger log = LoggerFactory.getLogger(SerializationCodec.class);

  private final ObjectMapper objectMapper;
  private final SchemaRegistryCodec schemaRegistryCodec;
  private final KafkaTelemetry telemetry;

  public SerializationCodec(ObjectMapper objectMapper) {
    this(objectMapper, null, new NoOpKafkaTelemetry());
  }

  public SerializationCodec(
      ObjectMapper objectMapper, SchemaRegistryCodec schemaRegistryCodec, KafkaTelemetry telemetry) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    this.schemaRegistryCodec = schemaRegistryCodec;
    this.telemetry = telemetry == null ? new NoOpKafkaTelemetry() : telemetry;
  }

  public Optional<SchemaRegistryCodec> schemaRegistry() {
    return Optional.ofNullable(schemaRegistryCodec);
  }

  public DeserializedMessage<Object> deserialize(ConsumerRecord<byte[], byte[]> record) {
    Object key = decode(record.key(), record.topic(), "key");
    Object value = decode(record.value(), record.topic(), "value");
    return new DeserializedMessage<>(
        key,
        value,
        decodeHeaders(record.headers()),
        record.topic(),
        record.partition(),
        record.offset(),
        record.timestamp());
  }

  public Object decode(byte[] raw) {
    return decode(raw, null, "value");
  }

  /** Never throws: registry failures fall back to JSON, JSON failures fall back to the raw text. */
  Object decode(byte[] raw, String topic, String part) {
    if (raw == null) {
      return null;
    }
    if (schemaRegistryCodec != null) {
      try {
        return schemaRegistryCodec.decode(raw);
      } catch (RuntimeException ex) {
        log.warn(
            "Schema registry decode failed, falling back to JSON topic={} part={} error={}",
            topic,
            part,
            ex.getMessage());
        telemetry.onDeserializationFallback(topic, part, ex);
      }
    }
    return parseJsonOrText(raw);
  }

  /**
   * Encodes with the registry when a subject is given and a registry is configured, otherwise as
   * UTF-8 JSON. Failures propagate.
   */
  public byte[] encode(Object value, String subject) {
    if (value == null) {
      return null;
    }
    if (schemaRegistryCodec != null && subject != null && !subject.isBlank()) {
      return schemaRegistryCodec.encode(subject, value);
    }
    try {
      return objectMapper.writeValueAsBytes(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException(
          "Failed to encode value of type " + value.getClass().getName(), ex);
    }
  }

  public Map<String, String> decodeHeaders(Headers headers) {
    Map<String, String> decoded = new LinkedHashMap<>();
    if (headers == null) {
      return decoded;
    }
    for (Header header : headers) {
      if (header.value() == null) {
        continue;
      }
      decoded.put(header.key(), new String(header.value(), StandardCharsets.UTF_8));
    }
    return decoded;
  }

  public void encodeHeaders(Map<String, String> headers, Headers target) {
    if (headers == null) {
      return;
    }
    headers.forEach(
        (name, value) -> {
          if (name != null && value != null) {
            target.add(name, value.getBytes(StandardCharsets.UTF_8));
          }
        });
  }

  private Object parseJsonOrText(byte[] raw) {
    try {
      return objectMapper.readValue(raw, Object.class);
    } catch (IOException ex) {
      return new String(raw, StandardCharsets.UTF_8);
    }
  }
}
