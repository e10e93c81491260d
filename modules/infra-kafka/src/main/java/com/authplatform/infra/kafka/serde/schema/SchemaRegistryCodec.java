package com.authplatform.infra.kafka.serde.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.avro.AvroRuntimeException;
import org.apache.avro.Schema;
import org.apache.avro.SchemaParseException;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.io.BinaryEncoder;
import org.apache.avro.io.Decoder;
import org.apache.avro.io.DecoderFactory;
import org.apache.avro.io.EncoderFactory;

/**
 * Registry wire format: magic byte {@code 0}, a 4-byte big-endian schema id, then the body. AVRO
 * bodies are Avro binary, JSON bodies are UTF-8 JSON.
 */
public class SchemaRegistryCodec {
  static final byte MAGIC_BYTE = 0;
  static final int HEADER_LENGTH = 5;

  private final SchemaRegistryClient registryClient;
  private final ObjectMapper objectMapper;
  private final Map<Integer, Schema> avroSchemas = new ConcurrentHashMap<>();

  public SchemaRegistryCodec(SchemaRegistryClient registryClient, ObjectMapper objectMapper) {
    this.registryClient = Objects.requireNonNull(registryClient, "registryClient must not be null");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
  }

  public SchemaRegistryClient registryClient() {
    return registryClient;
  }

  public int resolveSchemaId(String subject) {
    return registryClient.getLatestSchema(subject).id();
  }

  public byte[] encode(String subject, Object value) {
    return encode(registryClient.getLatestSchema(subject), value);
  }

  public byte[] encode(RegisteredSchema schema, Object value) {
    Objects.requireNonNull(schema, "schema must not be null");
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.write(MAGIC_BYTE);
    out.writeBytes(ByteBuffer.allocate(4).putInt(schema.id()).array());
    try {
      switch (schema.type()) {
        case AVRO -> writeAvro(schema, value, out);
        case JSON -> out.writeBytes(objectMapper.writeValueAsBytes(value));
        default -> throw new SchemaRegistryException(
            "Unsupported schema type for encoding: " + schema.type());
      }
    } catch (IOException | AvroRuntimeException ex) {
      throw new SchemaRegistryException(
          "Failed to encode value with schema id=" + schema.id(), ex);
    }
    return out.toByteArray();
  }

  public Object decode(byte[] framed) {
    if (framed == null || framed.length < HEADER_LENGTH || framed[0] != MAGIC_BYTE) {
      throw new SchemaRegistryException("Payload is not framed with the schema registry magic byte");
    }
    int schemaId = ByteBuffer.wrap(framed, 1, 4).getInt();
    RegisteredSchema schema = registryClient.getSchemaById(schemaId);
    try {
      return switch (schema.type()) {
        case AVRO -> readAvro(schema, framed);
        case JSON -> objectMapper.readValue(
            framed, HEADER_LENGTH, framed.length - HEADER_LENGTH, Object.class);
        default -> throw new SchemaRegistryException(
            "Unsupported schema type for decoding: " + schema.type());
      };
    } catch (IOException | AvroRuntimeException ex) {
      throw new SchemaRegistryException("Failed to decode value with schema id=" + schemaId, ex);
    }
  }

  private void writeAvro(RegisteredSchema schema, Object value, ByteArrayOutputStream out)
      throws IOException {
    Schema avroSchema = avroSchema(schema);
    String json = objectMapper.writeValueAsString(value);
    Decoder jsonDecoder = DecoderFactory.get().jsonDecoder(avroSchema, json);
    Object datum = new GenericDatumReader<>(avroSchema).read(null, jsonDecoder);

    BinaryEncoder encoder = EncoderFactory.get().binaryEncoder(out, null);
    new GenericDatumWriter<>(avroSchema).write(datum, encoder);
    encoder.flush();
  }

  private Object readAvro(RegisteredSchema schema, byte[] framed) throws IOException {
    Schema avroSchema = avroSchema(schema);
    Object datum =
        new GenericDatumReader<>(avroSchema)
            .read(
                null,
                DecoderFactory.get()
                    .binaryDecoder(framed, HEADER_LENGTH, framed.length - HEADER_LENGTH, null));
    return toPlainValue(datum);
  }

  private Object toPlainValue(Object datum) throws JsonProcessingException {
    if (datum == null) {
      return null;
    }
    return objectMapper.readValue(GenericData.get().toString(datum), Object.class);
  }

  private Schema avroSchema(RegisteredSchema schema) {
    return avroSchemas.computeIfAbsent(
        schema.id(),
        id -> {
          try {
            return new Schema.Parser().parse(schema.schema());
          } catch (SchemaParseException ex) {
            throw new SchemaRegistryException("Invalid Avro schema id=" + id, ex);
          }
        });
  }
}
