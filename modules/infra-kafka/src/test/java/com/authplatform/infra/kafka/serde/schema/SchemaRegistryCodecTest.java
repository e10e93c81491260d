package com.authplatform.infra.kafka.serde.schema;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.authplatform.infra.kafka.serde.EventObjectMapperFactory;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SchemaRegistryCodecTest {
  private static final String USER_SCHEMA =
      "{\"type\":\"record\",\"name\":\"UserCreated\",\"fields\":["
          + "{\"name\":\"userId\",\"type\":\"string\"},"
          + "{\"name\":\"loginCount\",\"type\":\"int\"}]}";

  private SchemaRegistryClient registryClient;
  private SchemaRegistryCodec codec;

  @BeforeEach
  void setUp() {
    registryClient = mock(SchemaRegistryClient.class);
    codec = new SchemaRegistryCodec(registryClient, EventObjectMapperFactory.create());
  }

  @Test
  void shouldFrameAvroBodyWithSchemaId() {
    RegisteredSchema schema = new RegisteredSchema(21, SchemaType.AVRO, USER_SCHEMA);
    when(registryClient.getLatestSchema("auth.user.created-value")).thenReturn(schema);
    when(registryClient.getSchemaById(21)).thenReturn(schema);

    byte[] framed =
        codec.encode("auth.user.created-value", Map.of("userId", "u-1", "loginCount", 3));

    assertEquals(SchemaRegistryCodec.MAGIC_BYTE, framed[0]);
    assertEquals(21, ByteBuffer.wrap(framed, 1, 4).getInt());
    assertEquals(Map.of("userId", "u-1", "loginCount", 3), codec.decode(framed));
  }

  @Test
  void shouldFrameJsonBodyAsUtf8() {
    RegisteredSchema schema = new RegisteredSchema(7, SchemaType.JSON, "{\"type\":\"object\"}");
    when(registryClient.getSchemaById(7)).thenReturn(schema);

    byte[] framed = codec.encode(schema, Map.of("status", "blocked"));

    assertArrayEquals(
        "{\"status\":\"blocked\"}".getBytes(StandardCharsets.UTF_8),
        Arrays.copyOfRange(framed, SchemaRegistryCodec.HEADER_LENGTH, framed.length));
    assertEquals(Map.of("status", "blocked"), codec.decode(framed));
  }

  @Test
  void shouldCacheParsedAvroSchema() {
    RegisteredSchema schema = new RegisteredSchema(21, SchemaType.AVRO, USER_SCHEMA);
    when(registryClient.getSchemaById(21)).thenReturn(schema);
    byte[] framed = codec.encode(schema, Map.of("userId", "u-2", "loginCount", 1));

    codec.decode(framed);
    codec.decode(framed);

    verify(registryClient, times(2)).getSchemaById(21);
  }

  @Test
  void shouldRejectUnframedPayload() {
    assertThrows(
        SchemaRegistryException.class,
        () -> codec.decode("{\"a\":1}".getBytes(StandardCharsets.UTF_8)));
    assertThrows(SchemaRegistryException.class, () -> codec.decode(new byte[] {0, 0, 1}));
  }

  @Test
  void shouldRejectProtobuf() {
    RegisteredSchema schema = new RegisteredSchema(9, SchemaType.PROTOBUF, "syntax = \"proto3\";");
    when(registryClient.getSchemaById(9)).thenReturn(schema);

    assertThrows(SchemaRegistryException.class, () -> codec.encode(schema, Map.of()));
    assertThrows(
        SchemaRegistryException.class, () -> codec.decode(new byte[] {0, 0, 0, 0, 9, 1, 2}));
  }

  @Test
  void shouldFailWhenValueDoesNotMatchAvroSchema() {
    RegisteredSchema schema = new RegisteredSchema(21, SchemaType.AVRO, USER_SCHEMA);

    assertThrows(
        SchemaRegistryException.class, () -> codec.encode(schema, Map.of("userId", "u-1")));
  }

  @Test
  void shouldResolveLatestSchemaId() {
    when(registryClient.getLatestSchema("user.updated-value"))
        .thenReturn(new RegisteredSchema(33, SchemaType.AVRO, USER_SCHEMA));

    assertEquals(33, codec.resolveSchemaId("user.updated-value"));
  }
}
