package com.authplatform.infra.kafka.serde;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.authplatform.infra.kafka.consumer.DeserializedMessage;
import com.authplatform.infra.kafka.observability.KafkaTelemetry;
import com.authplatform.infra.kafka.serde.schema.SchemaRegistryCodec;
import com.authplatform.infra.kafka.serde.schema.SchemaRegistryException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.apache.kafka.common.record.TimestampType;
import org.junit.jupiter.api.Test;

class SerializationCodecTest {
  private final SerializationCodec codec = new SerializationCodec(EventObjectMapperFactory.create());

  @Test
  void shouldDecodeJsonObjects() {
    Object decoded = codec.decode(utf8("{\"userId\":\"u-1\",\"roles\":[\"student\"]}"));

    assertEquals(Map.of("userId", "u-1", "roles", List.of("student")), decoded);
  }

  @Test
  void shouldDecodeJsonScalars() {
    assertEquals("u-1", codec.decode(utf8("\"u-1\"")));
    assertEquals(42, codec.decode(utf8("42")));
  }

  @Test
  void shouldFallBackToTextForNonJson() {
    assertEquals("plain-key", codec.decode(utf8("plain-key")));
    assertEquals("{broken", codec.decode(utf8("{broken")));
  }

  @Test
  void shouldReturnNullForNullBytes() {
    assertNull(codec.decode(null));
    assertNull(codec.encode(null, null));
  }

  @Test
  void shouldRoundTripJsonWithoutSchema() {
    Map<String, Object> event =
        Map.of(
            "eventId", "evt-1",
            "timestamp", 1_700_000_000,
            "payload",
                Map.of(
                    "userId", "u-1",
                    "verified", true,
                    "score", 4.5d,
                    "roles", List.of("student", "instructor"),
                    "profile", Map.of("firstName", "Ada", "tags", List.of())));

    assertEquals(event, codec.decode(codec.encode(event, null)));
  }

  @Test
  void shouldEncodeAsJsonWithoutSubject() {
    assertArrayEquals(utf8("{\"userId\":\"u-1\"}"), codec.encode(Map.of("userId", "u-1"), null));
    assertArrayEquals(utf8("\"u-1\""), codec.encode("u-1", null));
  }

  @Test
  void shouldFailToEncodeUnserializableValue() {
    assertThrows(IllegalStateException.class, () -> codec.encode(new Object(), null));
  }

  @Test
  void shouldDeserializeRecordWithHeaders() {
    RecordHeaders headers = new RecordHeaders();
    headers.add("x-event-type", utf8("AuthUserCreated"));
    headers.add("empty", null);
    ConsumerRecord<byte[], byte[]> record =
        new ConsumerRecord<>(
            "user.updated",
            2,
            15L,
            1_700_000_000_000L,
            TimestampType.CREATE_TIME,
            -1,
            -1,
            utf8("\"u-1\""),
            utf8("{\"status\":\"active\"}"),
            headers,
            Optional.empty());

    DeserializedMessage<Object> message = codec.deserialize(record);

    assertEquals("u-1", message.key());
    assertEquals(Map.of("status", "active"), message.value());
    assertEquals(Map.of("x-event-type", "AuthUserCreated"), message.headers());
    assertEquals("user.updated", message.topic());
    assertEquals(2, message.partition());
    assertEquals(15L, message.offset());
    assertEquals(1_700_000_000_000L, message.timestamp());
  }

  @Test
  void shouldFallBackToJsonWhenRegistryDecodeFails() {
    SchemaRegistryCodec registryCodec = mock(SchemaRegistryCodec.class);
    KafkaTelemetry telemetry = mock(KafkaTelemetry.class);
    SchemaRegistryException failure = new SchemaRegistryException("not framed");
    when(registryCodec.decode(any())).thenThrow(failure);
    SerializationCodec registryBacked =
        new SerializationCodec(EventObjectMapperFactory.create(), registryCodec, telemetry);

    Object decoded = registryBacked.decode(utf8("{\"a\":1}"), "user.updated", "value");

    assertEquals(Map.of("a", 1), decoded);
    verify(telemetry).onDeserializationFallback("user.updated", "value", failure);
  }

  @Test
  void shouldUseRegistryOnlyWhenSubjectGiven() {
    SchemaRegistryCodec registryCodec = mock(SchemaRegistryCodec.class);
    when(registryCodec.encode(eq("auth.user.created-value"), any())).thenReturn(new byte[] {0, 0, 0, 0, 7});
    SerializationCodec registryBacked =
        new SerializationCodec(EventObjectMapperFactory.create(), registryCodec, null);

    assertArrayEquals(
        new byte[] {0, 0, 0, 0, 7}, registryBacked.encode("v", "auth.user.created-value"));
    assertArrayEquals(utf8("\"v\""), registryBacked.encode("v", null));
    verify(registryCodec, never()).encode(eq((String) null), any());
  }

  private static byte[] utf8(String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }
}
