package com.authplatform.infra.kafka.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.authplatform.infra.kafka.consumer.DeserializedMessage;
import com.authplatform.infra.kafka.consumer.EventPattern;
import com.authplatform.infra.kafka.consumer.RetryConfig;
import java.io.IOException;
import java.lang.reflect.ParameterizedType;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EventPatternScannerTest {
  private static final DeserializedMessage<Object> MESSAGE =
      new DeserializedMessage<>("k", Map.of(), Map.of(), "user.updated", 0, 1L, 0L);

  private final EventPatternScanner scanner = new EventPatternScanner();

  @Test
  void shouldTurnAnnotatedMethodsIntoBindings() {
    SampleController controller = new SampleController();

    List<HandlerBinding> bindings = scanner.scan(controller);

    assertEquals(2, bindings.size());
    HandlerBinding blocked = bindings.get(0);
    assertEquals("onBlocked", blocked.methodName());
    assertEquals("user.blocked", blocked.pattern().topic());
    assertSame(controller, blocked.owner());
    assertEquals("SampleController#onBlocked", blocked.description());

    HandlerBinding updated = bindings.get(1);
    EventPattern pattern = updated.pattern();
    assertEquals("user.updated", pattern.topic());
    assertEquals(2, pattern.partition());
    assertTrue(pattern.fromBeginning());
    assertEquals(Duration.ofMillis(1500), pattern.timeout());
    assertEquals(new RetryConfig(3, 2.0d, Duration.ofMillis(50), true), pattern.retryConfig());
  }

  @Test
  void shouldLeaveOptionalSettingsUnsetByDefault() {
    HandlerBinding blocked = scanner.scan(new SampleController()).get(0);
    EventPattern pattern = blocked.pattern();

    assertNull(pattern.partition());
    assertFalse(pattern.fromBeginning());
    assertNull(pattern.timeout());
    assertNull(pattern.retryConfig());
    assertNull(pattern.schemaType());
  }

  @Test
  void shouldUseGenericParameterTypeAsSchemaType() {
    HandlerBinding updated = scanner.scan(new SampleController()).get(1);

    ParameterizedType schemaType =
        assertInstanceOf(ParameterizedType.class, updated.pattern().schemaType());
    assertEquals(Map.class, schemaType.getRawType());
  }

  @Test
  void shouldInvokeOwnerMethods() throws Exception {
    SampleController controller = new SampleController();
    List<HandlerBinding> bindings = scanner.scan(controller);

    bindings.get(0).handler().handle("blocked-payload", MESSAGE);
    bindings.get(1).handler().handle(Map.of("userId", "u-1"), MESSAGE);

    assertEquals(List.of("blocked-payload", Map.of("userId", "u-1"), MESSAGE), controller.received);
  }

  @Test
  void shouldBindSameTopicHandlersInMethodNameOrder() {
    List<HandlerBinding> bindings = scanner.scan(new SameTopicController());

    assertEquals(
        List.of("alert", "audit", "record"),
        bindings.stream().map(HandlerBinding::methodName).toList());
    assertTrue(bindings.stream().allMatch(b -> b.pattern().topic().equals("user.created")));
  }

  @Test
  void shouldRethrowHandlerExceptionsUnwrapped() {
    HandlerBinding failing = scanner.scan(new FailingController()).get(0);

    IOException thrown =
        assertThrows(IOException.class, () -> failing.handler().handle("x", MESSAGE));
    assertEquals("disk", thrown.getMessage());
  }

  @Test
  void shouldRejectInvalidSignatures() {
    assertThrows(IllegalArgumentException.class, () -> scanner.scan(new InvalidController()));
    assertThrows(IllegalArgumentException.class, () -> scanner.scan(null));
  }

  @Test
  void shouldReturnNothingForUnannotatedOwner() {
    assertTrue(scanner.scan(new Object()).isEmpty());
  }

  @KafkaEventController
  static class SampleController {
    final List<Object> received = new ArrayList<>();

    @KafkaEventPattern(topic = "user.blocked")
    public void onBlocked(Object payload) {
      received.add(payload);
    }

    @KafkaEventPattern(
        topic = "user.updated",
        partition = 2,
        fromBeginning = true,
        timeoutMs = 1500,
        retry = @HandlerRetry(maxAttempts = 3, initialDelayMs = 50, jitter = true))
    public void onUpdated(Map<String, Object> payload, DeserializedMessage<?> message) {
      received.add(payload);
      received.add(message);
    }
  }

  static class SameTopicController {
    @KafkaEventPattern(topic = "user.created")
    public void record(Object payload) {}

    @KafkaEventPattern(topic = "user.created")
    public void alert(Object payload) {}

    @KafkaEventPattern(topic = "user.created")
    public void audit(Object payload) {}
  }

  static class FailingController {
    @KafkaEventPattern(topic = "user.updated")
    public void fail(Object payload) throws IOException {
      throw new IOException("disk");
    }
  }

  static class InvalidController {
    @KafkaEventPattern(topic = "user.updated")
    public void wrong(Object payload, String extra) {}
  }
}
