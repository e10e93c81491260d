package com.authplatform.infra.kafka.manager;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.authplatform.infra.kafka.client.KafkaClient;
import com.authplatform.infra.kafka.errors.KafkaConnectionException;
import com.authplatform.infra.kafka.producer.EventPublisher;
import com.authplatform.infra.kafka.registry.HandlerRegistry;
import com.authplatform.infra.kafka.registry.KafkaEventController;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.context.ApplicationContext;

class KafkaManagerTest {
  private KafkaClient client;
  private EventPublisher publisher;
  private KafkaManager manager;

  @BeforeEach
  void setUp() {
    client = mock(KafkaClient.class);
    publisher = mock(EventPublisher.class);
    when(client.registry()).thenReturn(new HandlerRegistry());
    manager = new KafkaManager(client, publisher);
  }

  @Test
  void shouldRejectAccessBeforeInitialization() {
    IllegalStateException thrown =
        assertThrows(IllegalStateException.class, () -> manager.getPublisher());

    assertEquals("KafkaManager not initialized. Call initializeHandlers() first.", thrown.getMessage());
    assertThrows(IllegalStateException.class, () -> manager.getClient());
  }

  @Test
  void shouldConnectRegisterAndStartInOrder() {
    List<Object> owners = List.of(new Object());

    manager.initializeHandlers(owners);

    InOrder order = inOrder(client);
    order.verify(client).connect();
    order.verify(client).registerEventHandlers(owners);
    order.verify(client).startConsumers();
    assertTrue(manager.isInitialized());
    assertSame(publisher, manager.getPublisher());
    assertSame(client, manager.getClient());
  }

  @Test
  void shouldConnectWithoutConsumingWhenNoOwners() {
    manager.initializeHandlers(List.of());

    verify(client).connect();
    verify(client, never()).registerEventHandlers(any());
    verify(client, never()).startConsumers();
    assertSame(publisher, manager.getPublisher());
  }

  @Test
  void shouldIgnoreSecondInitialization() {
    manager.initializeHandlers(List.of(new Object()));
    manager.initializeHandlers(List.of(new Object()));

    verify(client, times(1)).connect();
    verify(client, times(1)).startConsumers();
  }

  @Test
  void shouldStayUninitializedWhenConnectFails() {
    doThrow(new KafkaConnectionException("producer", "Failed to connect Kafka producer", null))
        .when(client)
        .connect();

    assertThrows(KafkaConnectionException.class, () -> manager.initializeHandlers(List.of()));

    assertFalse(manager.isInitialized());
    assertThrows(IllegalStateException.class, () -> manager.getPublisher());
  }

  @Test
  void shouldDisconnectAndAllowRetryWhenConsumerStartFails() {
    List<Object> owners = List.of(new Object());
    doThrow(new KafkaConnectionException("consumer", "Failed to start Kafka consumer", null))
        .doNothing()
        .when(client)
        .startConsumers();

    assertThrows(KafkaConnectionException.class, () -> manager.initializeHandlers(owners));

    verify(client).disconnect();
    assertFalse(manager.isInitialized());

    manager.initializeHandlers(owners);

    InOrder order = inOrder(client);
    order.verify(client).registerEventHandlers(owners);
    order.verify(client).disconnect();
    order.verify(client).registerEventHandlers(owners);
    assertTrue(manager.isInitialized());
  }

  @Test
  void shouldDisconnectWhenHandlerRegistrationFails() {
    doThrow(new IllegalArgumentException("bad handler signature"))
        .when(client)
        .registerEventHandlers(any());

    IllegalArgumentException thrown =
        assertThrows(
            IllegalArgumentException.class,
            () -> manager.initializeHandlers(List.of(new Object())));

    assertEquals("bad handler signature", thrown.getMessage());
    verify(client).disconnect();
    verify(client, never()).startConsumers();
    assertFalse(manager.isInitialized());
  }

  @Test
  void shouldDisconnectOnShutdownAndAllowReinitialization() {
    manager.shutdown();
    verify(client, never()).disconnect();

    manager.initializeHandlers(List.of());
    manager.shutdown();

    verify(client).disconnect();
    assertFalse(manager.isInitialized());

    manager.initializeHandlers(List.of());
    verify(client, times(2)).connect();
  }

  @Test
  void shouldStartWithEventControllerBeans() {
    ApplicationContext context = mock(ApplicationContext.class);
    SampleController controller = new SampleController();
    when(context.getBeansWithAnnotation(KafkaEventController.class))
        .thenReturn(Map.of("sampleController", controller));
    KafkaManagerLifecycle lifecycle = new KafkaManagerLifecycle(manager, context);

    lifecycle.start();
    lifecycle.stop();

    verify(client).registerEventHandlers(List.of(controller));
    verify(client).disconnect();
  }

  @KafkaEventController
  static class SampleController {}
}
