package com.authplatform.infra.kafka.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.authplatform.infra.kafka.client.ConnectionState;
import com.authplatform.infra.kafka.client.KafkaClient;
import com.authplatform.infra.kafka.manager.KafkaManager;
import com.authplatform.infra.kafka.manager.KafkaManagerLifecycle;
import com.authplatform.infra.kafka.observability.KafkaTelemetry;
import com.authplatform.infra.kafka.observability.MicrometerKafkaTelemetry;
import com.authplatform.infra.kafka.observability.NoOpKafkaTelemetry;
import com.authplatform.infra.kafka.producer.EventPublisher;
import com.authplatform.infra.kafka.producer.KafkaEventPublisher;
import com.authplatform.infra.kafka.serde.SerializationCodec;
import com.authplatform.infra.kafka.serde.schema.SchemaRegistryClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class InfraKafkaAutoConfigurationTest {
  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(InfraKafkaAutoConfiguration.class);

  @Test
  void shouldUseNoOpKafkaTelemetryWhenMeterRegistryIsMissing() {
    contextRunner.run(
        context ->
            assertEquals(
                NoOpKafkaTelemetry.class, context.getBean(KafkaTelemetry.class).getClass()));
  }

  @Test
  void shouldUseMicrometerKafkaTelemetryWhenMeterRegistryIsPresent() {
    contextRunner
        .withBean(SimpleMeterRegistry.class, SimpleMeterRegistry::new)
        .run(
            context ->
                assertEquals(
                    MicrometerKafkaTelemetry.class,
                    context.getBean(KafkaTelemetry.class).getClass()));
  }

  @Test
  void shouldWireMessagingCoreWithoutConnecting() {
    contextRunner.run(
        context -> {
          assertTrue(context.containsBean("infraKafkaProducerFactory"));
          assertTrue(context.containsBean("infraKafkaConsumerFactory"));
          assertEquals(KafkaEventPublisher.class, context.getBean(EventPublisher.class).getClass());
          assertFalse(context.getBean(KafkaManager.class).isInitialized());
          assertEquals(
              ConnectionState.UNINITIALIZED,
              context.getBean(KafkaClient.class).producerState());
          assertEquals(1, context.getBeansOfType(KafkaManagerLifecycle.class).size());
        });
  }

  @Test
  void shouldSkipLifecycleWhenAutoStartupDisabled() {
    contextRunner
        .withPropertyValues("infra.kafka.auto-startup=false")
        .run(context -> assertTrue(context.getBeansOfType(KafkaManagerLifecycle.class).isEmpty()));
  }

  @Test
  void shouldConfigureSchemaRegistryOnlyWhenUrlIsSet() {
    contextRunner.run(
        context -> {
          assertTrue(context.getBeansOfType(SchemaRegistryClient.class).isEmpty());
          assertTrue(context.getBean(SerializationCodec.class).schemaRegistry().isEmpty());
        });

    contextRunner
        .withPropertyValues(
            "infra.kafka.schema-registry.url=http://localhost:8081",
            "infra.kafka.schema-registry.username=auth",
            "infra.kafka.schema-registry.password=secret")
        .run(
            context -> {
              assertEquals(1, context.getBeansOfType(SchemaRegistryClient.class).size());
              assertTrue(context.getBean(SerializationCodec.class).schemaRegistry().isPresent());
            });
  }

  @Test
  void shouldBindNestedProperties() {
    contextRunner
        .withPropertyValues(
            "infra.kafka.bootstrap-servers=kafka-1:9092,kafka-2:9092",
            "infra.kafka.consumer.group-id=auth-test",
            "infra.kafka.producer.send-timeout-ms=2500")
        .run(
            context -> {
              InfraKafkaProperties properties = context.getBean(InfraKafkaProperties.class);
              assertEquals("kafka-1:9092,kafka-2:9092", properties.bootstrapServersAsCsv());
              assertEquals("auth-test", properties.getConsumer().getGroupId());
              assertEquals(2500L, properties.getProducer().getSendTimeoutMs());
            });
  }
}
