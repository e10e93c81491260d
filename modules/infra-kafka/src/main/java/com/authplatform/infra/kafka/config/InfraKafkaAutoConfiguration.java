package com.authplatform.infra.kafka.config;

import com.authplatform.infra.kafka.client.KafkaClient;
import com.authplatform.infra.kafka.consumer.BeanValidationPayloadValidator;
import com.authplatform.infra.kafka.consumer.MessageDispatcher;
import com.authplatform.infra.kafka.consumer.PayloadBinder;
import com.authplatform.infra.kafka.consumer.PayloadValidator;
import com.authplatform.infra.kafka.errors.RetryExecutor;
import com.authplatform.infra.kafka.manager.KafkaManager;
import com.authplatform.infra.kafka.manager.KafkaManagerLifecycle;
import com.authplatform.infra.kafka.observability.KafkaTelemetry;
import com.authplatform.infra.kafka.observability.MicrometerKafkaTelemetry;
import com.authplatform.infra.kafka.observability.NoOpKafkaTelemetry;
import com.authplatform.infra.kafka.producer.EventPublisher;
import com.authplatform.infra.kafka.producer.KafkaEventPublisher;
import com.authplatform.infra.kafka.registry.EventPatternScanner;
import com.authplatform.infra.kafka.registry.HandlerRegistry;
import com.authplatform.infra.kafka.serde.EventObjectMapperFactory;
import com.authplatform.infra.kafka.serde.SerializationCodec;
import com.authplatform.infra.kafka.serde.schema.RestSchemaRegistryClient;
import com.authplatform.infra.kafka.serde.schema.SchemaRegistryClient;
import com.authplatform.infra.kafka.serde.schema.SchemaRegistryCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import org.apache.kafka.clients.admin.Admin;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.web.client.RestClient;

@AutoConfiguration(after = KafkaAutoConfiguration.class)
@EnableConfigurationProperties(InfraKafkaProperties.class)
public class InfraKafkaAutoConfiguration {
  @Bean
  @ConditionalOnMissingBean(name = "kafkaEventObjectMapper")
  public ObjectMapper kafkaEventObjectMapper() {
    return EventObjectMapperFactory.create();
  }

  @Bean
  @ConditionalOnClass(MeterRegistry.class)
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(KafkaTelemetry.class)
  public KafkaTelemetry micrometerKafkaTelemetry(MeterRegistry meterRegistry) {
    return new MicrometerKafkaTelemetry(meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(KafkaTelemetry.class)
  public KafkaTelemetry noOpKafkaTelemetry() {
    return new NoOpKafkaTelemetry();
  }

  @Bean
  @ConditionalOnProperty(prefix = "infra.kafka.schema-registry", name = "url")
  @ConditionalOnMissingBean
  public SchemaRegistryClient schemaRegistryClient(
      InfraKafkaProperties properties,
      @Qualifier("kafkaEventObjectMapper") ObjectMapper kafkaEventObjectMapper) {
    InfraKafkaProperties.SchemaRegistry registry = properties.getSchemaRegistry();
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(Math.max(0, registry.getTimeoutMs()));
    requestFactory.setReadTimeout(Math.max(0, registry.getTimeoutMs()));

    RestClient.Builder builder =
        RestClient.builder().baseUrl(registry.getUrl()).requestFactory(requestFactory);
    if (InfraKafkaProperties.hasText(registry.getUsername())) {
      builder.defaultHeaders(
          headers ->
              headers.setBasicAuth(
                  registry.getUsername(),
                  registry.getPassword() == null ? "" : registry.getPassword()));
    }
    return new RestSchemaRegistryClient(builder.build(), kafkaEventObjectMapper);
  }

  @Bean
  @ConditionalOnMissingBean
  public SerializationCodec serializationCodec(
      @Qualifier("kafkaEventObjectMapper") ObjectMapper kafkaEventObjectMapper,
      ObjectProvider<SchemaRegistryClient> schemaRegistryClient,
      KafkaTelemetry kafkaTelemetry) {
    SchemaRegistryClient registryClient = schemaRegistryClient.getIfAvailable();
    SchemaRegistryCodec registryCodec =
        registryClient == null
            ? null
            : new SchemaRegistryCodec(registryClient, kafkaEventObjectMapper);
    return new SerializationCodec(kafkaEventObjectMapper, registryCodec, kafkaTelemetry);
  }

  @Bean
  @ConditionalOnMissingBean
  public PayloadValidator payloadValidator(ObjectProvider<Validator> validator) {
    return new BeanValidationPayloadValidator(
        validator.getIfAvailable(
            () -> Validation.buildDefaultValidatorFactory().getValidator()));
  }

  @Bean
  @ConditionalOnMissingBean
  public PayloadBinder payloadBinder(
      @Qualifier("kafkaEventObjectMapper") ObjectMapper kafkaEventObjectMapper,
      PayloadValidator payloadValidator) {
    return new PayloadBinder(kafkaEventObjectMapper, payloadValidator);
  }

  @Bean
  @ConditionalOnMissingBean
  public RetryExecutor retryExecutor() {
    return new RetryExecutor();
  }

  @Bean
  @ConditionalOnMissingBean
  public HandlerRegistry handlerRegistry() {
    return new HandlerRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public EventPatternScanner eventPatternScanner() {
    return new EventPatternScanner();
  }

  @Bean
  @ConditionalOnMissingBean
  public MessageDispatcher messageDispatcher(
      HandlerRegistry handlerRegistry,
      SerializationCodec serializationCodec,
      PayloadBinder payloadBinder,
      RetryExecutor retryExecutor,
      KafkaTelemetry kafkaTelemetry) {
    return new MessageDispatcher(
        handlerRegistry, serializationCodec, payloadBinder, retryExecutor, kafkaTelemetry);
  }

  @Bean
  @ConditionalOnMissingBean(name = "infraKafkaProducerFactory")
  public ProducerFactory<byte[], byte[]> infraKafkaProducerFactory(
      InfraKafkaProperties properties) {
    return new DefaultKafkaProducerFactory<>(KafkaClientConfigs.producer(properties));
  }

  @Bean
  @ConditionalOnMissingBean(name = "infraKafkaConsumerFactory")
  public ConsumerFactory<byte[], byte[]> infraKafkaConsumerFactory(
      InfraKafkaProperties properties) {
    return new DefaultKafkaConsumerFactory<>(KafkaClientConfigs.consumer(properties));
  }

  @Bean
  @ConditionalOnMissingBean
  public KafkaClient kafkaClient(
      @Qualifier("infraKafkaProducerFactory") ProducerFactory<byte[], byte[]> producerFactory,
      @Qualifier("infraKafkaConsumerFactory") ConsumerFactory<byte[], byte[]> consumerFactory,
      HandlerRegistry handlerRegistry,
      EventPatternScanner eventPatternScanner,
      MessageDispatcher messageDispatcher,
      SerializationCodec serializationCodec,
      KafkaTelemetry kafkaTelemetry,
      InfraKafkaProperties properties) {
    return new KafkaClient(
        producerFactory,
        consumerFactory,
        handlerRegistry,
        eventPatternScanner,
        messageDispatcher,
        serializationCodec,
        () -> Admin.create(KafkaClientConfigs.admin(properties)),
        kafkaTelemetry,
        new KafkaClient.Settings(
            Duration.ofMillis(Math.max(1L, properties.getConsumer().getPollTimeoutMs())),
            Duration.ofMillis(Math.max(0L, properties.getShutdownTimeoutMs())),
            Duration.ofMillis(Math.max(1L, properties.getHealthTimeoutMs()))));
  }

  @Bean
  @ConditionalOnMissingBean
  public EventPublisher eventPublisher(
      KafkaClient kafkaClient,
      SerializationCodec serializationCodec,
      KafkaTelemetry kafkaTelemetry,
      InfraKafkaProperties properties) {
    long sendTimeoutMs = Math.max(0L, properties.getProducer().getSendTimeoutMs());
    return new KafkaEventPublisher(
        kafkaClient, serializationCodec, kafkaTelemetry, Duration.ofMillis(sendTimeoutMs));
  }

  @Bean
  @ConditionalOnMissingBean
  public KafkaManager kafkaManager(KafkaClient kafkaClient, EventPublisher eventPublisher) {
    return new KafkaManager(kafkaClient, eventPublisher);
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "infra.kafka",
      name = "auto-startup",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean
  public KafkaManagerLifecycle kafkaManagerLifecycle(
      KafkaManager kafkaManager, ApplicationContext applicationContext) {
    return new KafkaManagerLifecycle(kafkaManager, applicationContext);
  }
}
