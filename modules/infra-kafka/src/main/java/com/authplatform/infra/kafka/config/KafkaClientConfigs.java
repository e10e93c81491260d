package com.authplatform.infra.kafka.config;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.config.SaslConfigs;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;

/** Kafka client property maps derived from {@link InfraKafkaProperties}. */
public final class KafkaClientConfigs {
  private static final String PLAIN_LOGIN_MODULE =
      "org.apache.kafka.common.security.plain.PlainLoginModule";
  private static final String SCRAM_LOGIN_MODULE =
      "org.apache.kafka.common.security.scram.ScramLoginModule";

  private KafkaClientConfigs() {}

  public static Map<String, Object> producer(InfraKafkaProperties properties) {
    InfraKafkaProperties.Producer producer = properties.getProducer();

    Map<String, Object> config = new HashMap<>(security(properties));
    config.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, properties.bootstrapServersAsCsv());
    config.put(ProducerConfig.CLIENT_ID_CONFIG, properties.getClientId() + "-producer");
    config.put(ProducerConfig.ACKS_CONFIG, producer.getAcks());
    config.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, producer.isIdempotent());
    config.put(ProducerConfig.RETRIES_CONFIG, Math.max(0, producer.getRetries()));
    config.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, producer.getCompressionType());
    config.put(ProducerConfig.LINGER_MS_CONFIG, producer.getLingerMs());
    config.put(ProducerConfig.BATCH_SIZE_CONFIG, producer.getBatchSize());
    config.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, producer.getDeliveryTimeoutMs());
    config.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, producer.getRequestTimeoutMs());
    config.put(
        ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, resolveMaxInFlightRequests(producer));
    config.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class);
    config.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class);
    return config;
  }

  public static Map<String, Object> consumer(InfraKafkaProperties properties) {
    InfraKafkaProperties.Consumer consumer = properties.getConsumer();

    Map<String, Object> config = new HashMap<>(security(properties));
    config.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, properties.bootstrapServersAsCsv());
    config.put(ConsumerConfig.CLIENT_ID_CONFIG, properties.getClientId() + "-consumer");
    config.put(ConsumerConfig.GROUP_ID_CONFIG, consumer.getGroupId());
    config.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, consumer.getAutoOffsetReset());
    config.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, consumer.isAutoCommit());
    config.put(ConsumerConfig.AUTO_COMMIT_INTERVAL_MS_CONFIG, consumer.getAutoCommitIntervalMs());
    config.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, consumer.getMaxPollRecords());
    config.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, consumer.getMaxPollIntervalMs());
    config.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, consumer.getSessionTimeoutMs());
    config.put(ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, consumer.getHeartbeatIntervalMs());
    config.put(
        ConsumerConfig.MAX_PARTITION_FETCH_BYTES_CONFIG, consumer.getMaxPartitionFetchBytes());
    config.put(ConsumerConfig.FETCH_MIN_BYTES_CONFIG, consumer.getFetchMinBytes());
    config.put(ConsumerConfig.FETCH_MAX_BYTES_CONFIG, consumer.getFetchMaxBytes());
    config.put(ConsumerConfig.FETCH_MAX_WAIT_MS_CONFIG, consumer.getFetchMaxWaitMs());
    config.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
    config.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
    return config;
  }

  public static Map<String, Object> admin(InfraKafkaProperties properties) {
    Map<String, Object> config = new HashMap<>(security(properties));
    config.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, properties.bootstrapServersAsCsv());
    config.put(AdminClientConfig.CLIENT_ID_CONFIG, properties.getClientId() + "-admin");
    config.put(
        AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG,
        (int) Math.max(1L, properties.getHealthTimeoutMs()));
    return config;
  }

  static Map<String, Object> security(InfraKafkaProperties properties) {
    Map<String, Object> config = new HashMap<>();
    InfraKafkaProperties.Security security = properties.getSecurity();
    if (security == null) {
      return config;
    }
    InfraKafkaProperties.Sasl sasl = security.getSasl();
    boolean saslEnabled = sasl != null && InfraKafkaProperties.hasText(sasl.getMechanism());

    if (saslEnabled) {
      config.put(
          CommonClientConfigs.SECURITY_PROTOCOL_CONFIG,
          security.isSsl() ? "SASL_SSL" : "SASL_PLAINTEXT");
      config.put(SaslConfigs.SASL_MECHANISM, saslMechanism(sasl.getMechanism()));
      config.put(SaslConfigs.SASL_JAAS_CONFIG, jaasConfig(sasl));
    } else if (security.isSsl()) {
      config.put(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, "SSL");
    }
    return config;
  }

  private static String saslMechanism(String mechanism) {
    String normalized = mechanism.trim().toUpperCase(Locale.ROOT);
    return switch (normalized) {
      case "PLAIN", "SCRAM-SHA-256", "SCRAM-SHA-512" -> normalized;
      default -> throw new IllegalArgumentException(
          "Unsupported infra.kafka.security.sasl.mechanism: " + mechanism);
    };
  }

  private static String jaasConfig(InfraKafkaProperties.Sasl sasl) {
    if (!InfraKafkaProperties.hasText(sasl.getUsername())) {
      throw new IllegalArgumentException(
          "infra.kafka.security.sasl.username is required when SASL is enabled");
    }
    String loginModule =
        "PLAIN".equals(saslMechanism(sasl.getMechanism())) ? PLAIN_LOGIN_MODULE : SCRAM_LOGIN_MODULE;
    return loginModule
        + " required username=\""
        + escape(sasl.getUsername())
        + "\" password=\""
        + escape(sasl.getPassword() == null ? "" : sasl.getPassword())
        + "\";";
  }

  private static String escape(String value) {
    return value.replace("\\", "\\\\").replace("\"", "\\\"");
  }

  private static int resolveMaxInFlightRequests(InfraKafkaProperties.Producer producer) {
    int configuredMax = Math.max(1, producer.getMaxInFlightRequests());
    if (producer.isIdempotent()) {
      return Math.min(5, configuredMax);
    }
    return configuredMax;
  }
}
