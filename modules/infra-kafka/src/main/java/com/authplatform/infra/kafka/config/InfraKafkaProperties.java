package com.authplatform.infra.kafka.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "infra.kafka")
public class InfraKafkaProperties {
  private List<String> bootstrapServers = new ArrayList<>(List.of("localhost:9092"));
  private String clientId = "auth-service";
  private boolean autoStartup = true;
  private long shutdownTimeoutMs = 30000L;
  private long healthTimeoutMs = 5000L;
  private Security security = new Security();
  private Producer producer = new Producer();
  private Consumer consumer = new Consumer();
  private SchemaRegistry schemaRegistry = new SchemaRegistry();

  public List<String> getBootstrapServers() {
    return bootstrapServers;
  }

  public void setBootstrapServers(List<String> bootstrapServers) {
    this.bootstrapServers = bootstrapServers;
  }

  public String getClientId() {
    return clientId;
  }

  public void setClientId(String clientId) {
    this.clientId = clientId;
  }

  public boolean isAutoStartup() {
    return autoStartup;
  }

  public void setAutoStartup(boolean autoStartup) {
    this.autoStartup = autoStartup;
  }

  public long getShutdownTimeoutMs() {
    return shutdownTimeoutMs;
  }

  public void setShutdownTimeoutMs(long shutdownTimeoutMs) {
    this.shutdownTimeoutMs = shutdownTimeoutMs;
  }

  public long getHealthTimeoutMs() {
    return healthTimeoutMs;
  }

  public void setHealthTimeoutMs(long healthTimeoutMs) {
    this.healthTimeoutMs = healthTimeoutMs;
  }

  public Security getSecurity() {
    return security;
  }

  public void setSecurity(Security security) {
    this.security = security;
  }

  public Producer getProducer() {
    return producer;
  }

  public void setProducer(Producer producer) {
    this.producer = producer;
  }

  public Consumer getConsumer() {
    return consumer;
  }

  public void setConsumer(Consumer consumer) {
    this.consumer = consumer;
  }

  public SchemaRegistry getSchemaRegistry() {
    return schemaRegistry;
  }

  public void setSchemaRegistry(SchemaRegistry schemaRegistry) {
    this.schemaRegistry = schemaRegistry;
  }

  public String bootstrapServersAsCsv() {
    return String.join(",", bootstrapServers);
  }

  public boolean schemaRegistryEnabled() {
    return schemaRegistry != null && hasText(schemaRegistry.getUrl());
  }

  static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }

  public static class Security {
    private boolean ssl;
    private Sasl sasl = new Sasl();

    public boolean isSsl() {
      return ssl;
    }

    public void setSsl(boolean ssl) {
      this.ssl = ssl;
    }

    public Sasl getSasl() {
      return sasl;
    }

    public void setSasl(Sasl sasl) {
      this.sasl = sasl;
    }
  }

  public static class Sasl {
    /** {@code plain}, {@code scram-sha-256} or {@code scram-sha-512}; blank disables SASL. */
    private String mechanism;
    private String username;
    private String password;

    public String getMechanism() {
      return mechanism;
    }

    public void setMechanism(String mechanism) {
      this.mechanism = mechanism;
    }

    public String getUsername() {
      return username;
    }

    public void setUsername(String username) {
      this.username = username;
    }

    public String getPassword() {
      return password;
    }

    public void setPassword(String password) {
      this.password = password;
    }
  }

  public static class Producer {
    private String acks = "all";
    private boolean idempotent = true;
    private int maxInFlightRequests = 5;
    private int retries = 3;
    private int batchSize = 16384;
    private int lingerMs = 5;
    private String compressionType = "lz4";
    private int deliveryTimeoutMs = 120000;
    private int requestTimeoutMs = 30000;
    private long sendTimeoutMs = 0L;

    public String getAcks() {
      return acks;
    }

    public void setAcks(String acks) {
      this.acks = acks;
    }

    public boolean isIdempotent() {
      return idempotent;
    }

    public void setIdempotent(boolean idempotent) {
      this.idempotent = idempotent;
    }

    public int getMaxInFlightRequests() {
      return maxInFlightRequests;
    }

    public void setMaxInFlightRequests(int maxInFlightRequests) {
      this.maxInFlightRequests = maxInFlightRequests;
    }

    public int getRetries() {
      return retries;
    }

    public void setRetries(int retries) {
      this.retries = retries;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public int getLingerMs() {
      return lingerMs;
    }

    public void setLingerMs(int lingerMs) {
      this.lingerMs = lingerMs;
    }

    public String getCompressionType() {
      return compressionType;
    }

    public void setCompressionType(String compressionType) {
      this.compressionType = compressionType;
    }

    public int getDeliveryTimeoutMs() {
      return deliveryTimeoutMs;
    }

    public void setDeliveryTimeoutMs(int deliveryTimeoutMs) {
      this.deliveryTimeoutMs = deliveryTimeoutMs;
    }

    public int getRequestTimeoutMs() {
      return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(int requestTimeoutMs) {
      this.requestTimeoutMs = requestTimeoutMs;
    }

    public long getSendTimeoutMs() {
      return sendTimeoutMs;
    }

    public void setSendTimeoutMs(long sendTimeoutMs) {
      this.sendTimeoutMs = sendTimeoutMs;
    }
  }

  public static class Consumer {
    private String groupId = "auth-service-group";
    private String autoOffsetReset = "latest";
    private int sessionTimeoutMs = 30000;
    private int heartbeatIntervalMs = 3000;
    private int maxPollIntervalMs = 300000;
    private int maxPartitionFetchBytes = 1048576;
    private int fetchMinBytes = 1;
    private int fetchMaxBytes = 52428800;
    private int fetchMaxWaitMs = 500;
    private boolean autoCommit = true;
    private int autoCommitIntervalMs = 5000;
    private int maxPollRecords = 500;
    private long pollTimeoutMs = 1000L;

    public String getGroupId() {
      return groupId;
    }

    public void setGroupId(String groupId) {
      this.groupId = groupId;
    }

    public String getAutoOffsetReset() {
      return autoOffsetReset;
    }

    public void setAutoOffsetReset(String autoOffsetReset) {
      this.autoOffsetReset = autoOffsetReset;
    }

    public int getSessionTimeoutMs() {
      return sessionTimeoutMs;
    }

    public void setSessionTimeoutMs(int sessionTimeoutMs) {
      this.sessionTimeoutMs = sessionTimeoutMs;
    }

    public int getHeartbeatIntervalMs() {
      return heartbeatIntervalMs;
    }

    public void setHeartbeatIntervalMs(int heartbeatIntervalMs) {
      this.heartbeatIntervalMs = heartbeatIntervalMs;
    }

    public int getMaxPollIntervalMs() {
      return maxPollIntervalMs;
    }

    public void setMaxPollIntervalMs(int maxPollIntervalMs) {
      this.maxPollIntervalMs = maxPollIntervalMs;
    }

    public int getMaxPartitionFetchBytes() {
      return maxPartitionFetchBytes;
    }

    public void setMaxPartitionFetchBytes(int maxPartitionFetchBytes) {
      this.maxPartitionFetchBytes = maxPartitionFetchBytes;
    }

    public int getFetchMinBytes() {
      return fetchMinBytes;
    }

    public void setFetchMinBytes(int fetchMinBytes) {
      this.fetchMinBytes = fetchMinBytes;
    }

    public int getFetchMaxBytes() {
      return fetchMaxBytes;
    }

    public void setFetchMaxBytes(int fetchMaxBytes) {
      this.fetchMaxBytes = fetchMaxBytes;
    }

    public int getFetchMaxWaitMs() {
      return fetchMaxWaitMs;
    }

    public void setFetchMaxWaitMs(int fetchMaxWaitMs) {
      this.fetchMaxWaitMs = fetchMaxWaitMs;
    }

    public boolean isAutoCommit() {
      return autoCommit;
    }

    public void setAutoCommit(boolean autoCommit) {
      this.autoCommit = autoCommit;
    }

    public int getAutoCommitIntervalMs() {
      return autoCommitIntervalMs;
    }

    public void setAutoCommitIntervalMs(int autoCommitIntervalMs) {
      this.autoCommitIntervalMs = autoCommitIntervalMs;
    }

    public int getMaxPollRecords() {
      return maxPollRecords;
    }

    public void setMaxPollRecords(int maxPollRecords) {
      this.maxPollRecords = maxPollRecords;
    }

    public long getPollTimeoutMs() {
      return pollTimeoutMs;
    }

    public void setPollTimeoutMs(long pollTimeoutMs) {
      this.pollTimeoutMs = pollTimeoutMs;
    }
  }

  public static class SchemaRegistry {
    private String url;
    private String username;
    private String password;
    private int timeoutMs = 10000;

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url;
    }

    public String getUsername() {
      return username;
    }

    public void setUsername(String username) {
      this.username = username;
    }

    public String getPassword() {
      return password;
    }

    public void setPassword(String password) {
      this.password = password;
    }

    public int getTimeoutMs() {
      return timeoutMs;
    }

    public void setTimeoutMs(int timeoutMs) {
      this.timeoutMs = timeoutMs;
    }
  }
}
