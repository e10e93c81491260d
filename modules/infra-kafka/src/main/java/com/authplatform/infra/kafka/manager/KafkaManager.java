package com.authplatform.infra.kafka.manager;

import com.authplatform.infra.kafka.client.KafkaClient;
import com.authplatform.infra.kafka.producer.EventPublisher;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the messaging layer. One instance per process, built by the composition root;
 * {@link #getPublisher()} and {@link #getClient()} are only available once {@link
 * #initializeHandlers(List)} has completed.
 */
public class KafkaManager {
  private static final Logger log = LoggerFactory.getLogger(KafkaManager.class);

  private final KafkaClient client;
  private final EventPublisher publisher;
  private volatile boolean initialized;

  public KafkaManager(KafkaClient client, EventPublisher publisher) {
    this.client = Objects.requireNonNull(client, "client must not be null");
    this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
  }

  /**
   * Connects the client and, when owners are supplied, registers their handler methods and starts
   * consuming. A second call is ignored. If registration or startup fails the client is
   * disconnected, which clears its registry, and the call can be retried.
   */
  public synchronized void initializeHandlers(List<?> owners) {
    if (initialized) {
      log.warn("KafkaManager already initialized, ignoring initializeHandlers");
      return;
    }
    int ownerCount = owners == null ? 0 : owners.size();
    log.info("Initializing KafkaManager owners={}", ownerCount);
    client.connect();
    if (ownerCount > 0) {
      try {
        client.registerEventHandlers(owners);
        client.startConsumers();
      } catch (RuntimeException ex) {
        log.error("Failed to initialize KafkaManager error={}", ex.getMessage());
        // drops partial bindings so a later call starts from an empty registry
        client.disconnect();
        throw ex;
      }
    } else {
      log.warn("No Kafka event controllers supplied, consumption not started");
    }
    initialized = true;
    log.info("KafkaManager initialized handlers={}", client.registry().size());
  }

  public synchronized void shutdown() {
    if (!initialized) {
      return;
    }
    client.disconnect();
    initialized = false;
    log.info("KafkaManager shut down");
  }

  public EventPublisher getPublisher() {
    requireInitialized();
    return publisher;
  }

  public KafkaClient getClient() {
    requireInitialized();
    return client;
  }

  public boolean isInitialized() {
    return initialized;
  }

  private void requireInitialized() {
    if (!initialized) {
      throw new IllegalStateException(
          "KafkaManager not initialized. Call initializeHandlers() first.");
    }
  }
}
