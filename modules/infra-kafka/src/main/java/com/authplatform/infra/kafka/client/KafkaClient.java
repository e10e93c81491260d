package com.authplatform.infra.kafka.client;

import com.authplatform.infra.kafka.consumer.EventHandler;
import com.authplatform.infra.kafka.consumer.EventPattern;
import com.authplatform.infra.kafka.consumer.MessageDispatcher;
import com.authplatform.infra.kafka.errors.KafkaConnectionException;
import com.authplatform.infra.kafka.observability.KafkaTelemetry;
import com.authplatform.infra.kafka.producer.KafkaPublishException;
import com.authplatform.infra.kafka.registry.EventPatternScanner;
import com.authplatform.infra.kafka.registry.HandlerBinding;
import com.authplatform.infra.kafka.registry.HandlerRegistry;
import com.authplatform.infra.kafka.registry.TopicSubscription;
import com.authplatform.infra.kafka.serde.SerializationCodec;
import com.authplatform.infra.kafka.serde.schema.SchemaRegistryCodec;
import com.authplatform.infra.kafka.serde.schema.SchemaType;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.DescribeClusterResult;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.ProducerFactory;

/**
 * Owns the process-wide producer and consumer. Producer and consumer connect in parallel and are
 * tracked separately; a single daemon thread polls the consumer and hands every record to the
 * {@link MessageDispatcher}.
 */
public class KafkaClient {
  private static final Logger log = LoggerFactory.getLogger(KafkaClient.class);

  static final String PRODUCER = "producer";
  static final String CONSUMER = "consumer";

  private final ProducerFactory<byte[], byte[]> producerFactory;
  private final ConsumerFactory<byte[], byte[]> consumerFactory;
  private final HandlerRegistry registry;
  private final EventPatternScanner scanner;
  private final MessageDispatcher dispatcher;
  private final SerializationCodec codec;
  private final Supplier<Admin> adminFactory;
  private final KafkaTelemetry telemetry;
  private final Settings settings;

  private final AtomicBoolean running = new AtomicBoolean();
  private volatile Producer<byte[], byte[]> producer;
  private volatile Consumer<byte[], byte[]> consumer;
  private volatile ConnectionState producerState = ConnectionState.UNINITIALIZED;
  private volatile ConnectionState consumerState = ConnectionState.UNINITIALIZED;
  private Thread loopThread;

  public KafkaClient(
      ProducerFactory<byte[], byte[]> producerFactory,
      ConsumerFactory<byte[], byte[]> consumerFactory,
      HandlerRegistry registry,
      EventPatternScanner scanner,
      MessageDispatcher dispatcher,
      SerializationCodec codec,
      Supplier<Admin> adminFactory,
      KafkaTelemetry telemetry,
      Settings settings) {
    this.producerFactory = Objects.requireNonNull(producerFactory, "producerFactory must not be null");
    this.consumerFactory = Objects.requireNonNull(consumerFactory, "consumerFactory must not be null");
    this.registry = Objects.requireNonNull(registry, "registry must not be null");
    this.scanner = Objects.requireNonNull(scanner, "scanner must not be null");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
    this.adminFactory = Objects.requireNonNull(adminFactory, "adminFactory must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    this.settings = settings == null ? Settings.defaults() : settings;
  }

  /**
   * Connects producer and consumer in parallel. Both must succeed; when one fails the other stays
   * connected and the failure is rethrown.
   */
  public synchronized void connect() {
    CompletableFuture<Void> producerConnect = CompletableFuture.runAsync(this::connectProducer);
    CompletableFuture<Void> consumerConnect = CompletableFuture.runAsync(this::connectConsumer);
    try {
      CompletableFuture.allOf(producerConnect, consumerConnect).join();
    } catch (CompletionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      if (cause instanceof KafkaConnectionException connectionException) {
        throw connectionException;
      }
      throw new KafkaConnectionException("client", "Failed to connect Kafka client", cause);
    }
  }

  private void connectProducer() {
    if (producerState == ConnectionState.CONNECTED) {
      return;
    }
    producerState = ConnectionState.CONNECTING;
    try {
      producer = producerFactory.createProducer();
      producerState = ConnectionState.CONNECTED;
      telemetry.onConnect(PRODUCER, true);
      log.info("Kafka producer connected");
    } catch (RuntimeException ex) {
      producerState = ConnectionState.DISCONNECTED;
      telemetry.onConnect(PRODUCER, false);
      log.error("Failed to connect Kafka producer error={}", ex.getMessage());
      throw new KafkaConnectionException(PRODUCER, "Failed to connect Kafka producer", ex);
    }
  }

  private void connectConsumer() {
    if (consumerState == ConnectionState.CONNECTED) {
      return;
    }
    consumerState = ConnectionState.CONNECTING;
    try {
      consumer = consumerFactory.createConsumer();
      consumerState = ConnectionState.CONNECTED;
      telemetry.onConnect(CONSUMER, true);
      log.info("Kafka consumer connected");
    } catch (RuntimeException ex) {
      consumerState = ConnectionState.DISCONNECTED;
      telemetry.onConnect(CONSUMER, false);
      log.error("Failed to connect Kafka consumer error={}", ex.getMessage());
      throw new KafkaConnectionException(CONSUMER, "Failed to connect Kafka consumer", ex);
    }
  }

  public void registerEventHandlers(List<?> owners) {
    if (owners == null) {
      return;
    }
    for (Object owner : owners) {
      List<HandlerBinding> bindings = scanner.scan(owner);
      if (bindings.isEmpty()) {
        log.warn("No Kafka handler methods found owner={}", owner.getClass().getName());
        continue;
      }
      registry.registerAll(bindings);
    }
  }

  public HandlerBinding registerHandler(EventPattern pattern, EventHandler<Object> handler) {
    return registry.register(pattern, handler);
  }

  /**
   * Subscribes once to every registered topic and starts the consumption loop. Registration is
   * closed from here on.
   */
  public synchronized void startConsumers() {
    if (consumerState != ConnectionState.CONNECTED || consumer == null) {
      throw new IllegalStateException("Consumer is not connected");
    }
    if (loopThread != null) {
      log.warn("Kafka consumption already started");
      return;
    }
    List<TopicSubscription> subscriptions = registry.subscriptions();
    if (subscriptions.isEmpty()) {
      log.warn("No Kafka handlers registered, consumption not started");
      return;
    }
    registry.freeze();

    List<String> topics = subscriptions.stream().map(TopicSubscription::topic).toList();
    Set<String> fromBeginningTopics =
        subscriptions.stream()
            .filter(TopicSubscription::fromBeginning)
            .map(TopicSubscription::topic)
            .collect(Collectors.toUnmodifiableSet());
    Consumer<byte[], byte[]> activeConsumer = consumer;
    activeConsumer.subscribe(
        topics, new FromBeginningRebalanceListener(activeConsumer, fromBeginningTopics));

    running.set(true);
    loopThread = new Thread(() -> runLoop(activeConsumer), "kafka-consumer-loop");
    loopThread.setDaemon(true);
    loopThread.start();
    log.info(
        "Kafka consumption started topics={} fromBeginningTopics={}", topics, fromBeginningTopics);
  }

  private void runLoop(Consumer<byte[], byte[]> activeConsumer) {
    try {
      while (running.get()) {
        ConsumerRecords<byte[], byte[]> records = activeConsumer.poll(settings.pollTimeout());
        for (ConsumerRecord<byte[], byte[]> record : records) {
          dispatcher.dispatch(record);
        }
      }
    } catch (WakeupException ex) {
      if (running.get()) {
        log.error("Kafka consumption loop woken up while running", ex);
      }
    } catch (RuntimeException ex) {
      log.error("Kafka consumption loop terminated unexpectedly", ex);
    } finally {
      running.set(false);
      closeConsumer(activeConsumer);
      consumerState = ConnectionState.DISCONNECTED;
    }
  }

  public CompletableFuture<RecordMetadata> send(ProducerRecord<byte[], byte[]> record) {
    Producer<byte[], byte[]> activeProducer = producer;
    if (producerState != ConnectionState.CONNECTED || activeProducer == null) {
      return CompletableFuture.failedFuture(
          new KafkaPublishException(record.topic(), null, "Producer is not connected", null));
    }
    CompletableFuture<RecordMetadata> result = new CompletableFuture<>();
    try {
      activeProducer.send(
          record,
          (metadata, exception) -> {
            if (exception != null) {
              result.completeExceptionally(exception);
            } else {
              result.complete(metadata);
            }
          });
    } catch (RuntimeException ex) {
      result.completeExceptionally(ex);
    }
    return result;
  }

  public int registerSchema(String subject, String schema) {
    return registerSchema(subject, schema, SchemaType.AVRO);
  }

  public int registerSchema(String subject, String schema, SchemaType schemaType) {
    return requireSchemaRegistry().registryClient().register(subject, schema, schemaType);
  }

  public int getSchemaId(String subject) {
    return requireSchemaRegistry().resolveSchemaId(subject);
  }

  private SchemaRegistryCodec requireSchemaRegistry() {
    return codec
        .schemaRegistry()
        .orElseThrow(() -> new IllegalStateException("Schema registry is not configured"));
  }

  /** Describes the cluster through a short-lived admin client. Never throws. */
  public KafkaHealth healthCheck() {
    long timeoutMs = settings.healthTimeout().toMillis();
    try (Admin admin = adminFactory.get()) {
      DescribeClusterResult cluster = admin.describeCluster();
      Map<String, Object> details = new LinkedHashMap<>();
      details.put(
          "clusterId",
          Objects.toString(cluster.clusterId().get(timeoutMs, TimeUnit.MILLISECONDS), "unknown"));
      details.put("brokers", cluster.nodes().get(timeoutMs, TimeUnit.MILLISECONDS).size());
      details.put("topics", admin.listTopics().names().get(timeoutMs, TimeUnit.MILLISECONDS).size());
      details.put(PRODUCER, producerState.name());
      details.put(CONSUMER, consumerState.name());
      return KafkaHealth.healthy(details);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return KafkaHealth.unhealthy("interrupted");
    } catch (Exception ex) {
      log.warn("Kafka health check failed error={}", ex.getMessage());
      return KafkaHealth.unhealthy(ex.getMessage());
    }
  }

  /** Stops the loop, closes both clients and clears the registry. Safe to call repeatedly. */
  public synchronized void disconnect() {
    running.set(false);
    Thread loop = loopThread;
    Consumer<byte[], byte[]> activeConsumer = consumer;
    if (loop != null) {
      if (activeConsumer != null) {
        activeConsumer.wakeup();
      }
      awaitLoop(loop);
      loopThread = null;
    } else if (activeConsumer != null) {
      closeConsumer(activeConsumer);
    }
    consumer = null;
    if (consumerState != ConnectionState.UNINITIALIZED) {
      consumerState = ConnectionState.DISCONNECTED;
    }

    Producer<byte[], byte[]> activeProducer = producer;
    if (activeProducer != null) {
      closeProducer(activeProducer);
    }
    producer = null;
    if (producerState != ConnectionState.UNINITIALIZED) {
      producerState = ConnectionState.DISCONNECTED;
    }
    registry.reset();
    log.info("Kafka client disconnected");
  }

  private void awaitLoop(Thread loop) {
    try {
      loop.join(settings.shutdownTimeout().toMillis());
      if (loop.isAlive()) {
        log.warn(
            "Kafka consumption loop still busy after shutdownTimeoutMs={}",
            settings.shutdownTimeout().toMillis());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for the Kafka consumption loop to stop");
    }
  }

  private void closeConsumer(Consumer<byte[], byte[]> activeConsumer) {
    try {
      activeConsumer.close(settings.shutdownTimeout());
    } catch (RuntimeException ex) {
      log.warn("Failed to close Kafka consumer error={}", ex.getMessage());
    }
  }

  private void closeProducer(Producer<byte[], byte[]> activeProducer) {
    try {
      activeProducer.flush();
      activeProducer.close(settings.shutdownTimeout());
      producerFactory.reset();
    } catch (RuntimeException ex) {
      log.warn("Failed to close Kafka producer error={}", ex.getMessage());
    }
  }

  public ConnectionState producerState() {
    return producerState;
  }

  public ConnectionState consumerState() {
    return consumerState;
  }

  public boolean isConsuming() {
    return running.get();
  }

  public HandlerRegistry registry() {
    return registry;
  }

  public record Settings(Duration pollTimeout, Duration shutdownTimeout, Duration healthTimeout) {
    public Settings {
      pollTimeout = pollTimeout == null ? Duration.ofMillis(1000L) : pollTimeout;
      shutdownTimeout = shutdownTimeout == null ? Duration.ofSeconds(30L) : shutdownTimeout;
      healthTimeout = healthTimeout == null ? Duration.ofSeconds(5L) : healthTimeout;
    }

    public static Settings defaults() {
      return new Settings(null, null, null);
    }
  }
}
