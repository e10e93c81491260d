package com.authplatform.infra.kafka.client;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewinds newly assigned partitions of "from beginning" topics when the group has no committed
 * offset for them yet. Partitions with a committed offset resume from it.
 */
class FromBeginningRebalanceListener implements ConsumerRebalanceListener {
  private static final Logger log = LoggerFactory.getLogger(FromBeginningRebalanceListener.class);

  private final Consumer<?, ?> consumer;
  private final Set<String> fromBeginningTopics;

  FromBeginningRebalanceListener(Consumer<?, ?> consumer, Set<String> fromBeginningTopics) {
    this.consumer = Objects.requireNonNull(consumer, "consumer must not be null");
    this.fromBeginningTopics = Set.copyOf(fromBeginningTopics);
  }

  @Override
  public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
    Set<TopicPartition> candidates = new LinkedHashSet<>();
    for (TopicPartition partition : partitions) {
      if (fromBeginningTopics.contains(partition.topic())) {
        candidates.add(partition);
      }
    }
    if (candidates.isEmpty()) {
      return;
    }

    Map<TopicPartition, OffsetAndMetadata> committed = consumer.committed(candidates);
    List<TopicPartition> uncommitted =
        candidates.stream().filter(partition -> committed.get(partition) == null).toList();
    if (uncommitted.isEmpty()) {
      return;
    }
    consumer.seekToBeginning(uncommitted);
    log.info("Seeking Kafka partitions to beginning partitions={}", uncommitted);
  }

  @Override
  public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
    log.debug("Kafka partitions revoked partitions={}", partitions);
  }
}
