package com.authplatform.infra.kafka.registry;

import com.authplatform.infra.kafka.consumer.EventHandler;
import com.authplatform.infra.kafka.consumer.EventPattern;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Topic to handler bindings. Written only during startup registration and read only by the
 * consumption loop once {@link #freeze()} has been called, so the table is not synchronized.
 */
public class HandlerRegistry {
  private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

  private final Map<String, List<HandlerBinding>> bindingsByTopic = new LinkedHashMap<>();
  private volatile boolean frozen;

  public HandlerBinding register(
      EventPattern pattern, EventHandler<Object> handler, Object owner, String methodName) {
    if (frozen) {
      throw new IllegalStateException(
          "Handlers must be registered before consumption starts topic="
              + (pattern == null ? null : pattern.topic()));
    }
    HandlerBinding binding = new HandlerBinding(pattern, handler, owner, methodName);
    bindingsByTopic.computeIfAbsent(pattern.topic(), topic -> new ArrayList<>()).add(binding);
    log.info(
        "Registered Kafka handler topic={} handler={} partition={} fromBeginning={}",
        pattern.topic(),
        binding.description(),
        pattern.partition(),
        pattern.fromBeginning());
    return binding;
  }

  public HandlerBinding register(EventPattern pattern, EventHandler<Object> handler) {
    return register(pattern, handler, null, null);
  }

  public void registerAll(List<HandlerBinding> bindings) {
    for (HandlerBinding binding : bindings) {
      register(binding.pattern(), binding.handler(), binding.owner(), binding.methodName());
    }
  }

  public List<HandlerBinding> getBindings(String topic) {
    List<HandlerBinding> bindings = bindingsByTopic.get(topic);
    if (bindings == null) {
      return List.of();
    }
    return Collections.unmodifiableList(bindings);
  }

  /** One entry per distinct topic; {@code fromBeginning} is set if any binding asks for it. */
  public List<TopicSubscription> subscriptions() {
    List<TopicSubscription> subscriptions = new ArrayList<>();
    bindingsByTopic.forEach(
        (topic, bindings) ->
            subscriptions.add(
                new TopicSubscription(
                    topic,
                    bindings.stream().anyMatch(binding -> binding.pattern().fromBeginning()))));
    return subscriptions;
  }

  public boolean isEmpty() {
    return bindingsByTopic.isEmpty();
  }

  public int size() {
    return bindingsByTopic.values().stream().mapToInt(List::size).sum();
  }

  public void freeze() {
    frozen = true;
  }

  public boolean isFrozen() {
    return frozen;
  }

  /** Drops every binding when the client shuts down so a later start registers from scratch. */
  public void reset() {
    bindingsByTopic.clear();
    frozen = false;
  }
}
