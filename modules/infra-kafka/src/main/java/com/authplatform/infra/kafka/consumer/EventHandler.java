package com.authplatform.infra.kafka.consumer;

@FunctionalInterface
public interface EventHandler<T> {
  void handle(T payload, DeserializedMessage<?> message) throws Exception;
}
