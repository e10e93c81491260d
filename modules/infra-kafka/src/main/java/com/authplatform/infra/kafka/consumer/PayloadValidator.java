package com.authplatform.infra.kafka.consumer;

@FunctionalInterface
public interface PayloadValidator {
  PayloadValidator NONE = payload -> {};

  void validate(Object payload);
}
