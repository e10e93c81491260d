package com.authplatform.infra.kafka.registry;

public record TopicSubscription(String topic, boolean fromBeginning) {}
