package com.authplatform.infra.kafka.producer;

public class KafkaPublishException extends RuntimeException {
  private final String topic;
  private final Object key;

  public KafkaPublishException(String topic, Object key, String message, Throwable cause) {
    super(message, cause);
    this.topic = topic;
    this.key = key;
  }

  public String getTopic() {
    return topic;
  }

  public Object getKey() {
    return key;
  }
}
