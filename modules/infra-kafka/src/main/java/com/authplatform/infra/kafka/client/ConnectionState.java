package com.authplatform.infra.kafka.client;

public enum ConnectionState {
  UNINITIALIZED,
  CONNECTING,
  CONNECTED,
  DISCONNECTED
}
