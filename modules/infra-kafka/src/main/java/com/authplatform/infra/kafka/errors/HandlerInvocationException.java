package com.authplatform.infra.kafka.errors;

public class HandlerInvocationException extends RuntimeException {
  private final String handler;

  public HandlerInvocationException(String handler, Throwable cause) {
    super("Handler failed handler=" + handler + " error=" + cause.getMessage(), cause);
    this.handler = handler;
  }

  public String getHandler() {
    return handler;
  }
}
