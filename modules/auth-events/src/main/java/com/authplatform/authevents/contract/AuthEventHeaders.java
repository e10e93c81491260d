package com.authplatform.authevents.contract;

public final class AuthEventHeaders {
  public static final String X_EVENT_TYPE = "x-event-type";
  public static final String X_EVENT_VERSION = "x-event-version";
  public static final String X_CORRELATION_ID = "x-correlation-id";

  private AuthEventHeaders() {}
}
