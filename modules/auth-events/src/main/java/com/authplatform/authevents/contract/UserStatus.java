package com.authplatform.authevents.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum UserStatus {
  VERIFIED("verified"),
  NOT_VERIFIED("not-verified"),
  ACTIVE("active"),
  NOT_ACTIVE("not-active"),
  BLOCKED("blocked");

  private final String value;

  UserStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static UserStatus fromValue(String value) {
    for (UserStatus status : values()) {
      if (status.value.equalsIgnoreCase(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown user status: " + value);
  }
}
