package com.authplatform.authevents.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AuthType {
  EMAIL("email"),
  OAUTH("oauth");

  private final String value;

  AuthType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static AuthType fromValue(String value) {
    for (AuthType type : values()) {
      if (type.value.equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown auth type: " + value);
  }
}
