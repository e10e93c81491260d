package com.authplatform.authevents.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum UserRole {
  ADMIN("admin"),
  INSTRUCTOR("instructor"),
  STUDENT("student");

  private final String value;

  UserRole(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static UserRole fromValue(String value) {
    for (UserRole role : values()) {
      if (role.value.equalsIgnoreCase(value)) {
        return role;
      }
    }
    throw new IllegalArgumentException("Unknown user role: " + value);
  }
}
