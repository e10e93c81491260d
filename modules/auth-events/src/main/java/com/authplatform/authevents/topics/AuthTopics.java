package com.authplatform.authevents.topics;

import java.util.List;

public final class AuthTopics {
  public static final String USER_UPDATED = "user.updated";
  public static final String AUTH_OTP_VERIFIED = "auth.otp.verified";
  public static final String USER_INSTRUCTOR_REGISTERED = "user.instructor.registered";
  public static final String USER_BLOCKED = "user.blocked";
  public static final String USER_UNBLOCKED = "user.unblocked";

  public static final String AUTH_USER_CREATED = "auth.user.created";
  public static final String AUTH_OTP_REQUESTED = "auth.otp.requested";

  private AuthTopics() {}

  public static List<String> inbound() {
    return List.of(
        USER_UPDATED, AUTH_OTP_VERIFIED, USER_INSTRUCTOR_REGISTERED, USER_BLOCKED, USER_UNBLOCKED);
  }

  public static List<String> outbound() {
    return List.of(AUTH_USER_CREATED, AUTH_OTP_REQUESTED);
  }
}
