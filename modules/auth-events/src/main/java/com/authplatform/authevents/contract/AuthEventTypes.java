package com.authplatform.authevents.contract;

public final class AuthEventTypes {
  public static final String AUTH_USER_CREATED = "AuthUserCreated";
  public static final String OTP_REQUESTED = "OtpRequestEvent";

  private AuthEventTypes() {}
}
