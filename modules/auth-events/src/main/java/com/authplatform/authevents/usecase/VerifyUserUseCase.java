package com.authplatform.authevents.usecase;

import com.authplatform.authevents.contract.payload.OtpVerifiedPayload;

/** Marks the user verified once the notification service has confirmed the OTP. */
public interface VerifyUserUseCase {
  void execute(OtpVerifiedPayload dto) throws Exception;
}
