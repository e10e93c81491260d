package com.authplatform.authevents.contract.payload;

public record OtpRequestedPayload(
        String otpChannel,
        String username,
        String email,
        String userId
) {
    public static final String EMAIL_CHANNEL = "email";

    public static OtpRequestedPayload email(String userId, String username, String email) {
        return new OtpRequestedPayload(EMAIL_CHANNEL, username, email, userId);
    }
}
