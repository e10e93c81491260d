package com.authplatform.authevents.contract.payload;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import org.hibernate.validator.constraints.UUID;

public record OtpVerifiedPayload(
        @NotBlank @UUID String userId,
        String username,
        @NotBlank @Email(message = "Invalid email format") String email,
        String status
) {
}
