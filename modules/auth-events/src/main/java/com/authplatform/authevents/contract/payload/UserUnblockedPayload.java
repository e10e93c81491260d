package com.authplatform.authevents.contract.payload;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record UserUnblockedPayload(
        @NotBlank(message = "userId is required") String userId,
        @NotBlank(message = "email is required") @Email(message = "Invalid email format") String email,
        @NotBlank(message = "role is required") String role,
        @NotBlank(message = "status is required") String status,
        String firstName,
        String avatar
) {
}
