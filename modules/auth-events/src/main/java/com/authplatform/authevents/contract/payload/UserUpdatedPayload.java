package com.authplatform.authevents.contract.payload;

import com.authplatform.authevents.contract.UserRole;
import com.authplatform.authevents.contract.UserStatus;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.hibernate.validator.constraints.UUID;

public record UserUpdatedPayload(
        @NotBlank @UUID String userId,
        @NotBlank @Email(message = "Invalid email format") String email,
        String username,
        String avatar,
        @NotBlank(message = "Name is required")
        @Size(min = 3, message = "Name must be at least 3 characters long")
        String firstName,
        @Size(min = 3, message = "Name must be at least 3 characters long") String lastName,
        @NotNull(message = "Role must be one of the valid user roles") UserRole role,
        @NotNull(message = "status must be one of the valid user statuses") UserStatus status
) {
}
