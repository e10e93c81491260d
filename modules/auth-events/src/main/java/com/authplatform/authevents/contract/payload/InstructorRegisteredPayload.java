package com.authplatform.authevents.contract.payload;

import com.authplatform.authevents.contract.AuthType;
import com.authplatform.authevents.contract.UserRole;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.hibernate.validator.constraints.UUID;

public record InstructorRegisteredPayload(
        @NotBlank @UUID String userId,
        @NotBlank @Email(message = "Invalid email format") String email,
        @NotBlank(message = "Password is required")
        @Size(min = 6, message = "Password must be at least 6 characters long")
        String password,
        String avatar,
        @NotBlank(message = "First name is required")
        @Size(min = 3, message = "First name must be at least 3 characters long")
        String firstName,
        @Size(min = 3, message = "Last name must be at least 3 characters long") String lastName,
        @NotNull(message = "Role must be one of the valid user roles") UserRole role,
        @NotNull(message = "AuthType must be one of the valid auth types") AuthType authType
) {
    @Override
    public String toString() {
        return "InstructorRegisteredPayload[userId=" + userId + ", email=" + email + "]";
    }
}
