package com.authplatform.authevents.contract.payload;

import com.authplatform.authevents.contract.UserRole;
import com.authplatform.authevents.contract.UserStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserCreatedPayload(
        String userId,
        String email,
        UserRole role,
        String avatar,
        Instant createdAt,
        String firstName,
        String lastName,
        UserStatus status
) {
}
