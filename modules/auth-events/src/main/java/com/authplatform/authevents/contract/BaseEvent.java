package com.authplatform.authevents.contract;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.UUID;

/**
 * Envelope shared by every event the auth service consumes or emits. {@code eventVersion}, {@code
 * source} and {@code correlationId} are optional on inbound events.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BaseEvent<T>(
        @NotBlank(message = "eventId is required") String eventId,
        @NotBlank(message = "eventType is required") String eventType,
        @Positive(message = "timestamp is required") long timestamp,
        String eventVersion,
        String source,
        String correlationId,
        @NotNull(message = "payload is required") @Valid T payload
) {
    public static final String EVENT_VERSION = "0.0.1";
    public static final String SOURCE = "auth-service";

    public static <T> BaseEvent<T> create(
            String eventType,
            long timestamp,
            String correlationId,
            T payload
    ) {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType must not be blank");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
        return new BaseEvent<>(
                UUID.randomUUID().toString(),
                eventType,
                timestamp,
                EVENT_VERSION,
                SOURCE,
                correlationId,
                payload
        );
    }
}
