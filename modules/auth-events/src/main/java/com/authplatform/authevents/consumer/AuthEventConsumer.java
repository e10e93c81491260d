package com.authplatform.authevents.consumer;

import com.authplatform.authevents.contract.BaseEvent;
import com.authplatform.authevents.contract.payload.InstructorRegisteredPayload;
import com.authplatform.authevents.contract.payload.OtpVerifiedPayload;
import com.authplatform.authevents.contract.payload.UserBlockedPayload;
import com.authplatform.authevents.contract.payload.UserUnblockedPayload;
import com.authplatform.authevents.contract.payload.UserUpdatedPayload;
import com.authplatform.authevents.topics.AuthTopics;
import com.authplatform.authevents.usecase.BlockUserUseCase;
import com.authplatform.authevents.usecase.RegisterInstructorUseCase;
import com.authplatform.authevents.usecase.UnblockUserUseCase;
import com.authplatform.authevents.usecase.UpdateUserUseCase;
import com.authplatform.authevents.usecase.VerifyUserUseCase;
import com.authplatform.infra.kafka.consumer.DeserializedMessage;
import com.authplatform.infra.kafka.registry.KafkaEventController;
import com.authplatform.infra.kafka.registry.KafkaEventPattern;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Inbound side of the auth service. Payloads arrive converted and validated; each method hands the
 * event to its use case.
 */
@KafkaEventController
public class AuthEventConsumer {
  private static final Logger log = LoggerFactory.getLogger(AuthEventConsumer.class);

  private final UpdateUserUseCase updateUserUseCase;
  private final VerifyUserUseCase verifyUserUseCase;
  private final RegisterInstructorUseCase registerInstructorUseCase;
  private final BlockUserUseCase blockUserUseCase;
  private final UnblockUserUseCase unblockUserUseCase;

  public AuthEventConsumer(
      UpdateUserUseCase updateUserUseCase,
      VerifyUserUseCase verifyUserUseCase,
      RegisterInstructorUseCase registerInstructorUseCase,
      BlockUserUseCase blockUserUseCase,
      UnblockUserUseCase unblockUserUseCase) {
    this.updateUserUseCase =
        Objects.requireNonNull(updateUserUseCase, "updateUserUseCase must not be null");
    this.verifyUserUseCase =
        Objects.requireNonNull(verifyUserUseCase, "verifyUserUseCase must not be null");
    this.registerInstructorUseCase =
        Objects.requireNonNull(
            registerInstructorUseCase, "registerInstructorUseCase must not be null");
    this.blockUserUseCase =
        Objects.requireNonNull(blockUserUseCase, "blockUserUseCase must not be null");
    this.unblockUserUseCase =
        Objects.requireNonNull(unblockUserUseCase, "unblockUserUseCase must not be null");
  }

  @KafkaEventPattern(topic = AuthTopics.USER_UPDATED)
  public void handleUserUpdated(BaseEvent<UserUpdatedPayload> event, DeserializedMessage<?> message)
      throws Exception {
    logReceived(event, message);
    updateUserUseCase.execute(event);
  }

  @KafkaEventPattern(topic = AuthTopics.AUTH_OTP_VERIFIED)
  public void handleOtpVerified(BaseEvent<OtpVerifiedPayload> event, DeserializedMessage<?> message)
      throws Exception {
    logReceived(event, message);
    verifyUserUseCase.execute(event.payload());
  }

  @KafkaEventPattern(topic = AuthTopics.USER_INSTRUCTOR_REGISTERED)
  public void handleInstructorRegistered(
      BaseEvent<InstructorRegisteredPayload> event, DeserializedMessage<?> message)
      throws Exception {
    logReceived(event, message);
    registerInstructorUseCase.execute(event);
  }

  @KafkaEventPattern(topic = AuthTopics.USER_BLOCKED)
  public void handleUserBlocked(BaseEvent<UserBlockedPayload> event, DeserializedMessage<?> message)
      throws Exception {
    logReceived(event, message);
    blockUserUseCase.execute(event);
  }

  @KafkaEventPattern(topic = AuthTopics.USER_UNBLOCKED)
  public void handleUserUnblocked(
      BaseEvent<UserUnblockedPayload> event, DeserializedMessage<?> message) throws Exception {
    logReceived(event, message);
    unblockUserUseCase.execute(event);
  }

  private static void logReceived(BaseEvent<?> event, DeserializedMessage<?> message) {
    log.debug(
        "Received auth event topic={} partition={} offset={} eventId={} eventType={}",
        message.topic(),
        message.partition(),
        message.offset(),
        event.eventId(),
        event.eventType());
  }
}
