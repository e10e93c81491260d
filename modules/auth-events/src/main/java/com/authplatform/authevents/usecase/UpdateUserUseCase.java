package com.authplatform.authevents.usecase;

import com.authplatform.authevents.contract.BaseEvent;
import com.authplatform.authevents.contract.payload.UserUpdatedPayload;

/** Applies a profile change published by the user service. */
public interface UpdateUserUseCase {
  void execute(BaseEvent<UserUpdatedPayload> dto) throws Exception;
}
