package com.authplatform.authevents.usecase;

import com.authplatform.authevents.contract.BaseEvent;
import com.authplatform.authevents.contract.payload.UserBlockedPayload;

public interface BlockUserUseCase {
  void execute(BaseEvent<UserBlockedPayload> dto) throws Exception;
}
