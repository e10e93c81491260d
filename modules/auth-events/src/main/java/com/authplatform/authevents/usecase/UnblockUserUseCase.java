package com.authplatform.authevents.usecase;

import com.authplatform.authevents.contract.BaseEvent;
import com.authplatform.authevents.contract.payload.UserUnblockedPayload;

public interface UnblockUserUseCase {
  void execute(BaseEvent<UserUnblockedPayload> dto) throws Exception;
}
