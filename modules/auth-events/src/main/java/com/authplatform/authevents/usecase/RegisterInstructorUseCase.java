package com.authplatform.authevents.usecase;

import com.authplatform.authevents.contract.BaseEvent;
import com.authplatform.authevents.contract.payload.InstructorRegisteredPayload;

public interface RegisterInstructorUseCase {
  void execute(BaseEvent<InstructorRegisteredPayload> dto) throws Exception;
}
