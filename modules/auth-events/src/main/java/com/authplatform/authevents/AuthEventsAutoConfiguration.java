package com.authplatform.authevents;

import com.authplatform.authevents.consumer.AuthEventConsumer;
import com.authplatform.authevents.publisher.AuthEventPublisher;
import com.authplatform.authevents.publisher.KafkaAuthEventPublisher;
import com.authplatform.authevents.usecase.BlockUserUseCase;
import com.authplatform.authevents.usecase.RegisterInstructorUseCase;
import com.authplatform.authevents.usecase.UnblockUserUseCase;
import com.authplatform.authevents.usecase.UpdateUserUseCase;
import com.authplatform.authevents.usecase.VerifyUserUseCase;
import com.authplatform.infra.kafka.config.InfraKafkaAutoConfiguration;
import com.authplatform.infra.kafka.manager.KafkaManager;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(after = InfraKafkaAutoConfiguration.class)
public class AuthEventsAutoConfiguration {
  @Bean
  @ConditionalOnBean(KafkaManager.class)
  @ConditionalOnMissingBean(AuthEventPublisher.class)
  public AuthEventPublisher authEventPublisher(KafkaManager kafkaManager) {
    return new KafkaAuthEventPublisher(kafkaManager);
  }

  @Bean
  @ConditionalOnBean({
    UpdateUserUseCase.class,
    VerifyUserUseCase.class,
    RegisterInstructorUseCase.class,
    BlockUserUseCase.class,
    UnblockUserUseCase.class
  })
  @ConditionalOnMissingBean
  public AuthEventConsumer authEventConsumer(
      UpdateUserUseCase updateUserUseCase,
      VerifyUserUseCase verifyUserUseCase,
      RegisterInstructorUseCase registerInstructorUseCase,
      BlockUserUseCase blockUserUseCase,
      UnblockUserUseCase unblockUserUseCase) {
    return new AuthEventConsumer(
        updateUserUseCase,
        verifyUserUseCase,
        registerInstructorUseCase,
        blockUserUseCase,
        unblockUserUseCase);
  }
}
