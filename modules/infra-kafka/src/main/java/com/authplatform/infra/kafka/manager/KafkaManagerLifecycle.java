package com.authplatform.infra.kafka.manager;

import com.authplatform.infra.kafka.registry.KafkaEventController;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationContext;
import org.springframework.context.event.EventListener;

/** Starts the manager with every {@link KafkaEventController} bean once the application is ready. */
public class KafkaManagerLifecycle {
  private final KafkaManager manager;
  private final ApplicationContext applicationContext;

  public KafkaManagerLifecycle(KafkaManager manager, ApplicationContext applicationContext) {
    this.manager = Objects.requireNonNull(manager, "manager must not be null");
    this.applicationContext =
        Objects.requireNonNull(applicationContext, "applicationContext must not be null");
  }

  @EventListener(ApplicationReadyEvent.class)
  public void start() {
    List<Object> controllers =
        new ArrayList<>(applicationContext.getBeansWithAnnotation(KafkaEventController.class).values());
    manager.initializeHandlers(controllers);
  }

  @PreDestroy
  public void stop() {
    manager.shutdown();
  }
}
