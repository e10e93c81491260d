package com.authplatform.infra.kafka.registry;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds a method to a topic. The method takes the payload, optionally followed by the {@code
 * DeserializedMessage}. A payload parameter other than {@code Object} is converted and validated
 * before the call.
 *
 * <p>Handlers of one owner are bound in method-name order, then by parameter count, not in
 * declaration order. Several handlers on the same topic therefore run alphabetically by method
 * name, after those of owners registered earlier.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface KafkaEventPattern {
  String topic();

  /** Negative means every partition. */
  int partition() default -1;

  boolean fromBeginning() default false;

  /** 0 means no timeout. */
  long timeoutMs() default 0L;

  HandlerRetry retry() default @HandlerRetry;
}
