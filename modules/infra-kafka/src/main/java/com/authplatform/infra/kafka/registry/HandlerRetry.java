package com.authplatform.infra.kafka.registry;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Target({})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface HandlerRetry {
  /** 0 disables retries for the handler. */
  int maxAttempts() default 0;

  double backoffFactor() default 2.0d;

  long initialDelayMs() default 100L;

  boolean jitter() default false;
}
