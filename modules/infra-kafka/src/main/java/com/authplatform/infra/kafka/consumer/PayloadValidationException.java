package com.authplatform.infra.kafka.consumer;

import java.util.List;

public class PayloadValidationException extends RuntimeException {
  private final List<String> violations;

  public PayloadValidationException(String payloadType, List<String> violations) {
    super("Invalid payload type=" + payloadType + " violations=" + violations);
    this.violations = List.copyOf(violations);
  }

  public List<String> getViolations() {
    return violations;
  }
}
