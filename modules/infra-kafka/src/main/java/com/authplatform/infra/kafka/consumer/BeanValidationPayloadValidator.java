package com.authplatform.infra.kafka.consumer;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public class BeanValidationPayloadValidator implements PayloadValidator {
  private final Validator validator;

  public BeanValidationPayloadValidator(Validator validator) {
    this.validator = Objects.requireNonNull(validator, "validator must not be null");
  }

  @Override
  public void validate(Object payload) {
    if (payload == null) {
      return;
    }
    Set<ConstraintViolation<Object>> violations = validator.validate(payload);
    if (violations.isEmpty()) {
      return;
    }
    List<String> messages =
        violations.stream()
            .map(violation -> violation.getPropertyPath() + " " + violation.getMessage())
            .sorted(Comparator.naturalOrder())
            .toList();
    throw new PayloadValidationException(payload.getClass().getSimpleName(), messages);
  }
}
