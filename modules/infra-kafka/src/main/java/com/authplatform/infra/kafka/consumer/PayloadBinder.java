package com.authplatform.infra.kafka.consumer;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.lang.reflect.Type;
import java.util.Objects;

/** Converts the shared decoded value into a fresh handler-specific instance and validates it. */
public class PayloadBinder {
  private final ObjectMapper objectMapper;
  private final PayloadValidator validator;

  public PayloadBinder(ObjectMapper objectMapper, PayloadValidator validator) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    this.validator = validator == null ? PayloadValidator.NONE : validator;
  }

  public Object bind(Object value, Type schemaType) {
    if (schemaType == null || schemaType == Object.class || value == null) {
      return value;
    }
    JavaType targetType = objectMapper.getTypeFactory().constructType(schemaType);
    Object converted = objectMapper.convertValue(value, targetType);
    validator.validate(converted);
    return converted;
  }
}
