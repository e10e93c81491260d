package com.authplatform.infra.kafka.registry;

import com.authplatform.infra.kafka.consumer.DeserializedMessage;
import com.authplatform.infra.kafka.consumer.EventHandler;
import com.authplatform.infra.kafka.consumer.EventPattern;
import com.authplatform.infra.kafka.consumer.RetryConfig;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Type;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.springframework.core.MethodIntrospector;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.util.ClassUtils;
import org.springframework.util.ReflectionUtils;

/** Turns {@link KafkaEventPattern} methods of an owner object into handler bindings. */
public class EventPatternScanner {

  public List<HandlerBinding> scan(Object owner) {
    if (owner == null) {
      throw new IllegalArgumentException("owner must not be null");
    }
    Class<?> ownerType = ClassUtils.getUserClass(owner);
    Map<Method, KafkaEventPattern> annotated =
        MethodIntrospector.selectMethods(
            ownerType,
            (MethodIntrospector.MetadataLookup<KafkaEventPattern>)
                method -> AnnotatedElementUtils.findMergedAnnotation(method, KafkaEventPattern.class));

    List<Method> methods = new ArrayList<>(annotated.keySet());
    methods.sort(Comparator.comparing(Method::getName).thenComparing(Method::getParameterCount));

    List<HandlerBinding> bindings = new ArrayList<>();
    for (Method method : methods) {
      KafkaEventPattern annotation = annotated.get(method);
      validateSignature(ownerType, method);
      EventPattern pattern = toPattern(annotation, method);
      bindings.add(new HandlerBinding(pattern, invoker(owner, method), owner, method.getName()));
    }
    return bindings;
  }

  static EventPattern toPattern(KafkaEventPattern annotation, Method method) {
    Type payloadType = method.getGenericParameterTypes()[0];
    EventPattern pattern =
        EventPattern.of(annotation.topic())
            .withFromBeginning(annotation.fromBeginning())
            .withSchemaType(payloadType == Object.class ? null : payloadType);
    if (annotation.partition() >= 0) {
      pattern = pattern.withPartition(annotation.partition());
    }
    if (annotation.timeoutMs() > 0L) {
      pattern = pattern.withTimeout(Duration.ofMillis(annotation.timeoutMs()));
    }
    HandlerRetry retry = annotation.retry();
    if (retry.maxAttempts() > 0) {
      pattern =
          pattern.withRetry(
              new RetryConfig(
                  retry.maxAttempts(),
                  retry.backoffFactor(),
                  Duration.ofMillis(Math.max(0L, retry.initialDelayMs())),
                  retry.jitter()));
    }
    return pattern;
  }

  private static void validateSignature(Class<?> ownerType, Method method) {
    Class<?>[] parameters = method.getParameterTypes();
    boolean valid =
        parameters.length == 1
            || (parameters.length == 2 && parameters[1] == DeserializedMessage.class);
    if (!valid) {
      throw new IllegalArgumentException(
          "Handler method must take (payload) or (payload, DeserializedMessage): "
              + ownerType.getName()
              + "#"
              + method.getName());
    }
  }

  private static EventHandler<Object> invoker(Object owner, Method method) {
    ReflectionUtils.makeAccessible(method);
    boolean withMessage = method.getParameterCount() == 2;
    return (payload, message) -> {
      try {
        if (withMessage) {
          method.invoke(owner, payload, message);
        } else {
          method.invoke(owner, payload);
        }
      } catch (InvocationTargetException ex) {
        Throwable target = ex.getTargetException();
        if (target instanceof Exception exception) {
          throw exception;
        }
        throw (Error) target;
      }
    };
  }
}
