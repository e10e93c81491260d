package com.authplatform.infra.kafka.errors;

import com.authplatform.infra.kafka.consumer.DeserializedMessage;
import com.authplatform.infra.kafka.consumer.EventHandler;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs handler calls with bounded retry and an optional timeout. The timeout covers the whole retry
 * sequence. A timed-out call is not interrupted: it keeps running on its pool thread and whatever
 * it does afterwards is ignored by the caller.
 */
public class RetryExecutor implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

  private final ExecutorService handlerExecutor;
  private final Sleeper sleeper;

  public RetryExecutor() {
    this(
        Executors.newCachedThreadPool(handlerThreadFactory()),
        duration -> Thread.sleep(duration.toMillis()));
  }

  public RetryExecutor(ExecutorService handlerExecutor, Sleeper sleeper) {
    this.handlerExecutor =
        Objects.requireNonNull(handlerExecutor, "handlerExecutor must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
  }

  public <T> WrappedHandler<T> wrap(
      String name, EventHandler<T> handler, RetryPolicy policy, Duration timeout) {
    Objects.requireNonNull(handler, "handler must not be null");
    return (payload, message) -> execute(name, () -> handler.handle(payload, message), policy, timeout);
  }

  public CompletableFuture<Void> execute(
      String name, Call call, RetryPolicy policy, Duration timeout) {
    RetryPolicy effectivePolicy = policy == null ? RetryPolicy.NONE : policy;
    CompletableFuture<Void> attempts =
        CompletableFuture.runAsync(() -> runWithRetry(name, call, effectivePolicy), handlerExecutor);
    if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
      attempts = attempts.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    CompletableFuture<Void> result = new CompletableFuture<>();
    attempts.whenComplete(
        (ignored, throwable) -> {
          if (throwable == null) {
            result.complete(null);
            return;
          }
          Throwable cause = unwrap(throwable);
          if (cause instanceof TimeoutException) {
            result.completeExceptionally(new HandlerTimeoutException(name, timeout));
            return;
          }
          result.completeExceptionally(cause);
        });
    return result;
  }

  private void runWithRetry(String name, Call call, RetryPolicy policy) {
    int attempt = 1;
    while (true) {
      try {
        call.run();
        return;
      } catch (Exception ex) {
        if (!policy.isRetryable(ex) || !policy.shouldRetry(attempt, ex)) {
          throw asRuntime(name, ex);
        }
        Duration backoff = policy.backoffForAttempt(attempt);
        log.warn(
            "Retrying Kafka handler handler={} attempt={} backoffMs={} error={}",
            name,
            attempt,
            backoff.toMillis(),
            ex.getMessage());
        sleep(name, backoff);
        attempt++;
      }
    }
  }

  private void sleep(String name, Duration duration) {
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    try {
      sleeper.sleep(duration);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted during retry backoff handler=" + name, interrupted);
    }
  }

  private static RuntimeException asRuntime(String name, Exception ex) {
    if (ex instanceof RuntimeException runtimeException) {
      return runtimeException;
    }
    return new HandlerInvocationException(name, ex);
  }

  private static Throwable unwrap(Throwable throwable) {
    if (throwable instanceof CompletionException completionException
        && completionException.getCause() != null) {
      return completionException.getCause();
    }
    return throwable;
  }

  @Override
  public void close() {
    // in-flight handlers are left to finish
    handlerExecutor.shutdown();
  }

  private static ThreadFactory handlerThreadFactory() {
    AtomicInteger sequence = new AtomicInteger();
    return new ThreadFactory() {
      @Override
      public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, "kafka-handler-" + sequence.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      }
    };
  }

  @FunctionalInterface
  public interface Call {
    void run() throws Exception;
  }

  @FunctionalInterface
  public interface WrappedHandler<T> {
    CompletableFuture<Void> invoke(T payload, DeserializedMessage<?> message);
  }

  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}
