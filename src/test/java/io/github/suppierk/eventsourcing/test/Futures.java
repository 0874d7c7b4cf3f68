package io.github.suppierk.eventsourcing.test;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

public final class Futures {
  private Futures() {
    // No instance
  }

  /** Waits for the future to fail and returns the failure with completion wrappers removed. */
  public static <T extends Throwable> T failureOf(
      final CompletableFuture<?> future, final Class<T> expectedType) {
    Throwable failure = assertThrows(CompletionException.class, future::join);
    while (failure instanceof CompletionException && failure.getCause() != null) {
      failure = failure.getCause();
    }

    return assertInstanceOf(expectedType, failure);
  }
}
