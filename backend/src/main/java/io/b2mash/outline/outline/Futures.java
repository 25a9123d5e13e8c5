package io.b2mash.outline.outline;

import io.b2mash.outline.exception.OutlineTransportException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

final class Futures {

  private Futures() {}

  /** Strips the {@link CompletionException} and {@link ExecutionException} layers. */
  static Throwable unwrap(Throwable ex) {
    Throwable current = ex;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /** Rethrows as the typed runtime error the store raised, or a transport error otherwise. */
  static RuntimeException asRuntime(Throwable ex) {
    Throwable cause = unwrap(ex);
    if (cause instanceof RuntimeException runtime) {
      return runtime;
    }
    return new OutlineTransportException(String.valueOf(cause.getMessage()), cause);
  }

  /** Blocks for the result, surfacing the original typed exception. */
  static <T> T join(CompletableFuture<T> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      throw asRuntime(e);
    }
  }
}
