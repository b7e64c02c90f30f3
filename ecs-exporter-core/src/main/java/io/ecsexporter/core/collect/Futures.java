package io.ecsexporter.core.collect;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Helpers for composing API calls as {@link CompletableFuture}s.
 */
public final class Futures {

    private Futures() {
    }

    /**
     * Invoke an asynchronous call, turning a synchronous throw or a {@code null}
     * future into an exceptionally completed one.
     */
    public static <T> CompletableFuture<T> invoke(Supplier<CompletableFuture<T>> call) {
        try {
            CompletableFuture<T> future = call.get();
            if (future == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("API call returned no future"));
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Strip the wrappers {@link CompletableFuture} puts around the original failure.
     */
    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
