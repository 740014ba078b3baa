package me.christianrobert.namereduce.core.tools;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Helpers for calling asynchronous collaborators that may also fail synchronously.
 */
public final class FutureUtils {

    private FutureUtils() {
    }

    /**
     * Invokes an asynchronous call and folds synchronous failures (a thrown exception or a
     * null future) into a failed future, so callers only have one failure path to handle.
     */
    public static <T> CompletableFuture<T> call(Supplier<CompletableFuture<T>> asyncCall) {
        try {
            CompletableFuture<T> future = asyncCall.get();
            if (future == null) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("Asynchronous call returned no future"));
            }
            return future;
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Strips the wrappers {@link CompletableFuture} puts around the real cause.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
