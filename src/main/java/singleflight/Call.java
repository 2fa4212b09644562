package singleflight;

import com.google.common.util.concurrent.SettableFuture;
import com.google.common.util.concurrent.Uninterruptibles;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * An in-flight or completed call for one key.
 * A call moves from pending to completed exactly once, when {@link #completion} is set.
 */
final class Call<V> {

    // One-shot broadcast signal, set under the group lock when the computation finishes
    final SettableFuture<Void> completion = SettableFuture.create();

    // Written once by the computing thread before completion fires, read-only afterwards
    V value;
    Throwable error;

    // Guarded by the group lock, only mutated while pending
    int duplicates;
    List<SettableFuture<Result<V>>> subscribers = new ArrayList<>();

    // Frozen under the group lock at completion
    boolean shared;

    void awaitCompletion() {
        try {
            Uninterruptibles.getUninterruptibly(completion);
        } catch (ExecutionException e) {
            // completion is only ever set, never failed
            throw new IllegalStateException("Call completion signal failed", e.getCause());
        }
    }

    Result<V> toResult(boolean sharedFlag) {
        return error == null ? Result.success(value, sharedFlag) : Result.failure(error, sharedFlag);
    }
}
