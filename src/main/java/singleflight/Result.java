package singleflight;

import java.util.concurrent.ExecutionException;

/**
 * The outcome of a coalesced call as seen by one caller.
 * Every caller attached to the same call sees the same value and error; {@code shared} tells whether
 * the result was also handed to at least one other caller.
 *
 * @param value The computed value, null when the computation failed
 * @param error The exception thrown by the computation, null on success
 * @param shared Whether the result was delivered to more than one caller
 */
public record Result<V>(V value, Throwable error, boolean shared) {

    public static <V> Result<V> success(V value, boolean shared) {
        return new Result<>(value, null, shared);
    }

    public static <V> Result<V> failure(Throwable error, boolean shared) {
        return new Result<>(null, error, shared);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Get the value, throwing ExecutionException if the computation failed
     */
    public V getOrThrow() throws ExecutionException {
        if (error != null) {
            throw new ExecutionException(error);
        }
        return value;
    }
}
