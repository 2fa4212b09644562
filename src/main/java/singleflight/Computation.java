package singleflight;

import commons.Context;

/**
 * The unit of work a Group coalesces.
 * Implementations own their cancellation handling: the context is passed through untouched and
 * the Group never interrupts a running computation.
 */
@FunctionalInterface
public interface Computation<V> {
    V compute(Context ctx) throws Exception;
}
