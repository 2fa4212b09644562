package singleflight;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import commons.Context;
import commons.SingleFlightExecutor;
import exceptions.CallerCancelledException;
import org.tinylog.Logger;
import singleflight.config.GroupConfig;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A namespace of work executed with duplicate suppression.
 * For any key at most one computation is in flight; callers that arrive while it runs wait for it
 * and receive the same value or error. Once the computation finishes the key is forgotten, so the
 * next caller starts a fresh computation. Results are never cached.
 *
 * <p>All registry and call-record mutation happens under a single group-wide lock, which is never held
 * while a computation runs.
 *
 * @param <K> Key type, must implement equals and hashCode
 * @param <V> Value type produced by computations
 */
public class Group<K, V> implements AutoCloseable {

    private final Object lock = new Object();
    private final Map<K, Call<V>> calls = new HashMap<>(); // guarded by lock
    private final Executor asyncExecutor;
    private final ExecutorService ownedExecutor; // null when the executor is borrowed

    private final AtomicLong executions = new AtomicLong(0);
    private final AtomicLong joins = new AtomicLong(0);
    private final AtomicLong forgotten = new AtomicLong(0);

    /**
     * Create a group that runs asynchronous computations on the shared {@link SingleFlightExecutor} pool
     */
    public Group() {
        this(SingleFlightExecutor.getExecutorService());
    }

    /**
     * Create a group that runs asynchronous computations on the given executor. The executor is not shut down by {@link #close()}.
     */
    public Group(Executor asyncExecutor) {
        this.asyncExecutor = Preconditions.checkNotNull(asyncExecutor, "asyncExecutor cannot be null");
        this.ownedExecutor = null;
    }

    /**
     * Create a group with its own worker pool, released by {@link #close()}
     */
    public Group(GroupConfig config) {
        Preconditions.checkNotNull(config, "config cannot be null");
        this.ownedExecutor = Executors.newFixedThreadPool(
                config.getAsyncThreads(),
                new ThreadFactoryBuilder()
                        .setNameFormat(config.getThreadNamePrefix() + "-%d")
                        .setDaemon(config.isDaemon())
                        .build());
        this.asyncExecutor = ownedExecutor;
        Logger.info("Group initialized with {} async threads", config.getAsyncThreads());
    }

    /**
     * Execute the computation for the key unless one is already in flight, in which case wait for it.
     * The originating caller runs the computation on its own thread with its own context.
     * Waiting is not interruptible and the computation is never interrupted by the group.
     *
     * @param ctx Passed as-is to the computation
     * @param key Identifies the logical call
     * @param computation Work to run when no call for the key is in flight
     * @return The shared outcome; joiners always see shared = true, the originator sees whether anyone joined
     */
    public Result<V> doCall(Context ctx, K key, Computation<V> computation) {
        checkArguments(ctx, key, computation);

        Call<V> call;
        boolean joined;
        synchronized (lock) {
            call = calls.get(key);
            joined = call != null;
            if (joined) {
                call.duplicates++;
            } else {
                call = new Call<>();
                calls.put(key, call);
            }
        }

        if (joined) {
            joins.incrementAndGet();
            Logger.debug("Joined in-flight call for key {}", key);
            call.awaitCompletion();
            return call.toResult(true);
        }

        executions.incrementAndGet();
        Logger.debug("Starting call for key {}", key);
        Error fatal = execute(ctx, key, call, computation);
        if (fatal != null) {
            throw fatal;
        }
        return call.toResult(call.shared);
    }

    /**
     * Like {@link #doCall} but never blocks. The returned future is completed exactly once with the shared
     * outcome. When no call is in flight the computation is started on the group's executor.
     */
    public ListenableFuture<Result<V>> doAsync(Context ctx, K key, Computation<V> computation) {
        checkArguments(ctx, key, computation);

        SettableFuture<Result<V>> sink = SettableFuture.create();
        Call<V> call;
        boolean joined;
        synchronized (lock) {
            call = calls.get(key);
            joined = call != null;
            if (joined) {
                call.duplicates++;
            } else {
                call = new Call<>();
                calls.put(key, call);
            }
            call.subscribers.add(sink);
        }

        if (joined) {
            joins.incrementAndGet();
            Logger.debug("Subscribed to in-flight call for key {}", key);
            return sink;
        }

        executions.incrementAndGet();
        Logger.debug("Starting async call for key {}", key);
        Call<V> started = call;
        try {
            asyncExecutor.execute(() -> {
                Error fatal = execute(ctx, key, started, computation);
                if (fatal != null) {
                    Logger.error(fatal, "Async call for key {} terminated with an error", key);
                }
            });
        } catch (RejectedExecutionException e) {
            Logger.error("Executor rejected async call for key {}: {}", key, e.getMessage());
            started.error = e;
            complete(key, started);
        }
        return sink;
    }

    /**
     * Like {@link #doCall} but the wait races the context. If the context is cancelled first the caller gets a
     * {@link CallerCancelledException} outcome, while the computation keeps running for every other caller.
     * The computation always runs on the group's executor so the originator can stop waiting too.
     */
    public Result<V> doCancellable(Context ctx, K key, Computation<V> computation) {
        checkArguments(ctx, key, computation);
        if (ctx.isCancelled()) {
            return Result.failure(new CallerCancelledException(key, ctx.cause()), false);
        }

        ListenableFuture<Result<V>> pending = doAsync(ctx, key, computation);
        if (!ctx.isCancellable()) {
            return Futures.getUnchecked(pending);
        }

        SettableFuture<Result<V>> outcome = SettableFuture.create();
        pending.addListener(() -> outcome.set(Futures.getUnchecked(pending)), MoreExecutors.directExecutor());
        Context.Registration registration = ctx.onCancel(() -> {
            if (outcome.set(Result.failure(new CallerCancelledException(key, ctx.cause()), false))) {
                Logger.debug("Caller for key {} cancelled while waiting", key);
            }
        });

        try {
            return Futures.getUnchecked(outcome);
        } finally {
            registration.remove();
        }
    }

    /**
     * Forget the key if no other caller is waiting on its in-flight call, so that the next caller starts a
     * fresh computation instead of joining.
     *
     * @return true if the key is now absent (it was unknown or just removed), false if the call is shared
     */
    public boolean forgetUnshared(K key) {
        Preconditions.checkNotNull(key, "key cannot be null");
        synchronized (lock) {
            Call<V> call = calls.get(key);
            if (call == null) {
                return true;
            }
            if (call.duplicates > 0) {
                return false;
            }
            calls.remove(key);
        }
        forgotten.incrementAndGet();
        Logger.debug("Forgot unshared call for key {}", key);
        return true;
    }

    /**
     * @return Number of keys with a call currently in flight
     */
    public int inFlightCount() {
        synchronized (lock) {
            return calls.size();
        }
    }

    public boolean isInFlight(K key) {
        synchronized (lock) {
            return calls.containsKey(key);
        }
    }

    public GroupStats getStats() {
        return new GroupStats(executions.get(), joins.get(), forgotten.get());
    }

    /**
     * Shut down the worker pool if this group created it. In-flight computations are allowed to finish.
     */
    @Override
    public void close() {
        if (ownedExecutor != null && !ownedExecutor.isShutdown()) {
            ownedExecutor.shutdown();
            Logger.info("Group worker pool shut down");
        }
    }

    /**
     * Run the computation, then complete the call for every waiter.
     *
     * @return An Error thrown by the computation, already recorded on the call, for the caller to rethrow or log
     */
    private Error execute(Context ctx, K key, Call<V> call, Computation<V> computation) {
        Error fatal = null;
        try {
            call.value = computation.compute(ctx);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            call.error = e;
        } catch (Error e) {
            Logger.warn("Call for key {} failed with {}", key, e.toString());
            call.error = e;
            fatal = e;
        } catch (Throwable t) {
            call.error = t;
        }
        complete(key, call);
        return fatal;
    }

    private void complete(K key, Call<V> call) {
        List<SettableFuture<Result<V>>> subscribers;
        synchronized (lock) {
            call.shared = call.duplicates > 0;
            call.completion.set(null);
            calls.remove(key, call); // a forgotten call may have been replaced by a newer one
            subscribers = call.subscribers;
            call.subscribers = List.of();
        }

        Result<V> result = call.toResult(call.shared);
        Logger.trace("Completed call for key {} (shared: {}, subscribers: {})", key, result.shared(), subscribers.size());
        for (SettableFuture<Result<V>> subscriber : subscribers) {
            subscriber.set(result);
        }
    }

    private static void checkArguments(Context ctx, Object key, Computation<?> computation) {
        Preconditions.checkNotNull(ctx, "ctx cannot be null");
        Preconditions.checkNotNull(key, "key cannot be null");
        Preconditions.checkNotNull(computation, "computation cannot be null");
    }
}
