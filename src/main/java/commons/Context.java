package commons;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import org.tinylog.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cancellation token handed to every computation run by a Group.
 * A context is cancelled at most once, either explicitly, by its deadline, or because its parent was cancelled.
 * Computations decide for themselves whether to honor it; the Group never cancels one.
 */
public class Context {
    private static final Context BACKGROUND = new Context();
    private static final Registration NO_OP = () -> {};

    /**
     * Handle returned by {@link #onCancel(Runnable)}; removing it drops the callback if it has not run yet
     */
    @FunctionalInterface
    public interface Registration {
        void remove();
    }

    private final SettableFuture<Void> done = SettableFuture.create();
    private final boolean cancellable;
    private final Set<Runnable> callbacks = new LinkedHashSet<>(); // guarded by this
    private volatile Throwable cause;
    private ScheduledFuture<?> deadlineTask; // guarded by this
    private Registration parentRegistration; // guarded by this

    private Context() {
        this.cancellable = false;
    }

    private Context(Context parent) {
        this.cancellable = true;
        Registration registration = parent.onCancel(() -> cancel(parent.cause()));
        synchronized (this) {
            if (cause == null) {
                parentRegistration = registration;
                return;
            }
        }
        registration.remove();
    }

    /**
     * @return The root context, never cancelled
     */
    public static Context background() {
        return BACKGROUND;
    }

    /**
     * Create a child context that is cancelled by {@link #cancel()} or when the parent is cancelled
     */
    public static Context withCancel(Context parent) {
        Preconditions.checkNotNull(parent, "parent context cannot be null");
        return new Context(parent);
    }

    /**
     * Create a child context that cancels itself once the timeout elapses
     *
     * @param parent The parent context
     * @param timeout Time until the context is cancelled with a {@link TimeoutException} cause
     */
    public static Context withTimeout(Context parent, Duration timeout) {
        Preconditions.checkNotNull(parent, "parent context cannot be null");
        Preconditions.checkNotNull(timeout, "timeout cannot be null");
        Context ctx = new Context(parent);
        if (timeout.isZero() || timeout.isNegative()) {
            ctx.cancel(new TimeoutException("context deadline exceeded"));
            return ctx;
        }

        ScheduledFuture<?> task = SingleFlightExecutor.getSchedulerService().schedule(
                () -> ctx.cancel(new TimeoutException("context deadline exceeded after " + timeout.toMillis() + "ms")),
                timeout.toMillis(),
                TimeUnit.MILLISECONDS);
        synchronized (ctx) {
            if (ctx.isCancelled()) {
                task.cancel(false);
            } else {
                ctx.deadlineTask = task;
            }
        }
        return ctx;
    }

    /**
     * Cancel this context and all of its children.
     *
     * @return true if this call cancelled the context, false if it was already cancelled or is the background context
     */
    public boolean cancel() {
        return cancel(new CancellationException("context cancelled"));
    }

    private boolean cancel(Throwable cancelCause) {
        if (!cancellable) {
            return false;
        }
        ScheduledFuture<?> task;
        Registration fromParent;
        List<Runnable> toRun;
        synchronized (this) {
            if (cause != null) {
                return false;
            }
            cause = cancelCause;
            task = deadlineTask;
            deadlineTask = null;
            fromParent = parentRegistration;
            parentRegistration = null;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        if (task != null) {
            task.cancel(false);
        }
        if (fromParent != null) {
            fromParent.remove();
        }
        for (Runnable callback : toRun) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                Logger.error(e, "Cancellation callback failed");
            }
        }
        done.set(null);
        return true;
    }

    /**
     * Run the callback once when this context is cancelled, or right away if it already is.
     * Callers that stop caring before cancellation must remove the returned registration.
     */
    public Registration onCancel(Runnable callback) {
        Preconditions.checkNotNull(callback, "callback cannot be null");
        if (!cancellable) {
            return NO_OP;
        }
        synchronized (this) {
            if (cause == null) {
                callbacks.add(callback);
                return () -> {
                    synchronized (this) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        callback.run();
        return NO_OP;
    }

    /**
     * @return false for contexts that can never be cancelled, such as the background context
     */
    public boolean isCancellable() {
        return cancellable;
    }

    public boolean isCancelled() {
        return cause != null;
    }

    /**
     * @return Why the context was cancelled, or null while it is still live
     */
    public Throwable cause() {
        return cause;
    }

    /**
     * @return Number of callbacks waiting for this context to be cancelled
     */
    public synchronized int pendingCallbackCount() {
        return callbacks.size();
    }

    /**
     * @return A future that completes when this context is cancelled; never completes for the background context
     */
    public ListenableFuture<Void> done() {
        return Futures.nonCancellationPropagating(done);
    }

    @Override
    public String toString() {
        if (!cancellable) {
            return "Context(background)";
        }
        return "Context(cancelled=" + isCancelled() + (isCancelled() ? ", cause=" + cause : "") + ")";
    }
}
