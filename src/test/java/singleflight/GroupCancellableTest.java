package singleflight;

import commons.Context;
import exceptions.CallerCancelledException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import singleflight.config.GroupConfig;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for callers that stop waiting when their own context is cancelled.
 */
public class GroupCancellableTest {

    private Group<String, String> group;
    private ExecutorService callers;

    @BeforeEach
    void setUp() {
        group = new Group<>(new GroupConfig(4, "test-cancellable", true));
        callers = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        callers.shutdownNow();
        group.close();
    }

    @Test
    void testCompletesNormallyWhenNotCancelled() {
        Context ctx = Context.withCancel(Context.background());
        Result<String> result = group.doCancellable(ctx, "key", ctxFunc -> "bar");

        assertEquals("bar", result.value());
        assertNull(result.error());
        assertFalse(result.shared());
    }

    @Test
    void testPreCancelledContextNeverJoinsOrStarts() {
        Context ctx = Context.withCancel(Context.background());
        ctx.cancel();
        AtomicInteger calls = new AtomicInteger();

        Result<String> result = group.doCancellable(ctx, "key", ctxFunc -> {
            calls.incrementAndGet();
            return "bar";
        });

        CallerCancelledException error = assertInstanceOf(CallerCancelledException.class, result.error());
        assertInstanceOf(CancellationException.class, error.getCause());
        assertFalse(result.shared());
        assertEquals(0, calls.get());
        assertEquals(0, group.getStats().executions());
    }

    @Test
    void testCancelledJoinerLeavesOthersWaiting() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<Result<String>> originator = callers.submit(() -> group.doCall(Context.background(), "key", ctxFunc -> {
            started.countDown();
            release.await();
            return "value";
        }));
        assertTrue(started.await(5, TimeUnit.SECONDS));

        Context joinerCtx = Context.withCancel(Context.background());
        Future<Result<String>> joiner = callers.submit(() -> group.doCancellable(joinerCtx, "key", ctxFunc -> "other"));
        long deadline = System.currentTimeMillis() + 5_000;
        while (group.getStats().joins() < 1) {
            assertTrue(System.currentTimeMillis() < deadline, "joiner did not attach in time");
            Thread.sleep(1);
        }

        joinerCtx.cancel();
        Result<String> cancelled = joiner.get(5, TimeUnit.SECONDS);
        assertInstanceOf(CallerCancelledException.class, cancelled.error());
        assertNull(cancelled.value());
        assertFalse(originator.isDone());
        assertTrue(group.isInFlight("key"));

        release.countDown();
        Result<String> result = originator.get(5, TimeUnit.SECONDS);
        assertEquals("value", result.value());
        assertTrue(result.shared());
    }

    @Test
    void testOriginatorTimeoutLeavesComputationRunning() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        Context ctx = Context.withTimeout(Context.background(), Duration.ofMillis(50));

        Result<String> result = group.doCancellable(ctx, "key", ctxFunc -> {
            calls.incrementAndGet();
            release.await(); // ignores its context
            return "eventually";
        });

        CallerCancelledException error = assertInstanceOf(CallerCancelledException.class, result.error());
        assertInstanceOf(TimeoutException.class, error.getCause());
        assertTrue(group.isInFlight("key"));

        var latecomer = group.doAsync(Context.background(), "key", ctxFunc -> "fresh");
        release.countDown();
        assertEquals("eventually", latecomer.get(5, TimeUnit.SECONDS).value());
        assertEquals(1, calls.get());
        assertFalse(group.isInFlight("key"));
    }

    @Test
    void testRepeatedCallsLeaveNoCallbacksOnContext() {
        Context ctx = Context.withCancel(Context.background());
        for (int i = 0; i < 1_000; i++) {
            Result<String> result = group.doCancellable(ctx, "key-" + (i % 10), ctxFunc -> "v");
            assertEquals("v", result.value());
        }

        assertEquals(0, ctx.pendingCallbackCount());
        assertFalse(ctx.isCancelled());
    }

    @Test
    void testBackgroundContextSkipsCancellationRace() {
        Context background = Context.background();
        for (int i = 0; i < 1_000; i++) {
            assertEquals("v", group.doCancellable(background, "key", ctxFunc -> "v").value());
        }

        assertFalse(background.isCancellable());
        assertEquals(0, background.pendingCallbackCount());
    }

    @Test
    void testCallbackRemovedAfterCancelledWait() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        Context ctx = Context.withTimeout(Context.background(), Duration.ofMillis(20));

        Result<String> result = group.doCancellable(ctx, "key", ctxFunc -> {
            release.await();
            return "late";
        });

        assertInstanceOf(CallerCancelledException.class, result.error());
        assertEquals(0, ctx.pendingCallbackCount());
        release.countDown();
    }
}
