import com.google.common.util.concurrent.ListenableFuture;
import commons.Context;
import commons.SingleFlightExecutor;
import org.tinylog.Logger;
import singleflight.Group;
import singleflight.Result;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

public class Main {
    private static final AtomicInteger backendHits = new AtomicInteger();

    private static String fetchProfile(Context ctx, String userId) throws InterruptedException {
        backendHits.incrementAndGet();
        Thread.sleep(200); // slow backend
        if (ctx.isCancelled()) {
            throw new InterruptedException("fetch abandoned: " + ctx.cause());
        }
        return "profile-of-" + userId;
    }

    public static void blockingCallersTest() throws InterruptedException {
        Group<String, String> group = new Group<>();
        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(callers);

        for (int i = 0; i < callers; i++) {
            final int callerId = i;
            pool.submit(() -> {
                try {
                    start.await();
                    Result<String> result = group.doCall(Context.background(), "user:42",
                            ctx -> fetchProfile(ctx, "42"));
                    Logger.info("Caller {} got {} (shared: {})", callerId, result.value(), result.shared());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    finished.countDown();
                }
            });
        }

        start.countDown();
        finished.await();
        pool.shutdown();
        Logger.info("{} callers, {} backend hits, stats = {}", callers, backendHits.get(), group.getStats());
    }

    public static void subscribersTest() throws Exception {
        Group<String, String> group = new Group<>();
        backendHits.set(0);

        List<ListenableFuture<Result<String>>> futures = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            futures.add(group.doAsync(Context.background(), "user:7", ctx -> fetchProfile(ctx, "7")));
        }
        for (ListenableFuture<Result<String>> future : futures) {
            Logger.info("Subscriber got {}", future.get());
        }
        Logger.info("{} subscribers, {} backend hits", futures.size(), backendHits.get());
    }

    public static void main(String[] args) throws Exception {
        blockingCallersTest();
        subscribersTest();
        SingleFlightExecutor.shutdown();
    }
}
