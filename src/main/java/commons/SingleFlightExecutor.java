package commons;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Process-wide pools shared by every Group that does not bring its own executor.
 * The worker pool runs asynchronously started computations, the scheduler fires context deadlines.
 */
public class SingleFlightExecutor {
    private static final ExecutorService EXECUTOR_SERVICE = Executors.newFixedThreadPool(
            2 * Runtime.getRuntime().availableProcessors(),
            new ThreadFactoryBuilder().setNameFormat("singleflight-shared-%d").setDaemon(true).build());
    private static final ScheduledExecutorService SCHEDULER_SERVICE = Executors.newScheduledThreadPool(
            1,
            new ThreadFactoryBuilder().setNameFormat("singleflight-deadline-%d").setDaemon(true).build());

    private SingleFlightExecutor() {} // prevent initialization

    public static ExecutorService getExecutorService() {
        return EXECUTOR_SERVICE;
    }

    public static ScheduledExecutorService getSchedulerService() {
        return SCHEDULER_SERVICE;
    }

    public static void shutdown() {
        EXECUTOR_SERVICE.shutdown();
        SCHEDULER_SERVICE.shutdown();
    }

}
