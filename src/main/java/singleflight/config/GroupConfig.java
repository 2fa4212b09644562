package singleflight.config;

import java.util.Properties;

/**
 * Configuration for a Group that owns its own asynchronous worker pool
 */
public class GroupConfig {
    private final int asyncThreads;
    private final String threadNamePrefix;
    private final boolean daemon;

    // Default values
    private static final int DEFAULT_ASYNC_THREADS = 2 * Runtime.getRuntime().availableProcessors();
    private static final String DEFAULT_THREAD_NAME_PREFIX = "singleflight-async";
    private static final boolean DEFAULT_DAEMON = true;

    private static final int MIN_ASYNC_THREADS = 1;
    private static final int MAX_ASYNC_THREADS = 1024;

    /**
     * Create GroupConfig with default values
     */
    public GroupConfig() {
        this.asyncThreads = DEFAULT_ASYNC_THREADS;
        this.threadNamePrefix = DEFAULT_THREAD_NAME_PREFIX;
        this.daemon = DEFAULT_DAEMON;
    }

    /**
     * Create GroupConfig from Properties
     *
     * @param props Configuration properties
     */
    public GroupConfig(Properties props) {
        this.asyncThreads = Integer.parseInt(
                props.getProperty("async.threads", String.valueOf(DEFAULT_ASYNC_THREADS)).trim());
        GroupConfigValidator.validateRange(this.asyncThreads, MIN_ASYNC_THREADS, MAX_ASYNC_THREADS, "Async threads");

        this.threadNamePrefix = props.getProperty("async.thread.name.prefix", DEFAULT_THREAD_NAME_PREFIX);
        GroupConfigValidator.validateNotBlank(this.threadNamePrefix, "Async thread name prefix");

        this.daemon = Boolean.parseBoolean(
                props.getProperty("async.daemon", String.valueOf(DEFAULT_DAEMON)).trim());
    }

    /**
     * Create GroupConfig with specified values
     */
    public GroupConfig(int asyncThreads, String threadNamePrefix, boolean daemon) {
        GroupConfigValidator.validateRange(asyncThreads, MIN_ASYNC_THREADS, MAX_ASYNC_THREADS, "Async threads");
        GroupConfigValidator.validateNotBlank(threadNamePrefix, "Async thread name prefix");

        this.asyncThreads = asyncThreads;
        this.threadNamePrefix = threadNamePrefix;
        this.daemon = daemon;
    }

    public int getAsyncThreads() {
        return asyncThreads;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public boolean isDaemon() {
        return daemon;
    }

    @Override
    public String toString() {
        return String.format("GroupConfig(asyncThreads=%d, threadNamePrefix=%s, daemon=%b)",
                asyncThreads, threadNamePrefix, daemon);
    }
}
