package com.tidewaysystems.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for the executors used by the concurrent message bus.
 * Keeps the thread pool tuning for event fan-out in one place.
 *
 * <p>The default is a {@link ThreadPoolType#CACHED} pool. A handler that publishes
 * further events waits for their handlers on a pool thread, so bounded pools can
 * starve under deep cascades; pick {@link ThreadPoolType#FIXED} only when handlers
 * do not publish.
 */
public class ThreadPoolFactory {
    // Default values
    private static final int DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 10;
    private static final String DEFAULT_POOL_NAME = "tideway-bus";

    private ThreadPoolType executorType = ThreadPoolType.CACHED;
    private int fixedPoolSize = Runtime.getRuntime().availableProcessors();
    private int workStealingParallelism = Runtime.getRuntime().availableProcessors();
    private int shutdownTimeoutSeconds = DEFAULT_SHUTDOWN_TIMEOUT_SECONDS;
    private String poolName = DEFAULT_POOL_NAME;
    private boolean useNamedThreads = true;
    private boolean daemonThreads = true;

    /**
     * Enum defining the types of thread pools that can be used.
     */
    public enum ThreadPoolType {
        /**
         * Grows on demand and reuses idle threads.
         * Safe for handlers that publish further messages.
         */
        CACHED,

        /**
         * Uses a fixed thread pool with a specified number of threads.
         * Good for CPU-bound handlers that do not cascade.
         */
        FIXED,

        /**
         * Uses a work-stealing pool sized to the configured parallelism.
         */
        WORK_STEALING
    }

    /**
     * Creates a new ThreadPoolFactory with default settings.
     */
    public ThreadPoolFactory() {
        // Use defaults
    }

    /**
     * Creates an executor service based on the current configuration,
     * using the configured pool name.
     *
     * @return A new executor service
     */
    public ExecutorService createExecutorService() {
        return createExecutorService(poolName);
    }

    /**
     * Creates an executor service based on the current configuration.
     *
     * @param poolName Name prefix for the threads in this pool
     * @return A new executor service
     */
    public ExecutorService createExecutorService(String poolName) {
        switch (executorType) {
            case CACHED:
                return useNamedThreads
                        ? Executors.newCachedThreadPool(createNamedThreadFactory(poolName + "-worker"))
                        : Executors.newCachedThreadPool();
            case FIXED:
                return useNamedThreads
                        ? Executors.newFixedThreadPool(fixedPoolSize, createNamedThreadFactory(poolName + "-worker"))
                        : Executors.newFixedThreadPool(fixedPoolSize);
            case WORK_STEALING:
                return Executors.newWorkStealingPool(workStealingParallelism);
            default:
                throw new IllegalStateException("Unknown executor type: " + executorType);
        }
    }

    /**
     * Creates a named thread factory for better thread identification in logs and profilers.
     *
     * @param prefix The prefix for thread names
     * @return A thread factory that creates named threads
     */
    private ThreadFactory createNamedThreadFactory(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r, prefix + "-" + threadNumber.getAndIncrement());
                thread.setDaemon(daemonThreads);
                return thread;
            }
        };
    }

    // Getters and setters

    public ThreadPoolType getExecutorType() {
        return executorType;
    }

    public ThreadPoolFactory setExecutorType(ThreadPoolType executorType) {
        if (executorType == null) {
            throw new IllegalArgumentException("executorType cannot be null");
        }
        this.executorType = executorType;
        return this;
    }

    public int getFixedPoolSize() {
        return fixedPoolSize;
    }

    public ThreadPoolFactory setFixedPoolSize(int fixedPoolSize) {
        if (fixedPoolSize < 1) {
            throw new IllegalArgumentException("fixedPoolSize must be >= 1");
        }
        this.fixedPoolSize = fixedPoolSize;
        return this;
    }

    public int getWorkStealingParallelism() {
        return workStealingParallelism;
    }

    public ThreadPoolFactory setWorkStealingParallelism(int workStealingParallelism) {
        if (workStealingParallelism < 1) {
            throw new IllegalArgumentException("workStealingParallelism must be >= 1");
        }
        this.workStealingParallelism = workStealingParallelism;
        return this;
    }

    public int getShutdownTimeoutSeconds() {
        return shutdownTimeoutSeconds;
    }

    public ThreadPoolFactory setShutdownTimeoutSeconds(int shutdownTimeoutSeconds) {
        if (shutdownTimeoutSeconds < 0) {
            throw new IllegalArgumentException("shutdownTimeoutSeconds must be >= 0");
        }
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
        return this;
    }

    public String getPoolName() {
        return poolName;
    }

    public ThreadPoolFactory setPoolName(String poolName) {
        if (poolName == null || poolName.isBlank()) {
            throw new IllegalArgumentException("poolName cannot be null or blank");
        }
        this.poolName = poolName;
        return this;
    }

    public boolean isUseNamedThreads() {
        return useNamedThreads;
    }

    public ThreadPoolFactory setUseNamedThreads(boolean useNamedThreads) {
        this.useNamedThreads = useNamedThreads;
        return this;
    }

    public boolean isDaemonThreads() {
        return daemonThreads;
    }

    public ThreadPoolFactory setDaemonThreads(boolean daemonThreads) {
        this.daemonThreads = daemonThreads;
        return this;
    }
}
