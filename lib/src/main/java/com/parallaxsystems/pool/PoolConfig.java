package com.parallaxsystems.pool;

import com.google.common.base.Preconditions;
import com.parallaxsystems.mailbox.MailboxType;

/**
 * Configuration for a {@link TaskPool} and for the actors scheduled on it.
 * This class centralizes the tuning knobs of the runtime, making it easier to
 * trade throughput against responsiveness.
 */
public class PoolConfig {
    // Default values
    private static final int DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 10;
    private static final int DEFAULT_FAIR_BATCH_SIZE = 1;
    private static final String DEFAULT_NAME = "parallax";

    private int parallelism = Runtime.getRuntime().availableProcessors();
    private String name = DEFAULT_NAME;
    private boolean daemon = true;
    private boolean asyncMode = true;
    private int shutdownTimeoutSeconds = DEFAULT_SHUTDOWN_TIMEOUT_SECONDS;

    // Actor execution configuration
    private int fairBatchSize = DEFAULT_FAIR_BATCH_SIZE;
    private boolean fairByDefault = false;
    private MailboxType mailboxType = MailboxType.LINKED;

    /**
     * Enum defining the types of workloads a pool can be tuned for.
     */
    public enum WorkloadType {
        /**
         * Many actors exchanging small messages.
         * Uses FIFO local queues and fair actors so no actor monopolizes a worker.
         */
        MESSAGING,

        /**
         * Recursive fork/join and pipeline computations.
         * Uses LIFO local queues, which keep freshly forked subtasks hot in cache.
         */
        COMPUTE
    }

    /**
     * Creates a new PoolConfig with default settings.
     */
    public PoolConfig() {
        // Use defaults
    }

    /**
     * Creates a config with the given parallelism and defaults for everything else.
     *
     * @param parallelism The number of worker threads
     * @return A new PoolConfig
     */
    public static PoolConfig withParallelism(int parallelism) {
        return new PoolConfig().setParallelism(parallelism);
    }

    /**
     * Optimizes the configuration for a specific workload type.
     *
     * @param workloadType The type of workload to optimize for
     * @return This PoolConfig instance for method chaining
     */
    public PoolConfig optimizeFor(WorkloadType workloadType) {
        switch (workloadType) {
            case MESSAGING:
                return setAsyncMode(true).setFairByDefault(true);
            case COMPUTE:
                return setAsyncMode(false).setFairByDefault(false);
            default:
                throw new IllegalArgumentException("Unknown workload type: " + workloadType);
        }
    }

    // Getters and setters

    public int getParallelism() {
        return parallelism;
    }

    public PoolConfig setParallelism(int parallelism) {
        Preconditions.checkArgument(parallelism > 0, "parallelism must be positive, got %s", parallelism);
        this.parallelism = parallelism;
        return this;
    }

    public String getName() {
        return name;
    }

    public PoolConfig setName(String name) {
        Preconditions.checkArgument(name != null && !name.isBlank(), "name must not be blank");
        this.name = name;
        return this;
    }

    public boolean isDaemon() {
        return daemon;
    }

    public PoolConfig setDaemon(boolean daemon) {
        this.daemon = daemon;
        return this;
    }

    /**
     * Whether worker-local queues are processed FIFO (true) or LIFO (false).
     */
    public boolean isAsyncMode() {
        return asyncMode;
    }

    public PoolConfig setAsyncMode(boolean asyncMode) {
        this.asyncMode = asyncMode;
        return this;
    }

    public int getShutdownTimeoutSeconds() {
        return shutdownTimeoutSeconds;
    }

    public PoolConfig setShutdownTimeoutSeconds(int shutdownTimeoutSeconds) {
        Preconditions.checkArgument(shutdownTimeoutSeconds >= 0, "shutdownTimeoutSeconds must not be negative");
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
        return this;
    }

    /**
     * Number of messages a fair actor processes before yielding its worker.
     */
    public int getFairBatchSize() {
        return fairBatchSize;
    }

    public PoolConfig setFairBatchSize(int fairBatchSize) {
        Preconditions.checkArgument(fairBatchSize > 0, "fairBatchSize must be positive, got %s", fairBatchSize);
        this.fairBatchSize = fairBatchSize;
        return this;
    }

    public boolean isFairByDefault() {
        return fairByDefault;
    }

    public PoolConfig setFairByDefault(boolean fairByDefault) {
        this.fairByDefault = fairByDefault;
        return this;
    }

    public MailboxType getMailboxType() {
        return mailboxType;
    }

    public PoolConfig setMailboxType(MailboxType mailboxType) {
        this.mailboxType = Preconditions.checkNotNull(mailboxType, "mailboxType");
        return this;
    }

    @Override
    public String toString() {
        return "PoolConfig[name=" + name + ", parallelism=" + parallelism + ", asyncMode=" + asyncMode
                + ", fairByDefault=" + fairByDefault + ", mailboxType=" + mailboxType + "]";
    }
}
