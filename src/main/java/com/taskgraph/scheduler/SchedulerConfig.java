package com.taskgraph.scheduler;

import com.taskgraph.profiling.TimeIntervalCollector;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of a {@link TaskScheduler}.
 *
 * Uses Builder pattern for clean, validated construction.
 * Immutable after creation.
 *
 * Example usage:
 * SchedulerConfig config = new SchedulerConfig.Builder()
 *     .threadCount(4)
 *     .profilingCollector(new RecordingTimeIntervalCollector())
 *     .build();
 *
 * TaskScheduler scheduler = new TaskScheduler(config);
 */
public class SchedulerConfig {

    /**
     * Thread pool sizing multiplier.
     * Default thread count = CPU cores × CORE_MULTIPLIER
     */
    public static final int CORE_MULTIPLIER = 1;

    /**
     * Default maximum time to wait for the thread pool on shutdown.
     */
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final int threadCount;
    private final Duration shutdownTimeout;
    private final TimeIntervalCollector profilingCollector;

    /**
     * Private constructor - use Builder to create instances.
     */
    private SchedulerConfig(Builder builder) {
        this.threadCount = builder.threadCount;
        this.shutdownTimeout = builder.shutdownTimeout;
        this.profilingCollector = builder.profilingCollector;
    }

    /**
     * @return configuration with every default
     */
    public static SchedulerConfig defaults() {
        return new Builder().build();
    }

    /**
     * Returns the number of worker threads.
     */
    public int getThreadCount() {
        return threadCount;
    }

    /**
     * Returns the maximum time {@link TaskScheduler#shutdown()} waits for running tasks.
     */
    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    /**
     * Returns the collector given to submitted tasks that have none, or null.
     */
    public TimeIntervalCollector getProfilingCollector() {
        return profilingCollector;
    }

    @Override
    public String toString() {
        return "SchedulerConfig{" +
                "threadCount=" + threadCount +
                ", shutdownTimeout=" + shutdownTimeout +
                ", profiling=" + (profilingCollector != null) +
                '}';
    }

    /**
     * Builder for creating SchedulerConfig instances.
     * Provides fluent API with validation and sensible defaults.
     */
    public static class Builder {
        private int threadCount = Runtime.getRuntime().availableProcessors() * CORE_MULTIPLIER;  // Default
        private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;  // Default
        private TimeIntervalCollector profilingCollector;  // Default: no profiling

        /**
         * Sets the number of worker threads.
         * Default: CPU cores × CORE_MULTIPLIER
         */
        public Builder threadCount(int threadCount) {
            if (threadCount <= 0) {
                throw new IllegalArgumentException("threadCount must be positive, got " + threadCount);
            }
            this.threadCount = threadCount;
            return this;
        }

        /**
         * Sets how long shutdown waits for running tasks before forcing termination.
         * Default: 10 seconds
         */
        public Builder shutdownTimeout(Duration timeout) {
            Objects.requireNonNull(timeout, "shutdownTimeout cannot be null");
            if (timeout.isNegative()) {
                throw new IllegalArgumentException("shutdownTimeout cannot be negative");
            }
            this.shutdownTimeout = timeout;
            return this;
        }

        /**
         * Sets the collector injected into submitted tasks without one.
         * Default: null (no profiling)
         */
        public Builder profilingCollector(TimeIntervalCollector collector) {
            this.profilingCollector = collector;
            return this;
        }

        /**
         * Builds the SchedulerConfig instance.
         *
         * @return Immutable SchedulerConfig instance
         */
        public SchedulerConfig build() {
            // Validation already done in setters
            return new SchedulerConfig(this);
        }
    }
}
