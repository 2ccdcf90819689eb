package com.phillippitts.ambient.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>Provides tuneable sizing for the command, clarifier and event executors and the
 * sentinel scheduler. Defaults suit a single desktop user.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private PoolProperties command = new PoolProperties(2, 4, 50, "command-pool-");
    private PoolProperties clarifier = new PoolProperties(1, 2, 10, "clarifier-pool-");
    private PoolProperties event = new PoolProperties(2, 4, 10, "event-pool-");
    private SchedulerProperties scheduler = new SchedulerProperties();

    public PoolProperties getCommand() {
        return command;
    }

    public void setCommand(PoolProperties command) {
        this.command = command;
    }

    public PoolProperties getClarifier() {
        return clarifier;
    }

    public void setClarifier(PoolProperties clarifier) {
        this.clarifier = clarifier;
    }

    public PoolProperties getEvent() {
        return event;
    }

    public void setEvent(PoolProperties event) {
        this.event = event;
    }

    public SchedulerProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerProperties scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Bounded executor pool configuration.
     */
    public static class PoolProperties {
        private int corePoolSize;
        private int maxPoolSize;
        private int queueCapacity;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;

        public PoolProperties() {
            this(2, 4, 10, "pool-");
        }

        PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Scheduler used for periodic screen sampling.
     */
    public static class SchedulerProperties {
        private int poolSize = 1;
        private String threadNamePrefix = "sentinel-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
