package com.phillippitts.meetingscribe.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>The manager pool is the single "main context" thread that applies worker messages in order;
 * its size is fixed at one and only the name prefix is tunable. The persistence pool runs the
 * fire-and-forget writes to the result store.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private ManagerPoolProperties manager = new ManagerPoolProperties();
    private PersistencePoolProperties persistence = new PersistencePoolProperties();

    public ManagerPoolProperties getManager() {
        return manager;
    }

    public void setManager(ManagerPoolProperties manager) {
        this.manager = manager;
    }

    public PersistencePoolProperties getPersistence() {
        return persistence;
    }

    public void setPersistence(PersistencePoolProperties persistence) {
        this.persistence = persistence;
    }

    /**
     * Queue manager executor configuration.
     */
    public static class ManagerPoolProperties {
        private String threadNamePrefix = "transcription-manager-";

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Persistence executor configuration.
     */
    public static class PersistencePoolProperties {
        private int corePoolSize = 1;
        private int maxPoolSize = 2;
        private int queueCapacity = 200;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "persistence-pool-";

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
}
