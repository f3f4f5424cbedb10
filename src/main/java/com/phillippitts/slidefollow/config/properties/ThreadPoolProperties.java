package com.phillippitts.slidefollow.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>The follow loop is a single thread by contract (one writer of follow state); only its queue
 * and naming are tunable. Reconnect scheduling gets its own small scheduler.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private FollowPoolProperties follow = new FollowPoolProperties();
    private ReconnectPoolProperties reconnect = new ReconnectPoolProperties();

    public FollowPoolProperties getFollow() {
        return follow;
    }

    public void setFollow(FollowPoolProperties follow) {
        this.follow = follow;
    }

    public ReconnectPoolProperties getReconnect() {
        return reconnect;
    }

    public void setReconnect(ReconnectPoolProperties reconnect) {
        this.reconnect = reconnect;
    }

    /**
     * Follow loop executor configuration.
     */
    public static class FollowPoolProperties {
        private int queueCapacity = 256;
        private String threadNamePrefix = "follow-loop-";

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Reconnect scheduler configuration.
     */
    public static class ReconnectPoolProperties {
        private int poolSize = 1;
        private String threadNamePrefix = "reconnect-";

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
