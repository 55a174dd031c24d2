package com.interviewpulse.aggregator.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the executors that host the long-running loops.
 *
 * <p>Each loop occupies one thread for its whole lifetime; the pools exist to give the threads
 * stable names and a bounded shutdown wait.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private LoopPoolProperties ingest = new LoopPoolProperties("ingest-loop-");
    private LoopPoolProperties aggregation = new LoopPoolProperties("aggregation-loop-");

    public LoopPoolProperties getIngest() {
        return ingest;
    }

    public void setIngest(LoopPoolProperties ingest) {
        this.ingest = ingest;
    }

    public LoopPoolProperties getAggregation() {
        return aggregation;
    }

    public void setAggregation(LoopPoolProperties aggregation) {
        this.aggregation = aggregation;
    }

    /**
     * Loop executor configuration.
     */
    public static class LoopPoolProperties {
        private int corePoolSize = 1;
        private int maxPoolSize = 1;
        private int awaitTerminationSeconds = 30;
        private String threadNamePrefix;

        public LoopPoolProperties() {
            this("loop-");
        }

        LoopPoolProperties(String threadNamePrefix) {
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

        public int getAwaitTerminationSeconds() {
            return awaitTerminationSeconds;
        }

        public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
            this.awaitTerminationSeconds = awaitTerminationSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
