package com.interviewpulse.aggregator.config;

import com.interviewpulse.aggregator.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors hosting the two long-running loops.
 *
 * <p>Each loop runs as a single task that lives until the loop is stopped, so the pools are
 * sized for one thread each. Queue capacity stays at zero; a second submission while the loop
 * still runs is executed by the caller ({@link ThreadPoolExecutor.CallerRunsPolicy}).
 *
 * <p>MDC propagation: copies the Log4j2 ThreadContext from the submitting thread to the
 * worker thread so startup correlation ids survive into loop logs.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    @Bean(name = "ingestExecutor")
    public ThreadPoolTaskExecutor ingestExecutor() {
        return loopExecutor(threadPoolProperties.getIngest());
    }

    @Bean(name = "aggregationExecutor")
    public ThreadPoolTaskExecutor aggregationExecutor() {
        return loopExecutor(threadPoolProperties.getAggregation());
    }

    private static ThreadPoolTaskExecutor loopExecutor(ThreadPoolProperties.LoopPoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(props.getCorePoolSize(), props.getMaxPoolSize()));
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(props.getAwaitTerminationSeconds());
        executor.setTaskDecorator(contextPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    static TaskDecorator contextPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
