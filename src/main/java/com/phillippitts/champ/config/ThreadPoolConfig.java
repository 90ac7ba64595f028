package com.phillippitts.champ.config;

import com.phillippitts.champ.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for endpoint dispatch and the stream read loop.
 *
 * <p>Both copy the Log4j2 ThreadContext of the submitting thread into the worker so
 * {@code roundId} stays on every log line of a round.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Pool for concurrent model endpoint calls (one task per endpoint per round).
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. Keep
     * {@code threadpool.dispatch.queue-capacity} above the endpoint count: a call run on the
     * round thread is not bounded by the round timeout.
     */
    @Bean(name = "dispatchExecutor")
    public Executor dispatchExecutor() {
        return build(threadPoolProperties.getDispatch(), true);
    }

    /**
     * Pool hosting the long-lived stream read loop. The loop only returns when stopped, so
     * shutdown does not wait for it.
     */
    @Bean(name = "streamExecutor")
    public Executor streamExecutor() {
        return build(threadPoolProperties.getStream(), false);
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props, boolean awaitOnShutdown) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(awaitOnShutdown);
        executor.setAwaitTerminationSeconds(awaitOnShutdown ? 30 : 5);
        executor.setTaskDecorator(threadContextPropagation());
        executor.initialize();
        return executor;
    }

    static TaskDecorator threadContextPropagation() {
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
