package com.riskledger.config;

import java.lang.reflect.Method;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors used off the admission path.
 *
 * <ul>
 *   <li>{@code eventExecutor}: {@code @Async} listeners (audit flushes, metrics)</li>
 *   <li>{@code fillExecutor}: runs fills and price updates, chained per session by
 *       {@link com.riskledger.pipeline.FillSequencer}</li>
 *   <li>{@code busDispatchExecutor}: a single thread delivering bus messages in arrival order</li>
 * </ul>
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Value("${risk-ledger.async.core-pool-size:2}")
    private int corePoolSize;

    @Value("${risk-ledger.async.max-pool-size:4}")
    private int maxPoolSize;

    @Value("${risk-ledger.async.queue-capacity:500}")
    private int queueCapacity;

    @Value("${risk-ledger.async.fill-pool-size:4}")
    private int fillPoolSize;

    @Bean("eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("event-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean("fillExecutor")
    public ThreadPoolTaskExecutor fillExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(fillPoolSize);
        executor.setMaxPoolSize(fillPoolSize);
        // unbounded: dropping a fill would desynchronise the ledger
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("fill-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean("busDispatchExecutor")
    public ThreadPoolTaskExecutor busDispatchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("bus-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return eventExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable throwable, Method method, Object... params) -> {
            Logger logger = LoggerFactory.getLogger(method.getDeclaringClass());
            logger.error("Async error in method {}: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }
}
