package com.repledger.config;

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
 * Pool that writes loan_events and parameter_changes rows. LoanLedger publishes only after an
 * operation commits, and the listeners run here, so the H2 write happens outside the ledger's
 * monitor.
 *
 * <p>Sizing: {@code repledger.async.core-pool-size}, {@code max-pool-size}, {@code queue-capacity}.
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Value("${repledger.async.core-pool-size:2}")
    private int corePoolSize;

    @Value("${repledger.async.max-pool-size:4}")
    private int maxPoolSize;

    @Value("${repledger.async.queue-capacity:500}")
    private int queueCapacity;

    @Bean("eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("loan-event-");
        // A full queue makes the publishing thread write the audit row itself
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
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
            logger.error("Audit writer {} failed: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }
}
