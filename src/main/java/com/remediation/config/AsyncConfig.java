package com.remediation.config;

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
 * Thread pools of the remediation core.
 *
 * <ul>
 *   <li>{@code alertExecutor}: processes submitted alerts, one task per alert. Also the default
 *       {@code @Async} executor.</li>
 *   <li>{@code actionRunnerExecutor}: runs action runner calls so workers can bound them with a
 *       timeout and interrupt them on cancel.</li>
 * </ul>
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Value("${remediation.async.alert.core-pool-size:4}")
    private int alertCorePoolSize;

    @Value("${remediation.async.alert.max-pool-size:8}")
    private int alertMaxPoolSize;

    @Value("${remediation.async.alert.queue-capacity:500}")
    private int alertQueueCapacity;

    @Value("${remediation.async.action.core-pool-size:4}")
    private int actionCorePoolSize;

    @Value("${remediation.async.action.max-pool-size:16}")
    private int actionMaxPoolSize;

    @Bean("alertExecutor")
    public ThreadPoolTaskExecutor alertExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(alertCorePoolSize);
        executor.setMaxPoolSize(alertMaxPoolSize);
        executor.setQueueCapacity(alertQueueCapacity);
        executor.setThreadNamePrefix("alert-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    /**
     * No queue and the default abort policy: a saturated pool rejects the action instead of running
     * it on the worker thread, where the timeout could not bound it.
     */
    @Bean("actionRunnerExecutor")
    public ThreadPoolTaskExecutor actionRunnerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(actionCorePoolSize);
        executor.setMaxPoolSize(actionMaxPoolSize);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("action-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return alertExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable throwable, Method method, Object... params) -> {
            Logger logger = LoggerFactory.getLogger(method.getDeclaringClass());
            logger.error("Async error in method {}: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }
}
