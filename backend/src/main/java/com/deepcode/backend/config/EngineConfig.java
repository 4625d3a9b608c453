package com.deepcode.backend.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;

@Configuration
public class EngineConfig {

    /**
     * Runs engine calls. Tasks inherit the submitting request's MDC so engine logs carry its requestId.
     */
    @Bean(name = "engineExecutor")
    public ThreadPoolTaskExecutor engineExecutor(DeepCodeProperties props) {
        int threads = Math.max(1, props.engine().workerThreads());
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setThreadNamePrefix("engine-");
        ex.setCorePoolSize(threads);
        ex.setMaxPoolSize(threads);
        ex.setQueueCapacity(100);
        ex.setTaskDecorator(mdcPropagating());
        ex.setWaitForTasksToCompleteOnShutdown(true);
        ex.initialize();
        return ex;
    }

    /**
     * Delivers progress frames. A stalled observer holds one of these threads, never the request thread.
     */
    @Bean(name = "progressExecutor")
    public ThreadPoolTaskExecutor progressExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setThreadNamePrefix("progress-");
        ex.setCorePoolSize(4);
        ex.setMaxPoolSize(16);
        ex.setQueueCapacity(256);
        ex.setTaskDecorator(mdcPropagating());
        ex.initialize();
        return ex;
    }

    static TaskDecorator mdcPropagating() {
        return task -> {
            Map<String, String> ctx = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (ctx == null) MDC.clear(); else MDC.setContextMap(ctx);
                try {
                    task.run();
                } finally {
                    if (previous == null) MDC.clear(); else MDC.setContextMap(previous);
                }
            };
        };
    }
}
