package com.example.resq_ai.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;

/**
 * Thread pool the orchestrator runs requests on. The MDC of the submitting thread travels along,
 * so worker logs keep the correlation id.
 */
@Configuration
public class PipelineExecutorConfig {

    @Bean(name = "pipelineTaskExecutor")
    public ThreadPoolTaskExecutor pipelineTaskExecutor(PipelineProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(properties.getExecutor().getThreads(), properties.getInference().getMaxConcurrent());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.getExecutor().getQueueCapacity());
        executor.setThreadNamePrefix("pipeline-");
        executor.setTaskDecorator(mdcPropagating());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagating() {
        return task -> {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (context != null) MDC.setContextMap(context); else MDC.clear();
                try {
                    task.run();
                } finally {
                    if (previous != null) MDC.setContextMap(previous); else MDC.clear();
                }
            };
        };
    }
}
