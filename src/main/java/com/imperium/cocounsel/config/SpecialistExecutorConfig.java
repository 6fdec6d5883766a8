package com.imperium.cocounsel.config;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.Map;

/**
 * 专家调用线程池与时钟。
 * <p>
 * 主专家与协同专家并发提交到同一个有界线程池；任务装饰器把调用线程的 MDC（requestId）带到工作线程。
 */
@Configuration
public class SpecialistExecutorConfig {

    @Bean(name = "specialistExecutor")
    public ThreadPoolTaskExecutor specialistExecutor(
            @Value("${app.orchestrator.executor.core-size:4}") int coreSize,
            @Value("${app.orchestrator.executor.max-size:16}") int maxSize,
            @Value("${app.orchestrator.executor.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("specialist-");
        executor.setTaskDecorator(mdcTaskDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    static TaskDecorator mdcTaskDecorator() {
        return task -> {
            Map<String, String> parentMdc = MDC.getCopyOfContextMap();
            return () -> {
                if (parentMdc != null) {
                    MDC.setContextMap(parentMdc);
                }
                try {
                    task.run();
                } finally {
                    MDC.clear();
                }
            };
        };
    }
}
