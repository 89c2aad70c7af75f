package com.example.docextract.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Пул потоков для фоновой обработки документов.
 */
@Configuration
public class TaskExecutorConfig {

    @Bean("documentTaskExecutor")
    public TaskExecutor documentTaskExecutor(AppConfig appConfig) {
        AppConfig.ExecutorConfig settings = appConfig.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(settings.getMaxPoolSize());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("document-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
