package com.example.docextract.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Основная конфигурация приложения.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppConfig {
    /**
     * Имя файла, если клиент его не передал
     */
    @NotBlank
    private String defaultFilename = "unknown.pdf";

    /**
     * MIME тип, если клиент его не передал
     */
    @NotBlank
    private String defaultContentType = "application/octet-stream";

    @Valid
    private RegistryConfig registry = new RegistryConfig();

    @Valid
    private ExecutorConfig executor = new ExecutorConfig();

    @Data
    public static class RegistryConfig {
        /**
         * Сколько хранить завершённые задачи. Не задано - хранить до явного удаления
         */
        private Duration retention;

        /**
         * Период проверки устаревших задач (мс)
         */
        @Min(1)
        private long evictionIntervalMs = 60_000;
    }

    @Data
    public static class ExecutorConfig {
        @Min(1)
        private int corePoolSize = 8;
        @Min(1)
        private int maxPoolSize = 32;
        @Min(0)
        private int queueCapacity = 500;
    }
}
