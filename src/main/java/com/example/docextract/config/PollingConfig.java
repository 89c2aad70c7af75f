package com.example.docextract.config;

import com.example.docextract.service.polling.PollPolicy;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Параметры опроса операций анализа.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "polling")
public class PollingConfig {
    /**
     * Задержка перед вторым запросом статуса
     */
    @NotNull
    private Duration initialDelay = Duration.ofSeconds(2);

    /**
     * Максимальная задержка между запросами
     */
    @NotNull
    private Duration maxDelay = Duration.ofSeconds(10);

    /**
     * Множитель роста задержки
     */
    @DecimalMin("1.0")
    private double backoffMultiplier = 1.5;

    /**
     * Общий бюджет времени на опрос одной операции
     */
    @NotNull
    private Duration maxTotalWait = Duration.ofMinutes(5);

    /**
     * Максимальное число запросов статуса
     */
    @Min(1)
    private int maxAttempts = 60;

    /**
     * Сколько подряд неудачных запросов статуса допускается
     */
    @Min(1)
    private int maxConsecutiveFetchFailures = 3;

    /**
     * Доля случайного разброса задержки
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double jitter = 0.1;

    public PollPolicy toPolicy() {
        return PollPolicy.builder()
                .initialDelay(initialDelay)
                .maxDelay(maxDelay)
                .backoffMultiplier(backoffMultiplier)
                .maxTotalWait(maxTotalWait)
                .maxAttempts(maxAttempts)
                .maxConsecutiveFetchFailures(maxConsecutiveFetchFailures)
                .jitter(jitter)
                .build();
    }
}
