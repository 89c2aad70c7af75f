package com.example.docextract.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Конфигурация для Azure Content Understanding.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "content-understanding")
public class ContentUnderstandingConfig {
    /**
     * Базовый URL анализаторов
     */
    private String endpoint;

    /**
     * Ключ подписки
     */
    private String key;

    private String apiVersion;

    /**
     * Имя анализатора, извлекающего поля
     */
    private String analyzerName;

    /**
     * Таймаут одного запроса в секундах
     */
    private int timeoutSeconds = 300;

    public boolean isConfigured() {
        return hasText(endpoint) && hasText(key) && hasText(apiVersion) && hasText(analyzerName);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
