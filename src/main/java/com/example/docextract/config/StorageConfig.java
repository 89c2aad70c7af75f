package com.example.docextract.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Конфигурация для BackBlaze B2.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "b2")
public class StorageConfig {
    /**
     * ID ключа приложения
     */
    private String keyId;

    /**
     * Ключ приложения
     */
    private String applicationKey;

    /**
     * Имя бакета для загружаемых документов
     */
    private String bucketName;

    /**
     * URL авторизации аккаунта
     */
    private String authUrl = "https://api.backblazeb2.com/b2api/v2/b2_authorize_account";

    /**
     * Таймаут запросов в секундах
     */
    private int timeoutSeconds = 300;

    public boolean isConfigured() {
        return keyId != null && !keyId.isBlank()
                && applicationKey != null && !applicationKey.isBlank();
    }
}
