package com.example.docextract.service.storage;

import com.example.docextract.config.StorageConfig;
import com.example.docextract.exception.StorageException;
import com.example.docextract.model.StoredObject;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.Map;

/**
 * Хранилище документов в BackBlaze B2 (native API v2).
 */
@Slf4j
@Service
public class B2StorageClient implements StorageClient {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final StorageConfig config;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    private volatile B2Session session;

    public B2StorageClient(StorageConfig config) {
        this.config = config;
        this.objectMapper = new ObjectMapper();
        this.webClient = WebClient.builder()
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(16 * 1024 * 1024))
                .build();
    }

    @Override
    public StoredObject upload(byte[] content, String filename, String contentType) {
        try {
            B2Session current = session();
            String objectName = buildObjectName(content, filename);
            log.info("Uploading file: {}", objectName);

            JsonNode uploadTarget = postJson(
                    current.getApiUrl() + "/b2api/v2/b2_get_upload_url",
                    current.getAuthToken(),
                    Map.of("bucketId", current.getBucketId())
            );

            String response = webClient.post()
                    .uri(uploadTarget.path("uploadUrl").asText())
                    .header(HttpHeaders.AUTHORIZATION, uploadTarget.path("authorizationToken").asText())
                    .header("X-Bz-File-Name", UriUtils.encodePath(objectName, StandardCharsets.UTF_8))
                    .header(HttpHeaders.CONTENT_TYPE, contentType)
                    .header("X-Bz-Content-Sha1", sha1Hex(content))
                    .header("X-Bz-Info-src_filename", UriUtils.encodePath(filename, StandardCharsets.UTF_8))
                    .bodyValue(content)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout())
                    .block();

            JsonNode json = objectMapper.readTree(response);
            String fileId = json.path("fileId").asText(null);
            if (fileId == null) {
                throw new StorageException("B2 upload response does not contain fileId");
            }

            String url = current.getDownloadUrl() + "/file/" + config.getBucketName() + "/"
                    + UriUtils.encodePath(objectName, StandardCharsets.UTF_8);
            log.info("File uploaded successfully: {}", fileId);

            return StoredObject.builder()
                    .objectId(fileId)
                    .objectName(objectName)
                    .url(url)
                    .build();

        } catch (StorageException e) {
            throw e;
        } catch (WebClientResponseException e) {
            throw toStorageException("upload", e);
        } catch (Exception e) {
            throw new StorageException("B2 upload failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(StoredObject storedObject) {
        try {
            B2Session current = session();
            postJson(
                    current.getApiUrl() + "/b2api/v2/b2_delete_file_version",
                    current.getAuthToken(),
                    Map.of("fileId", storedObject.getObjectId(), "fileName", storedObject.getObjectName())
            );
            log.info("File deleted successfully: {}", storedObject.getObjectId());
        } catch (StorageException e) {
            throw e;
        } catch (WebClientResponseException e) {
            throw toStorageException("delete", e);
        } catch (Exception e) {
            throw new StorageException("B2 delete failed: " + e.getMessage(), e);
        }
    }

    private B2Session session() {
        B2Session current = session;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (session == null) {
                session = authorize();
            }
            return session;
        }
    }

    private B2Session authorize() {
        if (!config.isConfigured()) {
            throw new StorageException("BackBlaze B2 credentials not configured");
        }

        String response = webClient.get()
                .uri(config.getAuthUrl())
                .headers(headers -> headers.setBasicAuth(config.getKeyId(), config.getApplicationKey()))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout())
                .block();

        JsonNode auth = readTree(response);
        String authToken = auth.path("authorizationToken").asText();
        String apiUrl = auth.path("apiUrl").asText();
        String downloadUrl = auth.path("downloadUrl").asText();
        String accountId = auth.path("accountId").asText(config.getKeyId());

        JsonNode buckets = postJson(
                apiUrl + "/b2api/v2/b2_list_buckets",
                authToken,
                Map.of("accountId", accountId, "bucketName", config.getBucketName())
        ).path("buckets");

        if (!buckets.isArray() || buckets.isEmpty()) {
            throw new StorageException("Bucket '" + config.getBucketName() + "' not found");
        }

        log.info("Successfully authenticated with BackBlaze B2");
        return new B2Session(authToken, apiUrl, downloadUrl, buckets.get(0).path("bucketId").asText());
    }

    private JsonNode postJson(String url, String authToken, Map<String, Object> body) {
        String response = webClient.post()
                .uri(url)
                .header(HttpHeaders.AUTHORIZATION, authToken)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout())
                .block();
        return readTree(response);
    }

    private JsonNode readTree(String response) {
        try {
            return objectMapper.readTree(response == null ? "{}" : response);
        } catch (Exception e) {
            throw new StorageException("Unreadable B2 response: " + e.getMessage(), e);
        }
    }

    private StorageException toStorageException(String operation, WebClientResponseException e) {
        if (e.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value()) {
            // токен истёк - авторизуемся заново при следующем вызове
            session = null;
        }
        return new StorageException("B2 " + operation + " failed: HTTP " + e.getStatusCode().value()
                + ": " + e.getResponseBodyAsString(), e);
    }

    private Duration timeout() {
        return Duration.ofSeconds(config.getTimeoutSeconds());
    }

    /**
     * Уникальное имя объекта: время загрузки, префикс MD5 содержимого и исходное имя.
     */
    static String buildObjectName(byte[] content, String filename) {
        String timestamp = LocalDateTime.now(ZoneOffset.UTC).format(TIMESTAMP_FORMAT);
        String hash = DigestUtils.md5DigestAsHex(content).substring(0, 8);
        return timestamp + "_" + hash + "_" + filename;
    }

    private static String sha1Hex(byte[] content) throws NoSuchAlgorithmException {
        return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-1").digest(content));
    }

    @Value
    private static class B2Session {
        String authToken;
        String apiUrl;
        String downloadUrl;
        String bucketId;
    }
}
