package com.example.docextract.service.analysis;

import com.example.docextract.config.ContentUnderstandingConfig;
import com.example.docextract.exception.AnalysisException;
import com.example.docextract.exception.SubmissionException;
import com.example.docextract.model.ExtractedField;
import com.example.docextract.model.ExtractionPayload;
import com.example.docextract.service.polling.OperationStatus;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Клиент Azure Content Understanding: постановка анализа и запрос статуса операции.
 */
@Slf4j
@Service
public class ContentUnderstandingClient implements AnalysisClient {

    static final String SUBSCRIPTION_KEY_HEADER = "Ocp-Apim-Subscription-Key";
    static final String OPERATION_LOCATION_HEADER = "Operation-Location";

    private final ContentUnderstandingConfig config;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public ContentUnderstandingClient(ContentUnderstandingConfig config) {
        this.config = config;
        this.objectMapper = new ObjectMapper();
        this.webClient = WebClient.builder()
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(16 * 1024 * 1024))
                .build();
    }

    @Override
    public String submit(String documentUrl) {
        if (!config.isConfigured()) {
            throw new SubmissionException("Azure Content Understanding credentials not fully configured");
        }

        URI analyzeUri = UriComponentsBuilder.fromHttpUrl(config.getEndpoint())
                .path("/" + config.getAnalyzerName() + ":analyze")
                .queryParam("api-version", config.getApiVersion())
                .build()
                .toUri();
        log.info("Submitting document for analysis: {}", analyzeUri);

        try {
            ResponseEntity<Void> response = webClient.post()
                    .uri(analyzeUri)
                    .header(SUBSCRIPTION_KEY_HEADER, config.getKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("inputs", List.of(Map.of("url", documentUrl))))
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(timeout())
                    .block();

            String operationLocation = response != null
                    ? response.getHeaders().getFirst(OPERATION_LOCATION_HEADER)
                    : null;
            if (operationLocation == null || operationLocation.isBlank()) {
                throw new SubmissionException("No Operation-Location header in response");
            }

            log.info("Analysis operation created: {}", operationLocation);
            return operationLocation;

        } catch (SubmissionException e) {
            throw e;
        } catch (WebClientResponseException e) {
            log.error("Error response body: {}", e.getResponseBodyAsString());
            throw new SubmissionException("HTTP " + e.getStatusCode().value() + ": " + e.getResponseBodyAsString(), e);
        } catch (Exception e) {
            throw new SubmissionException("Failed to submit document: " + e.getMessage(), e);
        }
    }

    @Override
    public OperationStatus<ExtractionPayload> fetchStatus(String operationHandle) {
        JsonNode json;
        try {
            String body = webClient.get()
                    .uri(URI.create(operationHandle))
                    .header(SUBSCRIPTION_KEY_HEADER, config.getKey())
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout())
                    .block();
            json = objectMapper.readTree(body == null ? "{}" : body);
        } catch (WebClientResponseException e) {
            throw new AnalysisException("Status request failed: HTTP " + e.getStatusCode().value(), e);
        } catch (Exception e) {
            throw new AnalysisException("Status request failed: " + e.getMessage(), e);
        }

        String status = json.path("status").asText("").toLowerCase(Locale.ROOT);
        return switch (status) {
            case "notstarted", "running" -> OperationStatus.running();
            case "succeeded" -> OperationStatus.succeeded(parsePayload(json));
            case "failed", "cancelled" -> OperationStatus.failed(
                    "Analysis " + status + ": " + json.path("error").path("message").asText("Analysis failed"));
            default -> OperationStatus.failed("Unknown status: " + status);
        };
    }

    /**
     * Извлекает поля из analyzeResult.fields: значение из value, иначе из content.
     */
    ExtractionPayload parsePayload(JsonNode result) {
        ExtractionPayload.ExtractionPayloadBuilder payload = ExtractionPayload.builder();

        JsonNode fields = result.path("analyzeResult").path("fields");
        Iterator<Map.Entry<String, JsonNode>> entries = fields.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            JsonNode field = entry.getValue();
            if (field == null || field.isNull()) {
                continue;
            }

            JsonNode valueNode = field.hasNonNull("value") ? field.get("value") : field.get("content");
            if (valueNode == null || valueNode.isNull()) {
                continue;
            }

            payload.field(ExtractedField.builder()
                    .fieldName(entry.getKey())
                    .value(objectMapper.convertValue(valueNode, Object.class))
                    .confidence(field.hasNonNull("confidence") ? field.get("confidence").asDouble() : null)
                    .build());
        }

        payload.rawResult(objectMapper.convertValue(result, new TypeReference<Map<String, Object>>() {
        }));
        return payload.build();
    }

    private Duration timeout() {
        return Duration.ofSeconds(config.getTimeoutSeconds());
    }
}
