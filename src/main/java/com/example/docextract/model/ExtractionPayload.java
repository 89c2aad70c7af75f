package com.example.docextract.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Результат успешного анализа документа. Неизменяем вместе с вложенными структурами.
 */
@Value
public class ExtractionPayload {
    List<ExtractedField> fields;

    /**
     * Исходный ответ сервиса анализа
     */
    Map<String, Object> rawResult;

    @Builder
    public ExtractionPayload(@Singular List<ExtractedField> fields, Map<String, Object> rawResult) {
        this.fields = List.copyOf(fields);
        this.rawResult = FrozenValues.freezeMap(rawResult);
    }

    public int getFieldCount() {
        return fields.size();
    }
}
