package com.example.docextract.model;

import lombok.Builder;
import lombok.Value;

/**
 * Поле, извлечённое сервисом анализа из документа.
 */
@Value
public class ExtractedField {
    String fieldName;

    /**
     * Значение поля; вложенные объекты и списки неизменяемы
     */
    Object value;

    /**
     * Уверенность распознавания (0-1), может отсутствовать
     */
    Double confidence;

    @Builder
    public ExtractedField(String fieldName, Object value, Double confidence) {
        this.fieldName = fieldName;
        this.value = FrozenValues.freeze(value);
        this.confidence = confidence;
    }
}
