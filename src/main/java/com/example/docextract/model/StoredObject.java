package com.example.docextract.model;

import lombok.Builder;
import lombok.Value;

/**
 * Объект, сохранённый во внешнем хранилище.
 */
@Value
@Builder
public class StoredObject {
    /**
     * Идентификатор объекта в хранилище
     */
    String objectId;

    /**
     * Имя объекта в бакете
     */
    String objectName;

    /**
     * URL, по которому объект доступен сервису анализа
     */
    String url;
}
