package com.example.docextract.service.analysis;

import com.example.docextract.exception.SubmissionException;
import com.example.docextract.model.ExtractionPayload;
import com.example.docextract.service.polling.OperationStatus;

/**
 * Внешний сервис анализа документов с длительными операциями.
 */
public interface AnalysisClient {

    /**
     * Ставит документ на анализ.
     *
     * @param documentUrl URL документа в хранилище
     * @return дескриптор операции для запроса статуса
     * @throws SubmissionException если операция не была создана
     */
    String submit(String documentUrl);

    /**
     * Запрашивает текущую стадию операции. Любое исключение считается временным сбоем.
     */
    OperationStatus<ExtractionPayload> fetchStatus(String operationHandle);
}
