package com.example.docextract.cli;

import com.example.docextract.model.DocumentTask;
import com.example.docextract.model.ExtractedField;
import com.example.docextract.model.TaskError;
import com.example.docextract.service.DocumentProcessingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * CLI интерфейс для обработки локального файла.
 *
 * Примеры использования:
 *
 * java -jar doc-extract-service.jar --file=./protocol.pdf
 *
 * java -jar doc-extract-service.jar --file=./protocol.docx \
 *   --content-type=application/vnd.openxmlformats-officedocument.wordprocessingml.document
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandLineRunner implements ApplicationRunner {

    private final DocumentProcessingService processingService;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        // Без --file приложение работает как REST API
        if (!args.containsOption("file")) {
            log.info("Starting in REST API mode. Use --file=<path> for CLI mode.");
            return;
        }

        log.info("Starting in CLI mode");

        int exitCode;
        try {
            exitCode = runCli(args, System.out);
        } catch (Exception e) {
            log.error("CLI execution failed: {}", e.getMessage(), e);
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    /**
     * Обрабатывает файл и печатает сводку.
     *
     * @return код завершения: 0 - COMPLETED, 2 - FAILED
     */
    int runCli(ApplicationArguments args, PrintStream out) {
        Path file = Path.of(getRequiredOption(args, "file"));
        String contentType = getOption(args, "content-type", detectContentType(file));

        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }

        out.println("File: " + file.toAbsolutePath());
        out.println("Content type: " + (contentType != null ? contentType : "default"));
        out.println("Size: " + content.length + " bytes");
        out.println();

        DocumentTask task = processingService.submitBlocking(content, file.getFileName().toString(), contentType);
        printSummary(task, out);
        return task.getResult() != null && task.getResult().isSuccess() ? 0 : 2;
    }

    private void printSummary(DocumentTask task, PrintStream out) {
        out.println("Document:     " + task.getId());
        out.println("Status:       " + task.getState());
        if (task.getStorageLocation() != null) {
            out.println("Stored at:    " + task.getStorageLocation());
        }

        if (task.getResult() == null) {
            return;
        }
        if (task.getResult().isSuccess()) {
            out.println("Fields:       " + task.getResult().getPayload().getFieldCount());
            for (ExtractedField field : task.getResult().getPayload().getFields()) {
                String confidence = field.getConfidence() != null
                        ? String.format(" (%.2f)", field.getConfidence())
                        : "";
                out.println("  - " + field.getFieldName() + ": " + field.getValue() + confidence);
            }
        } else {
            TaskError error = task.getResult().getError();
            out.println("Error:        " + error.getKind() + " - " + error.getMessage());
        }
    }

    private String detectContentType(Path file) {
        try {
            return Files.probeContentType(file);
        } catch (IOException e) {
            log.debug("Could not detect content type of {}: {}", file, e.getMessage());
            return null;
        }
    }

    private String getRequiredOption(ApplicationArguments args, String name) {
        if (!args.containsOption(name) || args.getOptionValues(name).isEmpty()) {
            throw new IllegalArgumentException("Required option --" + name + " is missing");
        }
        return args.getOptionValues(name).get(0);
    }

    private String getOption(ApplicationArguments args, String name, String defaultValue) {
        if (args.containsOption(name) && !args.getOptionValues(name).isEmpty()) {
            return args.getOptionValues(name).get(0);
        }
        return defaultValue;
    }
}
