package mediabot.model;

import java.nio.file.Path;

/**
 * Запись об одной попытке загрузки. Живёт только внутри одной итерации
 * цикла повторов и нужна для логов.
 */
public record DownloadAttempt(
        int     index,
        String  formatDirective,
        Path    discoveredFile,   // null если файл не найден
        long    sizeBytes,
        Outcome outcome
) {
    public enum Outcome {
        SUCCESS,
        EMPTY_PAYLOAD,
        FORBIDDEN,
        UNAVAILABLE,
        TRANSIENT
    }
}
