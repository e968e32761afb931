package mediabot.model;

import java.nio.file.Path;

/**
 * Проверенный файл в общей временной директории.
 * token: уникальный префикс, по которому файл был найден.
 */
public record StoredPayload(Path path, long sizeBytes, String token) {
}
