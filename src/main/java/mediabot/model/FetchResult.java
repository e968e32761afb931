package mediabot.model;

/** Результат успешной загрузки: метаданные + проверенный файл. */
public record FetchResult(MediaInfo info, StoredPayload payload) {
}
