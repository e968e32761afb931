package mediabot.model;

import mediabot.util.MediaFormatting;

/**
 * Метаданные ролика от движка загрузки (probe или строка поиска).
 * Неизменяем, создаётся один раз и передаётся по всему пайплайну.
 */
public record MediaInfo(
        String title,
        String uploader,
        long   durationSeconds,   // -1 если неизвестна
        String webpageUrl         // может быть null для результатов probe
) {
    public static final long UNKNOWN_DURATION = -1;

    public boolean hasDuration() {
        return durationSeconds >= 0;
    }

    /** Имя, безопасное для файловой системы и подписи */
    public String safeTitle() {
        return MediaFormatting.sanitizeTitle(title);
    }

    public String formattedDuration() {
        return hasDuration() ? MediaFormatting.formatDuration(durationSeconds) : "неизвестна";
    }

    public String uploaderOrUnknown() {
        return (uploader == null || uploader.isBlank()) ? "Неизвестен" : uploader;
    }
}
