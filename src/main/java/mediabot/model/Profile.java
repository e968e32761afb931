package mediabot.model;

/**
 * Профиль загрузки: тип медиа + качество.
 * Для аудио качество всегда BEST, других вариантов у нас нет.
 */
public record Profile(MediaType mediaType, Quality quality) {

    public static final Profile VIDEO_BEST = new Profile(MediaType.VIDEO, Quality.BEST);
    public static final Profile VIDEO_FAST = new Profile(MediaType.VIDEO, Quality.FAST);
    public static final Profile VIDEO_HD   = new Profile(MediaType.VIDEO, Quality.HD);
    public static final Profile AUDIO      = new Profile(MediaType.AUDIO, Quality.BEST);

    public Profile {
        if (mediaType == null || quality == null) {
            throw new IllegalArgumentException("mediaType and quality are required");
        }
    }

    public boolean isAudio() {
        return mediaType == MediaType.AUDIO;
    }

    /** Подпись для инструкции пользователю */
    public String description() {
        if (isAudio()) return "Извлечение аудио из видео";
        return switch (quality) {
            case FAST -> "Быстрая загрузка (низкое качество)";
            case BEST -> "Видео в хорошем качестве (720p)";
            case HD   -> "Видео в HD (1080p)";
        };
    }
}
