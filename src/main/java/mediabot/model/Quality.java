package mediabot.model;

/**
 * Уровень качества. Конкретный селектор формата для yt-dlp
 * выбирает {@link mediabot.download.FormatSelector}.
 */
public enum Quality {
    FAST,   // до 480p, быстро и маленький файл
    BEST,   // до 720p
    HD      // до 1080p
}
