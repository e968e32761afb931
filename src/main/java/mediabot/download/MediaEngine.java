package mediabot.download;

import mediabot.model.MediaInfo;

import java.util.List;

/**
 * Внешний движок извлечения и загрузки (в проде это yt-dlp).
 *
 * Ошибки приходят уже классифицированными: AccessDeniedException,
 * ForbiddenResponseException или TransientFetchException.
 */
public interface MediaEngine {

    /** Только метаданные, без загрузки */
    MediaInfo probe(String url);

    /**
     * Загружает медиа в файл(ы) по шаблону outputTemplate.
     * Шаблон содержит плейсхолдеры движка (%(title)s, %(ext)s).
     */
    void fetch(String url, FormatDirective directive, String outputTemplate, ProgressListener progress);

    /** Плоский поиск без загрузки, не больше limit результатов */
    List<MediaInfo> search(String query, int limit);

    /** Доступно ли перекодирование (ffmpeg) */
    boolean supportsTranscoding();
}
