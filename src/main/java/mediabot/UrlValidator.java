package mediabot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;
import java.util.Locale;

/**
 * Проверяет, что ссылка ведёт на одну из поддерживаемых платформ.
 * Никаких сетевых запросов, только разбор строки.
 *
 * Хост должен совпадать с поддерживаемым доменом или быть его поддоменом.
 * Простого вхождения подстроки недостаточно: dropbox.com содержит "x.com",
 * а notyoutube.com содержит "youtube.com", но обе ссылки отклоняются.
 */
public class UrlValidator {

    private static final Logger log = LoggerFactory.getLogger(UrlValidator.class);

    // Поддомены (www., m., music., vm.) принимаются автоматически
    private static final List<String> SUPPORTED_DOMAINS = List.of(
            "youtube.com", "youtu.be",
            "instagram.com",
            "facebook.com", "fb.watch",
            "tiktok.com",
            "twitter.com", "x.com",
            "soundcloud.com",
            "vimeo.com",
            "dailymotion.com", "dai.ly"
    );

    public static final String SUPPORTED_PLATFORMS =
            "YouTube, Instagram, TikTok, Facebook, Twitter/X, SoundCloud, Vimeo, DailyMotion";

    /**
     * Добавляет https:// если схема не указана.
     * Возвращает null для пустой строки.
     */
    public static String normalize(String raw) {
        if (raw == null) return null;
        String url = raw.strip();
        if (url.isEmpty()) return null;
        String lower = url.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            url = "https://" + url;
        }
        return url;
    }

    public boolean isSupportedUrl(String raw) {
        try {
            String url = normalize(raw);
            if (url == null) return false;

            String host = URI.create(url).getHost();
            if (host == null) return false;

            String domain = host.toLowerCase(Locale.ROOT);
            return SUPPORTED_DOMAINS.stream()
                    .anyMatch(d -> domain.equals(d) || domain.endsWith("." + d));
        } catch (RuntimeException e) {
            log.debug("URL rejected, cannot parse '{}': {}", raw, e.getMessage());
            return false;
        }
    }
}
