package mediabot.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Форматирование для людей и файловой системы: имена, размеры, длительности.
 */
public final class MediaFormatting {

    private static final Pattern FORBIDDEN_CHARS = Pattern.compile("[<>:\"/\\\\|?*]");
    private static final Pattern WHITESPACE      = Pattern.compile("\\s+");
    private static final String[] UNITS = {"B", "KB", "MB", "GB"};

    public static final int    MAX_TITLE_LENGTH = 100;
    public static final String FALLBACK_NAME    = "media_file";

    private MediaFormatting() {
    }

    /** Убирает запрещённые в именах файлов символы и схлопывает пробелы */
    public static String sanitizeTitle(String title) {
        if (title == null || title.isBlank()) return FALLBACK_NAME;

        String cleaned = FORBIDDEN_CHARS.matcher(title).replaceAll("");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").strip();
        if (cleaned.length() > MAX_TITLE_LENGTH) {
            cleaned = cleaned.substring(0, MAX_TITLE_LENGTH).strip();
        }
        return cleaned.isEmpty() ? FALLBACK_NAME : cleaned;
    }

    /** Размер вида "4.9 KB", "12.3 MB" */
    public static String formatSize(long bytes) {
        if (bytes < 0) return "Unknown";
        double size = bytes;
        for (String unit : UNITS) {
            if (size < 1024.0) return String.format(Locale.ROOT, "%.1f %s", size, unit);
            size /= 1024.0;
        }
        return String.format(Locale.ROOT, "%.1f TB", size);
    }

    /** Длительность вида "1:23:45" или "3:07" */
    public static String formatDuration(long seconds) {
        if (seconds < 0) return "Unknown";
        long h = seconds / 3600;
        long m = (seconds % 3600) / 60;
        long s = seconds % 60;
        if (h > 0) return "%d:%02d:%02d".formatted(h, m, s);
        return "%d:%02d".formatted(m, s);
    }

    /** Экранирование для parse_mode=HTML в Telegram */
    public static String escapeHtml(String text) {
        if (text == null) return "";
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    /** Обрезает текст ошибки, чтобы не заваливать чат стектрейсами */
    public static String truncate(String text, int maxLength) {
        if (text == null) return "";
        return text.length() <= maxLength ? text : text.substring(0, maxLength) + "…";
    }
}
