package mediabot.download;

import mediabot.error.AccessDeniedException;
import mediabot.error.ForbiddenResponseException;
import mediabot.error.MediaBotException;
import mediabot.error.TransientFetchException;
import mediabot.util.MediaFormatting;

import java.util.List;
import java.util.Locale;

/**
 * Превращает вывод упавшего yt-dlp в типизированное исключение.
 * Строки сверяются без учёта регистра.
 */
public final class YtDlpErrors {

    private static final List<String> FORBIDDEN_MARKERS = List.of(
            "http error 403", "forbidden");

    private static final List<String> UNAVAILABLE_MARKERS = List.of(
            "video unavailable",
            "private video",
            "this video is unavailable",
            "is not available in your country",
            "has been removed",
            "this content isn't available",
            "account associated with this video has been terminated",
            "requested content is not available");

    private YtDlpErrors() {
    }

    public static MediaBotException classify(String output, int exitCode) {
        String lower  = output == null ? "" : output.toLowerCase(Locale.ROOT);
        String reason = MediaFormatting.truncate(lastErrorLine(output), 200);

        if (FORBIDDEN_MARKERS.stream().anyMatch(lower::contains)) {
            return new ForbiddenResponseException("Request blocked: " + reason);
        }
        if (UNAVAILABLE_MARKERS.stream().anyMatch(lower::contains)) {
            return new AccessDeniedException("Content unavailable: " + reason);
        }
        return new TransientFetchException("yt-dlp exited with code %d: %s".formatted(exitCode, reason));
    }

    /** Последняя строка "ERROR: ..." или, если её нет, последняя непустая строка */
    static String lastErrorLine(String output) {
        if (output == null || output.isBlank()) return "no output";
        List<String> lines = output.lines().map(String::strip).filter(l -> !l.isEmpty()).toList();
        for (int i = lines.size() - 1; i >= 0; i--) {
            if (lines.get(i).startsWith("ERROR:")) return lines.get(i);
        }
        return lines.get(lines.size() - 1);
    }
}
