package mediabot.download;

import mediabot.model.Profile;

import java.util.List;

/**
 * Селекторы форматов yt-dlp для каждого профиля.
 *
 * Первый элемент списка основной. Следующие пробуются по очереди,
 * когда источник отвечает 403: другой формат часто раздаётся с
 * другого CDN и не блокируется.
 */
public final class FormatSelector {

    private FormatSelector() {
    }

    public static List<FormatDirective> directivesFor(Profile profile, boolean transcodingAvailable) {
        if (profile.isAudio()) {
            if (transcodingAvailable) {
                return List.of(
                        FormatDirective.transcodedAudio("bestaudio/best", "mp3", "192K"),
                        FormatDirective.transcodedAudio("bestaudio[ext=m4a]/worstaudio/worst", "mp3", "192K"));
            }
            // Без ffmpeg просим сразу m4a, который Telegram проигрывает как аудио
            return List.of(
                    FormatDirective.audio("bestaudio[ext=m4a]/bestaudio/best"),
                    FormatDirective.audio("worstaudio/worst"));
        }
        return switch (profile.quality()) {
            case FAST -> List.of(
                    FormatDirective.video("best[height<=480]/best[height<=360]/worst"),
                    FormatDirective.video("worst"));
            case BEST -> List.of(
                    FormatDirective.video("best[height<=720]/best[height<=480]/best"),
                    FormatDirective.video("best[height<=480]/worst"));
            case HD -> List.of(
                    FormatDirective.video("best[height<=1080]/best[height<=720]/best"),
                    FormatDirective.video("best[height<=720]/best"));
        };
    }

    /** Директива для n-го варианта; после последнего остаёмся на нём */
    public static FormatDirective pick(List<FormatDirective> directives, int variant) {
        return directives.get(Math.min(variant, directives.size() - 1));
    }
}
