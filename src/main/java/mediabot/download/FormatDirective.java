package mediabot.download;

/**
 * Что просить у движка: селектор формата и, для аудио, перекодирование.
 * audioCodec == null значит "оставить контейнер как есть".
 */
public record FormatDirective(
        String  selector,
        boolean extractAudio,
        String  audioCodec,      // "mp3"
        String  audioQuality     // "192K"
) {
    public static FormatDirective video(String selector) {
        return new FormatDirective(selector, false, null, null);
    }

    public static FormatDirective audio(String selector) {
        return new FormatDirective(selector, false, null, null);
    }

    public static FormatDirective transcodedAudio(String selector, String codec, String quality) {
        return new FormatDirective(selector, true, codec, quality);
    }

    @Override
    public String toString() {
        return extractAudio ? selector + " -> " + audioCodec + "@" + audioQuality : selector;
    }
}
