package mediabot.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Команды главного меню. Текст кнопки превращается в команду ровно в одном
 * месте, в {@link #classify(String)}; дальше по коду ходит только enum.
 */
public enum MenuCommand {

    DOWNLOAD_VIDEO("📥 Download Video", Profile.VIDEO_BEST),
    FAST_DOWNLOAD ("⚡ Fast Download",  Profile.VIDEO_FAST),
    HD_VIDEO      ("🎞 HD Video",       Profile.VIDEO_HD),
    AUDIO_ONLY    ("🎵 Audio Only",     Profile.AUDIO),
    SEARCH_MUSIC  ("🔍 Search Music",   null),
    STATUS        ("📊 Status",         null),
    HELP          ("ℹ️ Help",           null),
    MAIN_MENU     (null,                null);   // /start, /help, /menu

    private static final List<String> MENU_SLASH_COMMANDS = List.of("/start", "/help", "/menu");

    private final String  label;
    private final Profile profile;

    MenuCommand(String label, Profile profile) {
        this.label   = label;
        this.profile = profile;
    }

    public String  label()   { return label; }
    public Profile profile() { return profile; }

    /** Команда выбирает профиль загрузки и переводит диалог в ожидание ссылки */
    public boolean selectsProfile() {
        return profile != null;
    }

    /** Кнопки главного меню в порядке отображения */
    public static List<MenuCommand> buttons() {
        return Arrays.stream(values())
                .filter(c -> c.label != null)
                .toList();
    }

    /**
     * Распознаёт текст как команду меню. Слэш-команды сравниваются без
     * учёта суффикса @botname, как их присылает Telegram в группах.
     */
    public static Optional<MenuCommand> classify(String text) {
        if (text == null) return Optional.empty();
        String trimmed = text.trim();
        if (trimmed.startsWith("/")) {
            String command = trimmed.split("[\\s@]", 2)[0].toLowerCase();
            return MENU_SLASH_COMMANDS.contains(command)
                    ? Optional.of(MAIN_MENU)
                    : Optional.empty();
        }
        for (MenuCommand c : values()) {
            if (c.label != null && c.label.equals(trimmed)) return Optional.of(c);
        }
        return Optional.empty();
    }
}
