package mediabot.model;

import java.time.Instant;

/**
 * Состояние диалога одного пользователя.
 *
 * Переходы делаются заменой целого значения в
 * {@link mediabot.ConversationStore}, а не мутацией полей.
 * profile заполнен только в режиме AWAITING_URL.
 */
public record ConversationState(Mode mode, Profile profile, Instant enteredAt) {

    public enum Mode {
        IDLE,                   // показано главное меню
        AWAITING_URL,           // выбран профиль, ждём ссылку
        AWAITING_SEARCH_QUERY,  // ждём текст для поиска
        PROCESSING              // задача отправлена в пул
    }

    public ConversationState {
        if (mode == null) throw new IllegalArgumentException("mode is required");
        if (mode == Mode.AWAITING_URL && profile == null) {
            throw new IllegalArgumentException("AWAITING_URL requires a profile");
        }
        if (enteredAt == null) enteredAt = Instant.now();
    }

    public static ConversationState idle() {
        return new ConversationState(Mode.IDLE, null, Instant.now());
    }

    public static ConversationState awaitingUrl(Profile profile) {
        return new ConversationState(Mode.AWAITING_URL, profile, Instant.now());
    }

    public static ConversationState awaitingSearchQuery() {
        return new ConversationState(Mode.AWAITING_SEARCH_QUERY, null, Instant.now());
    }

    public static ConversationState processing() {
        return new ConversationState(Mode.PROCESSING, null, Instant.now());
    }

    public boolean isIdle()       { return mode == Mode.IDLE; }
    public boolean isProcessing() { return mode == Mode.PROCESSING; }
    public boolean isAwaiting() {
        return mode == Mode.AWAITING_URL || mode == Mode.AWAITING_SEARCH_QUERY;
    }
}
