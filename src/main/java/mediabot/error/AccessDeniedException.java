package mediabot.error;

/** Контент приватный, удалён или закрыт по региону. Повторять бессмысленно. */
public class AccessDeniedException extends MediaBotException {

    public AccessDeniedException(String message) {
        super(message);
    }

    public AccessDeniedException(String message, Throwable cause) {
        super(message, cause);
    }
}
