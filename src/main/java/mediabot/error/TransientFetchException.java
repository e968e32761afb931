package mediabot.error;

/**
 * Таймаут, лимит запросов или любая другая ошибка движка,
 * после которой имеет смысл подождать и попробовать снова.
 */
public class TransientFetchException extends MediaBotException {

    public TransientFetchException(String message) {
        super(message);
    }

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
