package mediabot.error;

/** HTTP 403 от источника. Иногда лечится другим форматом. */
public class ForbiddenResponseException extends MediaBotException {

    public ForbiddenResponseException(String message) {
        super(message);
    }

    public ForbiddenResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
