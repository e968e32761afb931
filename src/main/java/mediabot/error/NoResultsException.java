package mediabot.error;

/** Поиск не вернул ни одного подходящего результата. */
public class NoResultsException extends MediaBotException {

    public NoResultsException(String message) {
        super(message);
    }
}
