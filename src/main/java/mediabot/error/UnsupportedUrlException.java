package mediabot.error;

/** Ссылка не с поддерживаемой платформы. */
public class UnsupportedUrlException extends MediaBotException {

    public UnsupportedUrlException(String message) {
        super(message);
    }
}
