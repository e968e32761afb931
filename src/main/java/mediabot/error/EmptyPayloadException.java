package mediabot.error;

/** Движок отработал, но проверенного файла нет (пусто или слишком мал). */
public class EmptyPayloadException extends MediaBotException {

    public EmptyPayloadException(String message) {
        super(message);
    }
}
