package mediabot.error;

/**
 * Базовое исключение приложения. Все ошибки запроса ловятся на границе
 * задачи и превращаются в одно сообщение пользователю.
 */
public abstract class MediaBotException extends RuntimeException {

    protected MediaBotException(String message) {
        super(message);
    }

    protected MediaBotException(String message, Throwable cause) {
        super(message, cause);
    }
}
