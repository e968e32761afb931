package mediabot.error;

/**
 * Конфигурация отсутствует или некорректна.
 * Единственная ошибка, после которой процесс завершается.
 */
public class ConfigurationException extends MediaBotException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
