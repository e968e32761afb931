package mediabot.transport;

import mediabot.error.DeliveryException;

import java.nio.file.Path;

/**
 * Всё, что ядру нужно от чата. Для Telegram это
 * {@link mediabot.TelegramClient}, в тестах фейк.
 *
 * Текстовые сообщения и chat action не бросают исключений: ошибка
 * отправки логируется и не должна ломать обработку запроса.
 * Отправка файла бросает {@link DeliveryException}, потому что от её
 * результата зависит, пробовать ли другой канал.
 */
public interface ChatTransport {

    void sendMessage(long chatId, String text);

    void sendMessage(long chatId, String text, Keyboard keyboard);

    void sendMedia(long chatId, MediaKind kind, Path file, String caption, String title)
            throws DeliveryException;

    void sendChatAction(long chatId, ChatAction action);
}
