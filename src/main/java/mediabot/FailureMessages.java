package mediabot;

import mediabot.error.AccessDeniedException;
import mediabot.error.DeliveryException;
import mediabot.error.EmptyPayloadException;
import mediabot.error.ForbiddenResponseException;
import mediabot.error.NoResultsException;
import mediabot.error.RetryFailedException;
import mediabot.error.UnsupportedUrlException;
import mediabot.util.MediaFormatting;

/**
 * Одно понятное сообщение пользователю на любую ошибку запроса.
 */
public final class FailureMessages {

    public static final String UNSUPPORTED_URL = """
            ❌ <b>Неподдерживаемая ссылка</b>

            Поддерживаются: %s""".formatted(UrlValidator.SUPPORTED_PLATFORMS);

    private FailureMessages() {
    }

    public static String describe(Throwable error) {
        if (error instanceof RetryFailedException) {
            Throwable last = error.getCause();
            if (last instanceof ForbiddenResponseException || last instanceof EmptyPayloadException) {
                return describe(last);
            }
            return "❌ <b>Все попытки загрузки (%d) завершились неудачей.</b> Попробуйте позже."
                    .formatted(((RetryFailedException) error).attempts());
        }
        if (error instanceof UnsupportedUrlException) return UNSUPPORTED_URL;
        if (error instanceof AccessDeniedException) {
            return "❌ <b>Видео недоступно</b>: оно приватное, удалено или ограничено по региону.";
        }
        if (error instanceof ForbiddenResponseException) {
            return "❌ <b>Доступ заблокирован</b>: сервер отклоняет запросы. Попробуйте другое видео.";
        }
        if (error instanceof EmptyPayloadException) {
            return "❌ <b>Файл не получен</b>: загрузка завершилась, но файл пустой.";
        }
        if (error instanceof NoResultsException) {
            return "❌ <b>Ничего не найдено</b>";
        }
        if (error instanceof DeliveryException) {
            return "❌ <b>Не удалось отправить файл</b>";
        }
        String msg = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return "❌ <b>Ошибка загрузки:</b>\n" + MediaFormatting.escapeHtml(MediaFormatting.truncate(msg, 150));
    }
}
