package mediabot.delivery;

import mediabot.AppConfig;
import mediabot.download.PayloadLocator;
import mediabot.error.DeliveryException;
import mediabot.model.MediaInfo;
import mediabot.model.RequestContext;
import mediabot.model.StoredPayload;
import mediabot.transport.ChatAction;
import mediabot.transport.ChatTransport;
import mediabot.transport.MediaKind;
import mediabot.util.MediaFormatting;
import mediabot.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Отправляет проверенный файл пользователю.
 *
 * Сначала пробует канал по типу медиа (видео/аудио), затем один раз
 * отправляет как документ. Любой сбой транспорта при отправке, а не
 * только DeliveryException, ведёт к следующей попытке и затем к
 * документу. Файл удаляется в finally при любом исходе.
 */
public class DeliveryService {

    private static final Logger log = LoggerFactory.getLogger(DeliveryService.class);

    private final ChatTransport  chat;
    private final PayloadLocator locator;
    private final Sleeper        sleeper;
    private final int            uploadAttempts;
    private final Duration       uploadPause;
    private final long           maxUploadBytes;

    public DeliveryService(AppConfig config, ChatTransport chat, PayloadLocator locator, Sleeper sleeper) {
        this.chat           = chat;
        this.locator        = locator;
        this.sleeper        = sleeper;
        this.uploadAttempts = config.uploadAttempts();
        this.uploadPause    = config.uploadPause();
        this.maxUploadBytes = config.maxUploadBytes();
    }

    public DeliveryOutcome deliver(RequestContext ctx, MediaInfo info, StoredPayload payload) {
        long chatId = ctx.chatId();
        Path file   = payload.path();
        try {
            // Файл мог пропасть между загрузкой и отправкой (например, его снёс sweeper)
            if (!locator.isValid(file)) {
                log.warn("Payload {} missing or too small before upload", file);
                chat.sendMessage(chatId, "❌ <b>Скачанный файл не найден или пуст</b>");
                return DeliveryOutcome.FAILED;
            }
            long size = Files.size(file);
            if (size > maxUploadBytes) {
                chat.sendMessage(chatId, "❌ <b>Файл слишком большой для Telegram</b> (%s, лимит %s)".formatted(
                        MediaFormatting.formatSize(size), MediaFormatting.formatSize(maxUploadBytes)));
                return DeliveryOutcome.FAILED;
            }

            String caption = caption(info, size);
            String title   = MediaFormatting.truncate(info.safeTitle(), 64);
            MediaKind kind = ctx.profile().isAudio() ? MediaKind.AUDIO : MediaKind.VIDEO;

            chat.sendMessage(chatId, "📤 <b>Отправляю файл в Telegram...</b>");
            chat.sendChatAction(chatId, ChatAction.UPLOAD_DOCUMENT);

            RuntimeException lastError = null;
            for (int attempt = 1; attempt <= uploadAttempts; attempt++) {
                try {
                    chat.sendMedia(chatId, kind, file, caption, title);
                    chat.sendMessage(chatId, "✅ <b>Готово!</b>");
                    log.info("Delivered {} to chatId={} as {}", file.getFileName(), chatId, kind);
                    return DeliveryOutcome.DELIVERED;
                } catch (RuntimeException e) {
                    lastError = e;
                    log.warn("Upload attempt {}/{} to chatId={} failed: {}",
                            attempt, uploadAttempts, chatId, e.getMessage());
                    if (attempt < uploadAttempts) {
                        chat.sendMessage(chatId, "⚠️ Не удалось отправить, пробую ещё раз (попытка %d)..."
                                .formatted(attempt + 1));
                        sleeper.sleep(uploadPause);
                    }
                }
            }

            // Последний шанс: отправить как обычный документ
            try {
                chat.sendMedia(chatId, MediaKind.DOCUMENT, file, caption, title);
                chat.sendMessage(chatId, "✅ <b>Отправлено как документ</b>");
                log.info("Delivered {} to chatId={} as document fallback", file.getFileName(), chatId);
                return DeliveryOutcome.DELIVERED_AS_DOCUMENT;
            } catch (RuntimeException e) {
                log.error("Document fallback to chatId={} failed: {}", chatId, e.getMessage());
                String reason = lastError != null ? lastError.getMessage() : e.getMessage();
                chat.sendMessage(chatId, "❌ <b>Не удалось отправить файл:</b> "
                        + MediaFormatting.escapeHtml(MediaFormatting.truncate(reason, 100)));
                return DeliveryOutcome.FAILED;
            }
        } catch (IOException e) {
            log.error("Cannot read payload {}: {}", file, e.getMessage());
            chat.sendMessage(chatId, "❌ <b>Скачанный файл не найден или пуст</b>");
            return DeliveryOutcome.FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException("Interrupted while delivering " + file.getFileName(), e);
        } finally {
            deleteQuietly(file);
        }
    }

    static String caption(MediaInfo info, long sizeBytes) {
        return """
                ✅ <b>Загрузка завершена!</b>

                🎬 <b>Название:</b> %s
                👤 <b>Автор:</b> %s
                ⏱ <b>Длительность:</b> %s
                📊 <b>Размер:</b> %s""".formatted(
                MediaFormatting.escapeHtml(info.safeTitle()),
                MediaFormatting.escapeHtml(info.uploaderOrUnknown()),
                info.formattedDuration(),
                MediaFormatting.formatSize(sizeBytes));
    }

    private void deleteQuietly(Path file) {
        try {
            if (Files.deleteIfExists(file)) log.info("Cleaned up: {}", file);
        } catch (IOException e) {
            log.warn("Could not delete payload {}: {}", file, e.getMessage());
        }
    }
}
