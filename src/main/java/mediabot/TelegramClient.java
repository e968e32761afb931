package mediabot;

import mediabot.error.DeliveryException;
import mediabot.transport.ChatAction;
import mediabot.transport.ChatTransport;
import mediabot.transport.Keyboard;
import mediabot.transport.MediaKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.bots.DefaultAbsSender;
import org.telegram.telegrambots.bots.DefaultBotOptions;
import org.telegram.telegrambots.meta.api.methods.send.SendAudio;
import org.telegram.telegrambots.meta.api.methods.send.SendChatAction;
import org.telegram.telegrambots.meta.api.methods.send.SendDocument;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.send.SendVideo;
import org.telegram.telegrambots.meta.api.methods.updates.SetWebhook;
import org.telegram.telegrambots.meta.api.objects.InputFile;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboard;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboardRemove;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.KeyboardRow;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.nio.file.Path;
import java.util.List;

/**
 * Тонкая обёртка над telegrambots. Не содержит бизнес-логики, только транспорт.
 * Все сообщения уходят с parse_mode=HTML.
 */
public class TelegramClient extends DefaultAbsSender implements ChatTransport {

    private static final Logger log = LoggerFactory.getLogger(TelegramClient.class);

    private static final String PARSE_MODE = "HTML";

    private final String botToken;

    public TelegramClient(String botToken) {
        super(new DefaultBotOptions());
        this.botToken = botToken;
    }

    @Override
    public String getBotToken() {
        return botToken;
    }

    // ── Отправка сообщений ─────────────────────────────────────────────────

    @Override
    public void sendMessage(long chatId, String text) {
        try {
            execute(SendMessage.builder()
                    .chatId(String.valueOf(chatId))
                    .text(text)
                    .parseMode(PARSE_MODE)
                    .build());
        } catch (TelegramApiException e) {
            log.error("Failed to send message to {}: {}", chatId, e.getMessage());
        }
    }

    @Override
    public void sendMessage(long chatId, String text, Keyboard keyboard) {
        try {
            execute(SendMessage.builder()
                    .chatId(String.valueOf(chatId))
                    .text(text)
                    .parseMode(PARSE_MODE)
                    .replyMarkup(toReplyKeyboard(keyboard))
                    .build());
        } catch (TelegramApiException e) {
            log.error("Failed to send message with keyboard to {}: {}", chatId, e.getMessage());
        }
    }

    @Override
    public void sendChatAction(long chatId, ChatAction action) {
        try {
            execute(SendChatAction.builder()
                    .chatId(String.valueOf(chatId))
                    .action(action.wireName())
                    .build());
        } catch (TelegramApiException e) {
            log.debug("Failed to send chat action {} to {}: {}", action, chatId, e.getMessage());
        }
    }

    // ── Отправка файлов ────────────────────────────────────────────────────

    @Override
    public void sendMedia(long chatId, MediaKind kind, Path file, String caption, String title) {
        var input = new InputFile(file.toFile());
        String chat = String.valueOf(chatId);
        try {
            switch (kind) {
                case VIDEO -> execute(SendVideo.builder()
                        .chatId(chat)
                        .video(input)
                        .caption(caption)
                        .parseMode(PARSE_MODE)
                        .supportsStreaming(true)
                        .build());
                case AUDIO -> execute(SendAudio.builder()
                        .chatId(chat)
                        .audio(input)
                        .caption(caption)
                        .parseMode(PARSE_MODE)
                        .title(title)
                        .build());
                case DOCUMENT -> execute(SendDocument.builder()
                        .chatId(chat)
                        .document(input)
                        .caption(caption)
                        .parseMode(PARSE_MODE)
                        .build());
            }
        } catch (TelegramApiException e) {
            throw new DeliveryException("Telegram rejected %s upload: %s".formatted(kind, e.getMessage()), e);
        }
    }

    // ── Клавиатуры ─────────────────────────────────────────────────────────

    static ReplyKeyboard toReplyKeyboard(Keyboard keyboard) {
        if (keyboard.removeKeyboard()) {
            return ReplyKeyboardRemove.builder().removeKeyboard(true).build();
        }
        List<KeyboardRow> rows = keyboard.rows().stream()
                .map(labels -> {
                    var row = new KeyboardRow();
                    labels.forEach(row::add);
                    return row;
                })
                .toList();
        return ReplyKeyboardMarkup.builder()
                .keyboard(rows)
                .resizeKeyboard(true)
                .build();
    }

    // ── Webhook ────────────────────────────────────────────────────────────

    public void setWebhook(String webhookUrl) {
        try {
            execute(SetWebhook.builder()
                    .url(webhookUrl)
                    .build());
            log.info("Webhook set to: {}", webhookUrl);
        } catch (TelegramApiException e) {
            log.error("Failed to set webhook: {}", e.getMessage());
        }
    }
}
