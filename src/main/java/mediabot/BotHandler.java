package mediabot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Принимает Telegram updates. Telegram шлёт POST /webhook с JSON-телом
 * при каждом событии; нам нужны только текстовые сообщения.
 */
public class BotHandler {

    private static final Logger log = LoggerFactory.getLogger(BotHandler.class);

    private final ConversationHandler conversation;
    private final ObjectMapper        json = new ObjectMapper();

    public BotHandler(ConversationHandler conversation) {
        this.conversation = conversation;
    }

    /** Точка входа: Javalin вызывает этот метод при POST /webhook */
    public void onUpdate(Context ctx) {
        ctx.status(200); // Telegram требует 200 как можно быстрее
        handleUpdate(ctx.body());
    }

    void handleUpdate(String body) {
        try {
            JsonNode update = json.readTree(body);
            JsonNode message = update.path("message");
            if (!message.has("text") || !message.path("chat").has("id")) return;

            long   chatId = message.get("chat").get("id").asLong();
            String text   = message.get("text").asText();

            log.debug("Message from {}: {}", chatId, text);
            conversation.onText(chatId, text);
        } catch (Exception e) {
            // Ошибка на одном update не должна ронять webhook
            log.error("Error processing update: {}", e.getMessage(), e);
        }
    }
}
