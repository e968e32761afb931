package mediabot.download;

import mediabot.model.RequestContext;
import mediabot.transport.ChatAction;
import mediabot.transport.ChatTransport;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Сообщения о ходе загрузки. yt-dlp шлёт прогресс на каждый чанк, поэтому
 * chat action отправляется только с вероятностью sampleRate.
 */
public class ProgressNotifier {

    private final ChatTransport  chat;
    private final double         sampleRate;
    private final DoubleSupplier random;

    public ProgressNotifier(ChatTransport chat, double sampleRate) {
        this(chat, sampleRate, () -> ThreadLocalRandom.current().nextDouble());
    }

    public ProgressNotifier(ChatTransport chat, double sampleRate, DoubleSupplier random) {
        this.chat       = chat;
        this.sampleRate = sampleRate;
        this.random     = random;
    }

    public void phase(long chatId, String text) {
        chat.sendMessage(chatId, text);
    }

    public ProgressListener forRequest(RequestContext ctx) {
        ChatAction action = ctx.profile().isAudio() ? ChatAction.UPLOAD_AUDIO : ChatAction.UPLOAD_VIDEO;
        return percent -> {
            if (random.getAsDouble() < sampleRate) {
                chat.sendChatAction(ctx.chatId(), action);
            }
        };
    }
}
