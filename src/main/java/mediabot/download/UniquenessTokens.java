package mediabot.download;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Генерирует токены для имён файлов. Только токен разделяет
 * параллельные загрузки в общей директории, поэтому в нём время,
 * chatId и сквозной счётчик процесса.
 *
 * Формат: dl_{millis}_{chat}_{seq}. Файлы ищутся по префиксу "токен + _",
 * так что dl_.._1 никогда не совпадёт с dl_.._12.
 */
public class UniquenessTokens {

    private final Clock      clock;
    private final AtomicLong sequence = new AtomicLong();

    public UniquenessTokens(Clock clock) {
        this.clock = clock;
    }

    public String next(long chatId) {
        // У групповых чатов id отрицательный, минус в имени файла ни к чему
        String chat = chatId < 0 ? "g" + (-chatId) : Long.toString(chatId);
        return "dl_%d_%s_%d".formatted(clock.millis(), chat, sequence.incrementAndGet());
    }

    public static String filePrefix(String token) {
        return token + "_";
    }
}
