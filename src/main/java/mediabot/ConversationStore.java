package mediabot;

import mediabot.model.ConversationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Состояния диалогов в памяти, по одному на chatId.
 * Отсутствие записи означает IDLE. При рестарте всё теряется, и это нормально.
 *
 * Каждое изменение атомарно на уровне ключа (ConcurrentHashMap),
 * потому что пишут сюда и поток webhook, и потоки пула по завершении задач.
 */
public class ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(ConversationStore.class);

    private final ConcurrentHashMap<Long, ConversationState> states = new ConcurrentHashMap<>();
    private final Clock    clock;
    private final Duration ttl;
    private ScheduledExecutorService cleaner;

    public ConversationStore(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl   = ttl;
    }

    public ConversationState get(long chatId) {
        ConversationState state = states.get(chatId);
        return state != null ? state : ConversationState.idle();
    }

    public void put(long chatId, ConversationState state) {
        if (state.isIdle()) {
            states.remove(chatId);
        } else {
            states.put(chatId, state);
        }
    }

    public void reset(long chatId) {
        states.remove(chatId);
    }

    /**
     * Записывает next, если диалог сейчас не в PROCESSING. Проверка и запись
     * атомарны, так что параллельное нажатие кнопки не затрёт начатую задачу.
     * Возвращает false, если запись отклонена.
     */
    public boolean putUnlessProcessing(long chatId, ConversationState next) {
        var refused = new AtomicBoolean();
        states.compute(chatId, (id, current) -> {
            if (current != null && current.isProcessing()) {
                refused.set(true);
                return current;
            }
            return next.isIdle() ? null : next;
        });
        return !refused.get();
    }

    /** Сброс в IDLE, но не из PROCESSING: его снимает только сама задача */
    public boolean resetUnlessProcessing(long chatId) {
        return putUnlessProcessing(chatId, ConversationState.idle());
    }

    /**
     * Переход expected → next, только если текущее состояние всё ещё expected.
     * Возвращает false, если состояние успел поменять кто-то другой.
     */
    public boolean transition(long chatId, ConversationState expected, ConversationState next) {
        if (expected.isIdle()) {
            return states.putIfAbsent(chatId, next) == null;
        }
        return states.replace(chatId, expected, next);
    }

    public int size() {
        return states.size();
    }

    // ── Очистка ────────────────────────────────────────────────────────────

    /** Раз в 15 минут сбрасывает зависшие ожидания ввода */
    public void startCleaner() {
        cleaner = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-cleaner");
            t.setDaemon(true);
            return t;
        });
        cleaner.scheduleAtFixedRate(this::removeExpired, 15, 15, TimeUnit.MINUTES);
    }

    /** PROCESSING не трогаем никогда: его снимает только сама задача */
    int removeExpired() {
        Instant threshold = clock.instant().minus(ttl);
        int before = states.size();
        states.values().removeIf(s -> s.isAwaiting() && s.enteredAt().isBefore(threshold));
        int removed = before - states.size();
        if (removed > 0) log.debug("Removed {} expired sessions", removed);
        return removed;
    }

    public void shutdown() {
        if (cleaner != null) cleaner.shutdownNow();
    }
}
