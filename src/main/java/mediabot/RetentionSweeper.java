package mediabot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Периодически удаляет старые файлы из общей временной директории.
 *
 * Sweeper не знает, какие файлы сейчас в работе. Если загрузка вместе с
 * отправкой длится дольше retentionAge, файл может исчезнуть между
 * поиском и отправкой. Поэтому retentionAge держим с большим запасом
 * относительно обычного времени обработки; DeliveryService перед
 * отправкой всё равно проверяет файл ещё раз.
 */
public class RetentionSweeper {

    private static final Logger log = LoggerFactory.getLogger(RetentionSweeper.class);

    private final Path     storageDir;
    private final Duration period;
    private final Duration retentionAge;
    private final Clock    clock;
    private final ScheduledExecutorService scheduler =
            Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "retention-sweeper");
                t.setDaemon(true);
                return t;
            });

    public RetentionSweeper(AppConfig config, Clock clock) {
        this(config.storageDir(), config.sweepPeriod(), config.retentionAge(), clock);
    }

    public RetentionSweeper(Path storageDir, Duration period, Duration retentionAge, Clock clock) {
        this.storageDir   = storageDir;
        this.period       = period;
        this.retentionAge = retentionAge;
        this.clock        = clock;
    }

    /**
     * Сразу чистит всё, что осталось от прошлого запуска (порог 0),
     * затем запускает цикл с обычным порогом.
     */
    public void start() {
        runCycle(Duration.ZERO);
        scheduler.scheduleAtFixedRate(() -> runCycle(retentionAge),
                period.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Retention sweeper started: every {} min, max age {} min",
                period.toMinutes(), retentionAge.toMinutes());
    }

    /**
     * Одна итерация. Исключение из scheduleAtFixedRate отменило бы все
     * следующие запуски, поэтому здесь ловится всё.
     */
    void runCycle(Duration maxAge) {
        try {
            int deleted = sweep(maxAge);
            if (deleted > 0) log.info("🧹 Cleaned {} temporary file(s)", deleted);
        } catch (Exception e) {
            log.error("Sweep cycle failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Удаляет файлы не моложе maxAge, при нулевом пороге удаляет все.
     * Ошибка на одном файле логируется и не прерывает проход.
     */
    public int sweep(Duration maxAge) throws IOException {
        if (!Files.isDirectory(storageDir)) return 0;

        List<Path> entries;
        try (Stream<Path> list = Files.list(storageDir)) {
            entries = list.filter(Files::isRegularFile).toList();
        }

        Instant now = clock.instant();
        int deleted = 0;
        for (Path file : entries) {
            try {
                BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
                Duration age = Duration.between(attrs.creationTime().toInstant(), now);
                boolean expired = maxAge.isZero() || age.compareTo(maxAge) >= 0;
                if (expired && Files.deleteIfExists(file)) {
                    deleted++;
                    log.info("Deleted {} ({} bytes, age {}s)", file.getFileName(), attrs.size(), age.toSeconds());
                }
            } catch (IOException e) {
                log.warn("Failed to delete {}: {}", file.getFileName(), e.getMessage());
            }
        }
        return deleted;
    }

    public void shutdown() {
        scheduler.shutdownNow();
    }
}
