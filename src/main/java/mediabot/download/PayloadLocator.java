package mediabot.download;

import mediabot.model.StoredPayload;
import mediabot.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Поиск и проверка скачанного файла в общей директории.
 *
 * Файл ищется только по токену. Запасного варианта "самый свежий файл
 * в папке" нет: при параллельных загрузках он отдаёт чужой файл.
 */
public class PayloadLocator {

    private static final Logger log = LoggerFactory.getLogger(PayloadLocator.class);

    // Временные файлы yt-dlp, которые никогда не являются результатом
    private static final List<String> PARTIAL_SUFFIXES = List.of(".part", ".ytdl", ".temp", ".tmp");

    private final Path     storageDir;
    private final long     minPayloadBytes;
    private final Duration settleDelay;
    private final Sleeper  sleeper;

    public PayloadLocator(Path storageDir, long minPayloadBytes, Duration settleDelay, Sleeper sleeper) {
        this.storageDir      = storageDir;
        this.minPayloadBytes = minPayloadBytes;
        this.settleDelay     = settleDelay;
        this.sleeper         = sleeper;
    }

    /**
     * Ждёт settleDelay (движок может дописывать файл асинхронно), затем
     * выбирает первый файл с токеном размером больше minPayloadBytes.
     * Слишком маленькие и недокачанные файлы удаляются сразу, лишние
     * валидные тоже, чтобы к доставке в папке остался один файл.
     */
    public Optional<StoredPayload> locate(String token) throws IOException, InterruptedException {
        sleeper.sleep(settleDelay);

        StoredPayload chosen = null;
        for (Path file : list(token)) {
            if (isPartial(file)) {
                deleteQuietly(file, "partial artifact");
                continue;
            }
            long size;
            try {
                size = Files.size(file);
            } catch (IOException e) {
                log.warn("Cannot read size of {}: {}", file, e.getMessage());
                continue;
            }
            log.debug("Found file: {} ({} bytes)", file.getFileName(), size);

            if (chosen != null) {
                deleteQuietly(file, "extra output");
            } else if (size <= minPayloadBytes) {
                log.warn("File too small: {} ({} bytes)", file.getFileName(), size);
                deleteQuietly(file, "below size threshold");
            } else {
                chosen = new StoredPayload(file, size, token);
            }
        }
        return Optional.ofNullable(chosen);
    }

    /** Файл существует и больше порога */
    public boolean isValid(Path file) {
        try {
            return Files.isRegularFile(file) && Files.size(file) > minPayloadBytes;
        } catch (IOException e) {
            log.warn("Cannot verify {}: {}", file, e.getMessage());
            return false;
        }
    }

    /** Удаляет все файлы с этим токеном. Возвращает число удалённых. */
    public int purge(String token) {
        List<Path> files;
        try {
            files = list(token);
        } catch (IOException e) {
            log.warn("Cannot list {} to purge token {}: {}", storageDir, token, e.getMessage());
            return 0;
        }
        int deleted = 0;
        for (Path file : files) {
            if (deleteQuietly(file, "purge")) deleted++;
        }
        if (deleted > 0) log.info("Purged {} artifact(s) for token {}", deleted, token);
        return deleted;
    }

    public List<Path> list(String token) throws IOException {
        if (!Files.isDirectory(storageDir)) return List.of();
        String prefix = UniquenessTokens.filePrefix(token);
        try (Stream<Path> entries = Files.list(storageDir)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().startsWith(prefix))
                    .sorted()
                    .toList();
        }
    }

    private static boolean isPartial(Path file) {
        String name = file.getFileName().toString();
        return PARTIAL_SUFFIXES.stream().anyMatch(name::endsWith);
    }

    private static boolean deleteQuietly(Path file, String reason) {
        try {
            boolean deleted = Files.deleteIfExists(file);
            if (deleted) log.debug("Deleted {} ({})", file.getFileName(), reason);
            return deleted;
        } catch (IOException e) {
            log.warn("Could not delete {} ({}): {}", file, reason, e.getMessage());
            return false;
        }
    }
}
