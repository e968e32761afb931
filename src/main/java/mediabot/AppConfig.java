package mediabot;

import mediabot.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Вся конфигурация приложения из переменных окружения.
 * Создаётся один раз при старте.
 */
public record AppConfig(
        String   botToken,
        String   webhookUrl,
        int      port,
        Path     storageDir,
        String   ytDlpPath,
        String   ffmpegPath,
        String   cookiesFile,        // путь к файлу cookies, null если не задан
        long     maxUploadBytes,
        int      engineTimeoutSeconds,
        int      maxAttempts,
        Duration retryBackoff,
        Duration settleDelay,
        long     minPayloadBytes,    // файл размером <= этого значения считается пустым
        int      uploadAttempts,
        Duration uploadPause,
        Duration sweepPeriod,
        Duration retentionAge,
        int      workerThreads,
        int      queueCapacity,
        int      searchResultLimit,
        long     searchMaxDurationSeconds,
        double   progressSampleRate,
        Duration sessionTtl
) {
    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    public static AppConfig fromEnv() {
        return from(System.getenv());
    }

    /** Сборка из произвольной карты. Используется тестами. */
    public static AppConfig from(Map<String, String> env) {
        var e = new Env(env);
        var config = new AppConfig(
                e.require("BOT_TOKEN"),
                e.require("WEBHOOK_URL"),
                e.getInt("PORT", 8080),
                Path.of(e.get("STORAGE_DIR", "/tmp/telegram_bot_files")),
                e.get("YT_DLP_PATH", "yt-dlp"),
                e.get("FFMPEG_PATH", "ffmpeg"),
                e.get("COOKIES_FILE", null),
                e.getLong("MAX_UPLOAD_BYTES", 50L * 1024 * 1024),
                e.getInt("ENGINE_TIMEOUT_SECONDS", 600),
                e.getInt("DOWNLOAD_MAX_ATTEMPTS", 3),
                Duration.ofSeconds(e.getLong("RETRY_BACKOFF_SECONDS", 3)),
                Duration.ofMillis(e.getLong("SETTLE_DELAY_MILLIS", 2000)),
                e.getLong("MIN_PAYLOAD_BYTES", 1024),
                e.getInt("UPLOAD_ATTEMPTS", 2),
                Duration.ofMillis(e.getLong("UPLOAD_PAUSE_MILLIS", 2000)),
                Duration.ofMinutes(e.getLong("SWEEP_PERIOD_MINUTES", 5)),
                Duration.ofMinutes(e.getLong("RETENTION_MINUTES", 10)),
                e.getInt("WORKER_THREADS", 4),
                e.getInt("QUEUE_CAPACITY", 16),
                e.getInt("SEARCH_RESULT_LIMIT", 3),
                e.getLong("SEARCH_MAX_DURATION_SECONDS", 1800),
                e.getDouble("PROGRESS_SAMPLE_RATE", 0.1),
                Duration.ofMinutes(e.getLong("SESSION_TTL_MINUTES", 30))
        );
        config.validate();
        return config;
    }

    public void validate() {
        if (!botToken.contains(":")) {
            throw new ConfigurationException("BOT_TOKEN has invalid format");
        }
        if (!webhookUrl.startsWith("https://")) {
            throw new ConfigurationException("WEBHOOK_URL must start with https://");
        }
        if (maxAttempts < 1 || uploadAttempts < 1) {
            throw new ConfigurationException("Attempt counts must be positive");
        }
        if (workerThreads < 1 || queueCapacity < 1) {
            throw new ConfigurationException("WORKER_THREADS and QUEUE_CAPACITY must be positive");
        }
        if (sweepPeriod.isZero() || sweepPeriod.isNegative()) {
            throw new ConfigurationException("SWEEP_PERIOD_MINUTES must be positive");
        }
        log.info("Config loaded: port={}, storage={}, workers={}, queue={}",
                port, storageDir, workerThreads, queueCapacity);
    }

    public boolean hasCookies() {
        return cookiesFile != null;
    }

    public AppConfig withCookiesFile(String path) {
        return new AppConfig(botToken, webhookUrl, port, storageDir, ytDlpPath, ffmpegPath,
                path, maxUploadBytes, engineTimeoutSeconds, maxAttempts, retryBackoff,
                settleDelay, minPayloadBytes, uploadAttempts, uploadPause, sweepPeriod,
                retentionAge, workerThreads, queueCapacity, searchResultLimit,
                searchMaxDurationSeconds, progressSampleRate, sessionTtl);
    }

    // ── Чтение переменных ──────────────────────────────────────────────────

    private record Env(Map<String, String> values) {

        String require(String name) {
            String value = values.get(name);
            if (value == null || value.isBlank()) {
                throw new ConfigurationException("Required environment variable not set: " + name);
            }
            return value.trim();
        }

        String get(String name, String defaultValue) {
            String value = values.get(name);
            return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
        }

        int getInt(String name, int defaultValue) {
            String value = get(name, null);
            if (value == null) return defaultValue;
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException ex) {
                throw new ConfigurationException("Not an integer: " + name + "=" + value, ex);
            }
        }

        long getLong(String name, long defaultValue) {
            String value = get(name, null);
            if (value == null) return defaultValue;
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException ex) {
                throw new ConfigurationException("Not a number: " + name + "=" + value, ex);
            }
        }

        double getDouble(String name, double defaultValue) {
            String value = get(name, null);
            if (value == null) return defaultValue;
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException ex) {
                throw new ConfigurationException("Not a number: " + name + "=" + value, ex);
            }
        }
    }
}
