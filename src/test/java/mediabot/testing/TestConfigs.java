package mediabot.testing;

import mediabot.AppConfig;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/** Конфигурация для тестов: без пауз, хранилище во временной папке. */
public final class TestConfigs {

    private TestConfigs() {
    }

    public static AppConfig forStorage(Path storageDir) {
        return forStorage(storageDir, Map.of());
    }

    public static AppConfig forStorage(Path storageDir, Map<String, String> overrides) {
        var env = new HashMap<String, String>();
        env.put("BOT_TOKEN", "123456:test-token");
        env.put("WEBHOOK_URL", "https://bot.example.org");
        env.put("STORAGE_DIR", storageDir.toString());
        env.put("RETRY_BACKOFF_SECONDS", "0");
        env.put("SETTLE_DELAY_MILLIS", "0");
        env.put("UPLOAD_PAUSE_MILLIS", "0");
        env.putAll(overrides);
        return AppConfig.from(env);
    }
}
