package mediabot;

import io.javalin.Javalin;
import mediabot.delivery.DeliveryService;
import mediabot.download.DownloadOrchestrator;
import mediabot.download.PayloadLocator;
import mediabot.download.ProgressNotifier;
import mediabot.download.UniquenessTokens;
import mediabot.download.YtDlpEngine;
import mediabot.download.retry.RetryExecutor;
import mediabot.error.ConfigurationException;
import mediabot.search.SearchService;
import mediabot.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Base64;

/**
 * Точка входа. Собирает все зависимости вручную и запускает сервер.
 * Никакого DI-фреймворка, для такого количества классов он не нужен.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        AppConfig config;
        try {
            config = AppConfig.fromEnv();
        } catch (ConfigurationException e) {
            log.error("Cannot start: {}", e.getMessage());
            System.exit(1);
            return;
        }

        config = writeCookies(config);

        try {
            Files.createDirectories(config.storageDir());
        } catch (Exception e) {
            log.error("Cannot create storage directory {}: {}", config.storageDir(), e.getMessage());
            System.exit(1);
            return;
        }

        // Сборка зависимостей
        var clock          = Clock.systemUTC();
        var telegramClient = new TelegramClient(config.botToken());
        var engine         = new YtDlpEngine(config);
        var locator        = new PayloadLocator(config.storageDir(), config.minPayloadBytes(),
                                                config.settleDelay(), Sleeper.SYSTEM);
        var orchestrator   = new DownloadOrchestrator(config, engine, locator,
                                                      new RetryExecutor(Sleeper.SYSTEM),
                                                      new UniquenessTokens(clock),
                                                      new ProgressNotifier(telegramClient, config.progressSampleRate()));
        var delivery       = new DeliveryService(config, telegramClient, locator, Sleeper.SYSTEM);
        var pipeline       = new MediaPipeline(orchestrator, delivery);
        var search         = new SearchService(config, engine, pipeline, telegramClient);
        var store          = new ConversationStore(clock, config.sessionTtl());
        var dispatcher     = RequestDispatcher.bounded(config.workerThreads(), config.queueCapacity());
        var conversation   = new ConversationHandler(store, telegramClient, new UrlValidator(),
                                                     dispatcher, pipeline, search,
                                                     new StatusReport(dispatcher, engine, config.storageDir()));
        var botHandler     = new BotHandler(conversation);
        var sweeper        = new RetentionSweeper(config, clock);

        // Сначала чистим остатки прошлого запуска, потом принимаем запросы
        sweeper.start();
        store.startCleaner();

        // HTTP сервер
        var app = Javalin.create();

        // Telegram webhook
        app.post("/webhook", botHandler::onUpdate);

        // Healthcheck
        app.get("/health", ctx -> ctx.result("OK"));

        app.start(config.port());

        // Регистрируем webhook в Telegram
        telegramClient.setWebhook(config.webhookUrl() + "/webhook");

        log.info("Bot started on port {}, storage {}, transcoding={}",
                config.port(), config.storageDir(), engine.supportsTranscoding());

        // Graceful shutdown
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            app.stop();
            dispatcher.shutdown();
            store.shutdown();
            sweeper.shutdown();
        }, "shutdown"));
    }

    /**
     * Декодирует cookies из YOUTUBE_COOKIES_BASE64 во временный файл.
     * Файл лежит рядом с хранилищем, а не в нём, иначе его удалит sweeper.
     */
    private static AppConfig writeCookies(AppConfig config) {
        String cookiesB64 = System.getenv("YOUTUBE_COOKIES_BASE64");
        if (cookiesB64 == null || cookiesB64.isBlank()) return config;

        try {
            Path parent = config.storageDir().toAbsolutePath().getParent();
            Path cookiesFile = (parent != null ? parent : Path.of(".")).resolve("cookies.txt");
            Files.write(cookiesFile, Base64.getDecoder().decode(cookiesB64.trim()));
            log.info("Cookies file written to {}", cookiesFile);
            return config.withCookiesFile(cookiesFile.toString());
        } catch (Exception e) {
            log.error("Failed to write cookies file: {}", e.getMessage());
            return config;
        }
    }
}
