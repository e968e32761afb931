package mediabot;

import mediabot.download.MediaEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;
import java.util.stream.Stream;

/** Ответ на кнопку "📊 Status". */
public class StatusReport implements Supplier<String> {

    private static final Logger log = LoggerFactory.getLogger(StatusReport.class);

    private final RequestDispatcher dispatcher;
    private final MediaEngine       engine;
    private final Path              storageDir;

    public StatusReport(RequestDispatcher dispatcher, MediaEngine engine, Path storageDir) {
        this.dispatcher = dispatcher;
        this.engine     = engine;
        this.storageDir = storageDir;
    }

    @Override
    public String get() {
        return """
                📊 <b>Состояние</b>

                ⚙️ <b>Загрузки:</b> %s
                📁 <b>Файлов во временной папке:</b> %s
                🎛 <b>Перекодирование (ffmpeg):</b> %s

                🌐 <b>Платформы:</b> %s""".formatted(
                dispatcher.describe(),
                storageEntries(),
                engine.supportsTranscoding() ? "доступно" : "нет",
                UrlValidator.SUPPORTED_PLATFORMS);
    }

    private String storageEntries() {
        if (!Files.isDirectory(storageDir)) return "0";
        try (Stream<Path> files = Files.list(storageDir)) {
            return String.valueOf(files.count());
        } catch (IOException e) {
            log.warn("Cannot list {}: {}", storageDir, e.getMessage());
            return "?";
        }
    }
}
