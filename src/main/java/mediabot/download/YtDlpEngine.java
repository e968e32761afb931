package mediabot.download;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import mediabot.AppConfig;
import mediabot.error.TransientFetchException;
import mediabot.model.MediaInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Движок на yt-dlp: каждый вызов запускает отдельный процесс.
 *
 * Вызовы блокирующие, поэтому выполняются только из пула
 * {@link mediabot.RequestDispatcher}, а не из потока webhook.
 */
public class YtDlpEngine implements MediaEngine {

    private static final Logger log = LoggerFactory.getLogger(YtDlpEngine.class);

    // [download]  42.3% of   10.00MiB at  1.00MiB/s ETA 00:05
    private static final Pattern PROGRESS = Pattern.compile("^\\[download]\\s+(\\d{1,3}(?:\\.\\d+)?)%");

    private static final String YOUTUBE_WATCH = "https://www.youtube.com/watch?v=";

    // Процесс завершился, но его дочерние процессы могут ещё держать stdout
    private static final long OUTPUT_DRAIN_MILLIS = 5_000;

    private static final String BROWSER_USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) "
            + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private final AppConfig    config;
    private final ObjectMapper json = new ObjectMapper();
    private volatile Boolean   transcoding;   // определяется лениво при первом запросе

    public YtDlpEngine(AppConfig config) {
        this.config = config;
    }

    // ── Метаданные ─────────────────────────────────────────────────────────

    @Override
    public MediaInfo probe(String url) {
        var cmd = baseCommand(true);
        cmd.addAll(List.of("--dump-json", "--skip-download", url));

        String output = runProcess(cmd, "probe", line -> { });
        List<MediaInfo> parsed = parseJsonLines(output);
        if (parsed.isEmpty()) {
            throw new TransientFetchException("yt-dlp returned no metadata for " + url);
        }
        return parsed.get(0);
    }

    @Override
    public List<MediaInfo> search(String query, int limit) {
        var cmd = baseCommand(false);
        cmd.addAll(List.of("--flat-playlist", "--dump-json", "ytsearch%d:%s".formatted(limit, query)));

        String output = runProcess(cmd, "search", line -> { });
        return parseJsonLines(output);
    }

    List<MediaInfo> parseJsonLines(String output) {
        var result = new ArrayList<MediaInfo>();
        for (String line : output.lines().toList()) {
            // stderr смешан со stdout, JSON начинается с '{'
            if (!line.startsWith("{")) continue;
            try {
                result.add(toMediaInfo(json.readTree(line)));
            } catch (IOException e) {
                log.warn("Skipping unparsable yt-dlp line: {}", e.getMessage());
            }
        }
        return result;
    }

    static MediaInfo toMediaInfo(JsonNode root) {
        String title = root.path("title").asText("Unknown");

        String uploader = root.path("uploader").asText("");
        if (uploader.isEmpty()) uploader = root.path("channel").asText("");

        JsonNode durationNode = root.path("duration");
        long duration = durationNode.isNumber()
                ? durationNode.asLong()
                : MediaInfo.UNKNOWN_DURATION;

        String url = root.path("webpage_url").asText("");
        if (url.isEmpty()) url = root.path("url").asText("");
        if (url.isEmpty() && root.hasNonNull("id")) url = YOUTUBE_WATCH + root.get("id").asText();

        return new MediaInfo(title, uploader.isEmpty() ? null : uploader, duration,
                url.isEmpty() ? null : url);
    }

    // ── Загрузка ───────────────────────────────────────────────────────────

    @Override
    public void fetch(String url, FormatDirective directive, String outputTemplate, ProgressListener progress) {
        var cmd = baseCommand(true);
        cmd.addAll(List.of("--newline", "-f", directive.selector()));

        if (directive.extractAudio()) {
            cmd.addAll(List.of(
                    "-x",
                    "--audio-format",  directive.audioCodec(),
                    "--audio-quality", directive.audioQuality(),
                    "--embed-metadata",
                    "--ffmpeg-location", config.ffmpegPath()
            ));
        }
        cmd.addAll(List.of("-o", outputTemplate, url));

        runProcess(cmd, "fetch", line -> {
            Double percent = parseProgress(line);
            if (percent != null) progress.onProgress(percent);
        });
    }

    static Double parseProgress(String line) {
        Matcher m = PROGRESS.matcher(line.strip());
        return m.find() ? Double.valueOf(m.group(1)) : null;
    }

    @Override
    public boolean supportsTranscoding() {
        Boolean cached = transcoding;
        if (cached == null) {
            cached = detectFfmpeg();
            transcoding = cached;
        }
        return cached;
    }

    private boolean detectFfmpeg() {
        try {
            Process p = new ProcessBuilder(config.ffmpegPath(), "-version")
                    .redirectErrorStream(true)
                    .start();
            p.getInputStream().transferTo(OutputStream.nullOutputStream());
            boolean ok = p.waitFor(10, TimeUnit.SECONDS) && p.exitValue() == 0;
            log.info("FFmpeg {}", ok ? "is available" : "not found, audio will not be transcoded");
            return ok;
        } catch (IOException e) {
            log.warn("FFmpeg not found at {}: {}", config.ffmpegPath(), e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ── Вспомогательные методы ─────────────────────────────────────────────

    List<String> baseCommand(boolean singleItem) {
        var cmd = new ArrayList<String>();
        cmd.add(config.ytDlpPath());
        cmd.addAll(List.of(
                "--no-warnings",
                "--no-check-certificate",
                "--force-ipv4",
                "--socket-timeout", "60",
                "--retries", "20",
                "--fragment-retries", "20",
                "--http-chunk-size", "10M",
                // Заголовки обычного браузера: без них часть площадок отвечает 403
                "--add-header", "User-Agent:" + BROWSER_USER_AGENT,
                "--add-header", "Accept:*/*",
                "--add-header", "Accept-Language:en-US,en;q=0.9",
                "--add-header", "Sec-Fetch-Mode:navigate"
        ));
        if (singleItem) cmd.add("--no-playlist");
        if (config.hasCookies()) {
            cmd.add("--cookies");
            cmd.add(config.cookiesFile());
        }
        return cmd;
    }

    /**
     * Вывод читается в отдельном потоке, а таймаут отсчитывает вызывающий.
     * Зависший yt-dlp, который держит stdout открытым, убивается по таймауту.
     */
    private String runProcess(List<String> cmd, String stage, Consumer<String> onLine) {
        log.debug("[{}] Running: {}", stage, String.join(" ", cmd));

        Process process;
        try {
            process = new ProcessBuilder(cmd)
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            throw new TransientFetchException("Cannot start yt-dlp: " + e.getMessage(), e);
        }

        var output    = new StringBuffer();
        var readError = new AtomicReference<IOException>();
        Thread reader = new Thread(() -> {
            try (var in = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = in.readLine()) != null) {
                    output.append(line).append('\n');
                    log.trace("[{}] {}", stage, line);
                    onLine.accept(line);
                }
            } catch (IOException e) {
                readError.set(e);
            }
        }, "yt-dlp-" + stage);
        reader.setDaemon(true);
        reader.start();

        try {
            boolean finished = process.waitFor(config.engineTimeoutSeconds(), TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                reader.join(OUTPUT_DRAIN_MILLIS);
                log.warn("[{}] yt-dlp killed after {} seconds", stage, config.engineTimeoutSeconds());
                throw new TransientFetchException("yt-dlp timed out after %d seconds".formatted(
                        config.engineTimeoutSeconds()));
            }
            reader.join(OUTPUT_DRAIN_MILLIS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new TransientFetchException("Interrupted while waiting for yt-dlp", e);
        }

        if (readError.get() != null) {
            throw new TransientFetchException("Lost yt-dlp output: " + readError.get().getMessage(), readError.get());
        }
        if (process.exitValue() != 0) {
            log.debug("[{}] yt-dlp failed with code {}:\n{}", stage, process.exitValue(), output);
            throw YtDlpErrors.classify(output.toString(), process.exitValue());
        }
        return output.toString().trim();
    }
}
