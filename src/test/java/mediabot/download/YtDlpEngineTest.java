package mediabot.download;

import mediabot.error.AccessDeniedException;
import mediabot.error.TransientFetchException;
import mediabot.model.MediaInfo;
import mediabot.testing.TestConfigs;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

class YtDlpEngineTest {

    @TempDir
    Path storage;

    @Test
    void parsesMetadataLinesAndSkipsNoise() {
        var engine = new YtDlpEngine(TestConfigs.forStorage(storage));
        String output = """
                WARNING: something
                {"title":"Song A","uploader":"Artist","duration":200,"webpage_url":"https://www.youtube.com/watch?v=a"}
                {"title":"Song B","channel":"Channel B","id":"bbb"}
                {broken json
                """;

        List<MediaInfo> infos = engine.parseJsonLines(output);

        assertEquals(2, infos.size());
        assertEquals(new MediaInfo("Song A", "Artist", 200, "https://www.youtube.com/watch?v=a"), infos.get(0));

        MediaInfo second = infos.get(1);
        assertEquals("Channel B", second.uploader());
        assertEquals("https://www.youtube.com/watch?v=bbb", second.webpageUrl());
        assertFalse(second.hasDuration());
    }

    @Test
    void flatSearchEntryFallsBackToUrl() {
        var engine = new YtDlpEngine(TestConfigs.forStorage(storage));

        MediaInfo info = engine.parseJsonLines(
                "{\"title\":\"X\",\"url\":\"https://youtu.be/x\",\"duration\":61.0}").get(0);

        assertEquals("https://youtu.be/x", info.webpageUrl());
        assertEquals(61, info.durationSeconds());
        assertNull(info.uploader());
    }

    @Test
    void parsesDownloadProgress() {
        assertEquals(42.5, YtDlpEngine.parseProgress("[download]  42.5% of 3.45MiB at 1.2MiB/s ETA 00:02"));
        assertEquals(100.0, YtDlpEngine.parseProgress("[download] 100% of 3.45MiB"));
        assertNull(YtDlpEngine.parseProgress("[download] Destination: /tmp/x.mp4"));
        assertNull(YtDlpEngine.parseProgress("[ExtractAudio] Destination: x.mp3"));
    }

    @Test
    void commandCarriesBrowserHeadersAndChunking() {
        var engine = new YtDlpEngine(TestConfigs.forStorage(storage, Map.of("YT_DLP_PATH", "/opt/yt-dlp")));

        List<String> cmd = engine.baseCommand(true);

        assertEquals("/opt/yt-dlp", cmd.get(0));
        assertEquals("10M", cmd.get(cmd.indexOf("--http-chunk-size") + 1));
        assertTrue(cmd.stream().anyMatch(a -> a.startsWith("User-Agent:Mozilla/5.0")));
        assertTrue(cmd.contains("Accept-Language:en-US,en;q=0.9"));
        assertTrue(cmd.contains("--no-playlist"));
        assertFalse(engine.baseCommand(false).contains("--no-playlist"));
    }

    // ── Запуск процесса: вместо yt-dlp подставляется shell-скрипт ──────────

    private YtDlpEngine engineRunning(String script, int timeoutSeconds) throws Exception {
        Path binary = Files.writeString(storage.resolve("fake-yt-dlp.sh"), "#!/bin/sh\n" + script + "\n");
        assertTrue(binary.toFile().setExecutable(true));
        return new YtDlpEngine(TestConfigs.forStorage(storage, Map.of(
                "YT_DLP_PATH", binary.toString(),
                "ENGINE_TIMEOUT_SECONDS", String.valueOf(timeoutSeconds))));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void hungProcessIsKilledAfterTimeout() throws Exception {
        var engine = engineRunning("echo '[youtube] Extracting URL'\nexec sleep 30", 1);

        var error = assertTimeoutPreemptively(Duration.ofSeconds(15),
                () -> assertThrows(TransientFetchException.class, () -> engine.probe("https://youtu.be/x")));

        assertTrue(error.getMessage().contains("timed out after 1 seconds"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void probeReadsMetadataFromProcessOutput() throws Exception {
        var engine = engineRunning(
                "echo 'WARNING: noise'\necho '{\"title\":\"Live\",\"uploader\":\"Band\",\"duration\":90}'", 10);

        MediaInfo info = engine.probe("https://youtu.be/x");

        assertEquals("Live", info.title());
        assertEquals("Band", info.uploader());
        assertEquals(90, info.durationSeconds());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void fetchReportsProgressLines() throws Exception {
        var engine = engineRunning(
                "echo '[download]  12.5% of 1.00MiB'\necho '[download] 100% of 1.00MiB'", 10);
        var seen = new CopyOnWriteArrayList<Double>();

        engine.fetch("https://youtu.be/x", FormatDirective.video("best"), "out.%(ext)s", seen::add);

        assertEquals(List.of(12.5, 100.0), seen);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void failedProcessIsClassifiedFromItsOutput() throws Exception {
        var engine = engineRunning("echo 'ERROR: [youtube] x: Private video' >&2\nexit 1", 10);

        assertThrows(AccessDeniedException.class, () -> engine.probe("https://youtu.be/x"));
    }
}
