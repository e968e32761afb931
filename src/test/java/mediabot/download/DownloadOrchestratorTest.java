package mediabot.download;

import mediabot.AppConfig;
import mediabot.download.retry.RetryDecision;
import mediabot.download.retry.RetryExecutor;
import mediabot.error.AccessDeniedException;
import mediabot.error.EmptyPayloadException;
import mediabot.error.ForbiddenResponseException;
import mediabot.error.RetryFailedException;
import mediabot.error.TransientFetchException;
import mediabot.error.UnsupportedUrlException;
import mediabot.model.FetchResult;
import mediabot.model.Profile;
import mediabot.model.RequestContext;
import mediabot.testing.FakeChatTransport;
import mediabot.testing.FakeMediaEngine;
import mediabot.testing.TestConfigs;
import mediabot.transport.ChatAction;
import mediabot.util.Sleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DownloadOrchestratorTest {

    private static final String URL = "https://www.youtube.com/watch?v=abc";

    @TempDir
    Path storage;

    private final FakeMediaEngine   engine = new FakeMediaEngine();
    private final FakeChatTransport chat   = new FakeChatTransport();
    private final List<Duration>    sleeps = new ArrayList<>();

    private DownloadOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        AppConfig config = TestConfigs.forStorage(storage, Map.of("RETRY_BACKOFF_SECONDS", "3"));
        Sleeper recording = sleeps::add;
        var locator = new PayloadLocator(storage, config.minPayloadBytes(), Duration.ZERO, d -> { });
        orchestrator = new DownloadOrchestrator(config, engine, locator, new RetryExecutor(recording),
                new UniquenessTokens(Clock.systemUTC()), new ProgressNotifier(chat, 1.0, () -> 0.0));
    }

    private static RequestContext request(Profile profile) {
        return new RequestContext(42, URL, profile);
    }

    private List<Path> storedFiles() throws Exception {
        try (Stream<Path> files = Files.list(storage)) {
            return files.toList();
        }
    }

    @Test
    void successfulFetchReturnsSingleVerifiedFile() throws Exception {
        FetchResult result = orchestrator.fetch(request(Profile.AUDIO));

        assertEquals("Test Song", result.info().title());
        assertEquals(5000, result.payload().sizeBytes());
        assertEquals(List.of(result.payload().path()), storedFiles());
        assertTrue(result.payload().path().getFileName().toString().startsWith(result.payload().token() + "_"));
        assertEquals(1, engine.probeCalls.get());
        assertTrue(chat.actions.contains(ChatAction.UPLOAD_AUDIO));
    }

    @Test
    void unavailableContentIsNotRetried() throws Exception {
        engine.failNextProbe(new AccessDeniedException("Private video"));

        assertThrows(AccessDeniedException.class, () -> orchestrator.fetch(request(Profile.VIDEO_BEST)));

        assertEquals(1, engine.probeCalls.get());
        assertEquals(0, engine.fetchCalls());
        assertTrue(sleeps.isEmpty());
        assertTrue(storedFiles().isEmpty());
    }

    @Test
    void transientFailuresAreRetriedAndPartialsPurged() throws Exception {
        engine.failNextFetch(new TransientFetchException("Read timed out"), 2000)
              .failNextFetch(new TransientFetchException("Connection reset"), 3000);

        FetchResult result = orchestrator.fetch(request(Profile.VIDEO_BEST));

        assertEquals(3, engine.fetchCalls());
        assertEquals(List.of(result.payload().path()), storedFiles());
        assertEquals(List.of(Duration.ofSeconds(3), Duration.ofSeconds(3)), sleeps);
        assertTrue(chat.anyTextContains(42, "Повторная попытка 3/3"));
    }

    @Test
    void forbiddenSwitchesToAlternateFormatWithoutWaiting() {
        engine.failNextFetch(new ForbiddenResponseException("HTTP Error 403: Forbidden"), 0);

        orchestrator.fetch(request(Profile.VIDEO_FAST));

        List<FormatDirective> expected = FormatSelector.directivesFor(Profile.VIDEO_FAST, true);
        assertEquals(2, engine.fetchCalls());
        assertEquals(expected.get(0), engine.fetches.get(0).directive());
        assertEquals(expected.get(1), engine.fetches.get(1).directive());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void undersizedResultCountsAsFailedAttempt() throws Exception {
        engine.nextFetchWrites(1024).nextFetchWrites(10);

        FetchResult result = orchestrator.fetch(request(Profile.AUDIO));

        assertEquals(3, engine.fetchCalls());
        assertEquals(5000, result.payload().sizeBytes());
        assertEquals(1, storedFiles().size());
    }

    @Test
    void exhaustedBudgetLeavesNothingBehind() throws Exception {
        engine.failNextFetch(new TransientFetchException("a"), 500)
              .failNextFetch(new TransientFetchException("b"), 500)
              .failNextFetch(new TransientFetchException("c"), 500);

        var e = assertThrows(RetryFailedException.class, () -> orchestrator.fetch(request(Profile.AUDIO)));

        assertEquals(3, e.attempts());
        assertEquals("c", e.getCause().getMessage());
        assertTrue(storedFiles().isEmpty());
    }

    @Test
    void partOnlyOutputIsEmptyPayload() throws Exception {
        engine.nextFetchLeavesPartOnly(9000)
              .nextFetchLeavesPartOnly(9000)
              .nextFetchLeavesPartOnly(9000);

        var e = assertThrows(RetryFailedException.class, () -> orchestrator.fetch(request(Profile.AUDIO)));

        assertInstanceOf(EmptyPayloadException.class, e.getCause());
        assertTrue(storedFiles().isEmpty());
    }

    @Test
    void sequentialRequestsUseDistinctTokens() {
        FetchResult first  = orchestrator.fetch(request(Profile.AUDIO));
        FetchResult second = orchestrator.fetch(request(Profile.AUDIO));

        assertNotEquals(first.payload().token(), second.payload().token());
        assertNotEquals(first.payload().path(), second.payload().path());
    }

    @Test
    void classification() {
        assertEquals(RetryDecision.TERMINAL, DownloadOrchestrator.classify(new AccessDeniedException("x")));
        assertEquals(RetryDecision.TERMINAL, DownloadOrchestrator.classify(new UnsupportedUrlException("x")));
        assertEquals(RetryDecision.RETRY_ALTERNATE,
                DownloadOrchestrator.classify(new ForbiddenResponseException("x")));
        assertEquals(RetryDecision.RETRY, DownloadOrchestrator.classify(new EmptyPayloadException("x")));
        assertEquals(RetryDecision.RETRY, DownloadOrchestrator.classify(new IllegalStateException("x")));
    }
}
