package mediabot.download.retry;

import mediabot.error.AccessDeniedException;
import mediabot.error.ForbiddenResponseException;
import mediabot.error.RetryFailedException;
import mediabot.error.TransientFetchException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryExecutorTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private final RetryExecutor executor = new RetryExecutor(sleeps::add);

    private static RetryPolicy policy(int attempts) {
        return new RetryPolicy(attempts, e -> {
            if (e instanceof AccessDeniedException) return RetryDecision.TERMINAL;
            if (e instanceof ForbiddenResponseException) return RetryDecision.RETRY_ALTERNATE;
            return RetryDecision.RETRY;
        }, Duration.ofSeconds(3));
    }

    @Test
    void returnsFirstSuccessWithoutSleeping() {
        String result = executor.execute(policy(3), attempt -> "ok-" + attempt, (a, e, d, r) -> { });

        assertEquals("ok-1", result);
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void retriesTransientFailuresWithBackoff() {
        var failures = new ArrayList<Integer>();

        String result = executor.execute(policy(3), attempt -> {
            if (attempt < 3) throw new TransientFetchException("timeout " + attempt);
            return "done";
        }, (attempt, error, decision, willRetry) -> failures.add(attempt));

        assertEquals("done", result);
        assertEquals(List.of(1, 2), failures);
        assertEquals(List.of(Duration.ofSeconds(3), Duration.ofSeconds(3)), sleeps);
    }

    @Test
    void alternateRetryDoesNotSleep() {
        var decisions = new ArrayList<RetryDecision>();

        String result = executor.execute(policy(3), attempt -> {
            if (attempt == 1) throw new ForbiddenResponseException("HTTP Error 403");
            return "alt";
        }, (attempt, error, decision, willRetry) -> decisions.add(decision));

        assertEquals("alt", result);
        assertEquals(List.of(RetryDecision.RETRY_ALTERNATE), decisions);
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void terminalFailureStopsImmediately() {
        var calls = new ArrayList<Integer>();
        var denied = new AccessDeniedException("Private video");

        var thrown = assertThrows(AccessDeniedException.class, () ->
                executor.execute(policy(3), attempt -> {
                    calls.add(attempt);
                    throw denied;
                }, (attempt, error, decision, willRetry) -> assertEquals(false, willRetry)));

        assertSame(denied, thrown);
        assertEquals(List.of(1), calls);
    }

    @Test
    void exhaustionReportsAttemptsAndLastCause() {
        var thrown = assertThrows(RetryFailedException.class, () ->
                executor.execute(policy(3), attempt -> {
                    throw new TransientFetchException("failure " + attempt);
                }, (a, e, d, r) -> { }));

        assertEquals(3, thrown.attempts());
        assertEquals("failure 3", thrown.getCause().getMessage());
        // Пауза только между попытками, после последней не спим
        assertEquals(2, sleeps.size());
    }

    @Test
    void lastAttemptIsReportedAsFinal() {
        var flags = new ArrayList<Boolean>();

        assertThrows(RetryFailedException.class, () ->
                executor.execute(policy(2), attempt -> {
                    throw new TransientFetchException("x");
                }, (attempt, error, decision, willRetry) -> flags.add(willRetry)));

        assertEquals(List.of(true, false), flags);
    }

    @Test
    void checkedTerminalFailureIsWrapped() {
        var terminal = new RetryPolicy(3, e -> RetryDecision.TERMINAL, Duration.ZERO);

        var thrown = assertThrows(RetryFailedException.class, () ->
                executor.execute(terminal, attempt -> {
                    throw new IOException("disk full");
                }, (a, e, d, r) -> { }));

        assertInstanceOf(IOException.class, thrown.getCause());
        assertEquals(1, thrown.attempts());
    }

    @Test
    void nullDecisionIsTerminal() {
        var policy = new RetryPolicy(3, e -> null, Duration.ZERO);
        assertEquals(RetryDecision.TERMINAL, policy.classify(new RuntimeException()));
    }

    @Test
    void invalidPolicyIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(0, e -> RetryDecision.RETRY, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(1, e -> RetryDecision.RETRY, Duration.ofSeconds(-1)));
    }
}
