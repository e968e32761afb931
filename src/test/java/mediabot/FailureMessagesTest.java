package mediabot;

import mediabot.error.AccessDeniedException;
import mediabot.error.EmptyPayloadException;
import mediabot.error.ForbiddenResponseException;
import mediabot.error.NoResultsException;
import mediabot.error.RetryFailedException;
import mediabot.error.TransientFetchException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FailureMessagesTest {

    @Test
    void exhaustionMentionsAttemptCount() {
        String text = FailureMessages.describe(new RetryFailedException(3, new TransientFetchException("timeout")));
        assertTrue(text.contains("(3)"));
    }

    @Test
    void exhaustionByBlockOrEmptyFileNamesTheCause() {
        assertEquals(FailureMessages.describe(new ForbiddenResponseException("403")),
                FailureMessages.describe(new RetryFailedException(3, new ForbiddenResponseException("403"))));
        assertEquals(FailureMessages.describe(new EmptyPayloadException("empty")),
                FailureMessages.describe(new RetryFailedException(3, new EmptyPayloadException("empty"))));
    }

    @Test
    void knownFailuresHaveFixedTexts() {
        assertTrue(FailureMessages.describe(new AccessDeniedException("Private video")).contains("Видео недоступно"));
        assertTrue(FailureMessages.describe(new NoResultsException("q")).contains("Ничего не найдено"));
    }

    @Test
    void unknownFailureIsEscapedAndTruncated() {
        String text = FailureMessages.describe(new IllegalStateException("<boom>" + "x".repeat(500)));

        assertTrue(text.contains("&lt;boom&gt;"));
        assertTrue(text.endsWith("…"));
        assertTrue(text.length() < 250);
    }

    @Test
    void messagelessFailureUsesTypeName() {
        assertTrue(FailureMessages.describe(new NullPointerException()).contains("NullPointerException"));
    }
}
