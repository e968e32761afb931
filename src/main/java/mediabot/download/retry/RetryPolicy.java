package mediabot.download.retry;

import java.time.Duration;
import java.util.function.Function;

/**
 * Политика повторов: сколько попыток, какую ошибку повторять и
 * сколько ждать между попытками. Backoff фиксированный.
 */
public record RetryPolicy(
        int                                  maxAttempts,
        Function<Throwable, RetryDecision>   classifier,
        Duration                             backoff
) {
    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (classifier == null) throw new IllegalArgumentException("classifier is required");
        if (backoff == null || backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must be non-negative");
        }
    }

    public RetryDecision classify(Throwable error) {
        RetryDecision decision = classifier.apply(error);
        return decision == null ? RetryDecision.TERMINAL : decision;
    }
}
