package mediabot.download.retry;

import mediabot.error.RetryFailedException;
import mediabot.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Выполняет операцию по {@link RetryPolicy}. Повторы синхронные, в том же
 * потоке; между RETRY-попытками поток спит фиксированный backoff.
 *
 * Терминальная ошибка пробрасывается как есть (runtime) или обёрнутой
 * в {@link RetryFailedException} (checked). После исчерпания бюджета
 * бросается {@link RetryFailedException} с последней ошибкой в cause.
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    @FunctionalInterface
    public interface Attempt<T> {
        /** attempt начинается с 1 */
        T run(int attempt) throws Exception;
    }

    @FunctionalInterface
    public interface FailureListener {
        /**
         * Вызывается после каждой неудачной попытки, до паузы.
         * willRetry = false значит, что это была последняя попытка.
         */
        void onFailure(int attempt, Exception error, RetryDecision decision, boolean willRetry);
    }

    private final Sleeper sleeper;

    public RetryExecutor(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    public <T> T execute(RetryPolicy policy, Attempt<T> attempt, FailureListener listener) {
        Exception last = null;

        for (int i = 1; i <= policy.maxAttempts(); i++) {
            try {
                return attempt.run(i);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RetryFailedException(i, e);
            } catch (Exception e) {
                RetryDecision decision = policy.classify(e);
                boolean willRetry = decision != RetryDecision.TERMINAL && i < policy.maxAttempts();
                log.debug("Attempt {}/{} failed ({}): {}",
                        i, policy.maxAttempts(), decision, e.getMessage());

                listener.onFailure(i, e, decision, willRetry);

                if (decision == RetryDecision.TERMINAL) {
                    if (e instanceof RuntimeException) throw (RuntimeException) e;
                    throw new RetryFailedException(i, e);
                }
                last = e;
                if (willRetry && decision == RetryDecision.RETRY) {
                    pause(policy, i);
                }
            }
        }
        throw new RetryFailedException(policy.maxAttempts(), last);
    }

    private void pause(RetryPolicy policy, int attempt) {
        try {
            sleeper.sleep(policy.backoff());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetryFailedException(attempt, e);
        }
    }
}
