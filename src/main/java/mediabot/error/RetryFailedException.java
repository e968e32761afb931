package mediabot.error;

/**
 * Бюджет попыток исчерпан. В cause лежит ошибка последней попытки,
 * по ней строится сообщение пользователю.
 */
public class RetryFailedException extends MediaBotException {

    private final int attempts;

    public RetryFailedException(int attempts, Throwable lastError) {
        super("All %d attempts failed".formatted(attempts), lastError);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
