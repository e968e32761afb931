package mediabot.download.retry;

public enum RetryDecision {
    /** Подождать backoff и повторить */
    RETRY,
    /** Повторить сразу, но с альтернативными параметрами */
    RETRY_ALTERNATE,
    /** Повторять бессмысленно */
    TERMINAL
}
