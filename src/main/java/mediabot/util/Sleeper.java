package mediabot.util;

import java.time.Duration;

/** Пауза между попытками. Вынесена в интерфейс, чтобы тесты не спали. */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
