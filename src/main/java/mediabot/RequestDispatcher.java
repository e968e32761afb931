package mediabot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Пул для загрузок. Размер пула и очереди ограничены: если очередь
 * заполнена, новый запрос отклоняется, а не порождает ещё один поток.
 */
public class RequestDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RequestDispatcher.class);

    private final Executor executor;

    public RequestDispatcher(Executor executor) {
        this.executor = executor;
    }

    public static RequestDispatcher bounded(int workers, int queueCapacity) {
        var counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "download-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        var pool = new ThreadPoolExecutor(workers, workers, 60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(queueCapacity), factory, new ThreadPoolExecutor.AbortPolicy());
        return new RequestDispatcher(pool);
    }

    /** false если пул перегружен или остановлен */
    public boolean submit(Runnable task) {
        try {
            executor.execute(task);
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Request rejected, pool is saturated: {}", describe());
            return false;
        }
    }

    public String describe() {
        if (executor instanceof ThreadPoolExecutor) {
            var pool = (ThreadPoolExecutor) executor;
            return "active=%d, queued=%d, workers=%d".formatted(
                    pool.getActiveCount(), pool.getQueue().size(), pool.getMaximumPoolSize());
        }
        return "inline";
    }

    public void shutdown() {
        if (executor instanceof ExecutorService) {
            ((ExecutorService) executor).shutdownNow();
        }
    }
}
