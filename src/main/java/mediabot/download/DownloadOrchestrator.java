package mediabot.download;

import mediabot.AppConfig;
import mediabot.download.retry.RetryDecision;
import mediabot.download.retry.RetryExecutor;
import mediabot.download.retry.RetryPolicy;
import mediabot.error.AccessDeniedException;
import mediabot.error.EmptyPayloadException;
import mediabot.error.ForbiddenResponseException;
import mediabot.error.UnsupportedUrlException;
import mediabot.model.DownloadAttempt;
import mediabot.model.FetchResult;
import mediabot.model.MediaInfo;
import mediabot.model.RequestContext;
import mediabot.model.StoredPayload;
import mediabot.util.MediaFormatting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ядро загрузки: probe → fetch → поиск файла → проверка, с повторами.
 *
 * Токен создаётся один раз на весь набор попыток, чтобы очистка после
 * любой неудачной попытки находила её недокачанные файлы. Перед каждой
 * следующей попыткой все файлы токена удаляются, иначе поиск файла мог
 * бы подобрать мусор от предыдущей.
 */
public class DownloadOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DownloadOrchestrator.class);

    private final Path             storageDir;
    private final MediaEngine      engine;
    private final PayloadLocator   locator;
    private final RetryExecutor    retry;
    private final RetryPolicy      policy;
    private final UniquenessTokens tokens;
    private final ProgressNotifier progress;

    public DownloadOrchestrator(AppConfig config, MediaEngine engine, PayloadLocator locator,
                                RetryExecutor retry, UniquenessTokens tokens, ProgressNotifier progress) {
        this.storageDir = config.storageDir();
        this.engine     = engine;
        this.locator    = locator;
        this.retry      = retry;
        this.tokens     = tokens;
        this.progress   = progress;
        this.policy     = new RetryPolicy(config.maxAttempts(),
                DownloadOrchestrator::classify, config.retryBackoff());
    }

    /** 403 лечится другим форматом, недоступный контент не лечится ничем */
    public static RetryDecision classify(Throwable error) {
        if (error instanceof AccessDeniedException || error instanceof UnsupportedUrlException) {
            return RetryDecision.TERMINAL;
        }
        if (error instanceof ForbiddenResponseException) {
            return RetryDecision.RETRY_ALTERNATE;
        }
        return RetryDecision.RETRY;
    }

    public FetchResult fetch(RequestContext ctx) {
        String token = tokens.next(ctx.chatId());
        String template = storageDir.resolve(
                UniquenessTokens.filePrefix(token) + "%(title).80s.%(ext)s").toString();
        List<FormatDirective> directives =
                FormatSelector.directivesFor(ctx.profile(), engine.supportsTranscoding());
        AtomicInteger variant = new AtomicInteger();

        log.info("Fetch started: chatId={}, url={}, profile={}, token={}",
                ctx.chatId(), ctx.url(), ctx.profile(), token);

        try {
            return retry.execute(policy,
                    attempt -> runAttempt(ctx, token, template,
                            FormatSelector.pick(directives, variant.get()), attempt),
                    (attempt, error, decision, willRetry) -> {
                        var record = new DownloadAttempt(attempt,
                                FormatSelector.pick(directives, variant.get()).toString(),
                                null, 0, outcomeOf(error));
                        log.warn("Attempt failed: chatId={}, {}, decision={}, cause={}",
                                ctx.chatId(), record, decision, error.getMessage());

                        locator.purge(token);
                        if (decision == RetryDecision.RETRY_ALTERNATE) variant.incrementAndGet();
                    });
        } catch (RuntimeException e) {
            locator.purge(token);
            throw e;
        }
    }

    private FetchResult runAttempt(RequestContext ctx, String token, String template,
                                   FormatDirective directive, int attempt) throws Exception {
        long chatId = ctx.chatId();
        if (attempt == 1) {
            progress.phase(chatId, "🔍 <b>Начинаю загрузку...</b>");
        } else {
            progress.phase(chatId, "🔄 Повторная попытка %d/%d...".formatted(attempt, policy.maxAttempts()));
        }

        // Сначала проверяем, что контент вообще доступен
        MediaInfo info = engine.probe(ctx.url());
        progress.phase(chatId, "📥 <b>Загружаю:</b> %s\n⏱ <b>Длительность:</b> %s".formatted(
                MediaFormatting.escapeHtml(info.safeTitle()), info.formattedDuration()));

        Files.createDirectories(storageDir);
        log.debug("Attempt {} for token {} with format {}", attempt, token, directive);
        engine.fetch(ctx.url(), directive, template, progress.forRequest(ctx));

        StoredPayload payload = locator.locate(token)
                .orElseThrow(() -> new EmptyPayloadException("Download completed but no valid file found"));

        var record = new DownloadAttempt(attempt, directive.toString(),
                payload.path(), payload.sizeBytes(), DownloadAttempt.Outcome.SUCCESS);
        log.info("Fetch succeeded: chatId={}, {}", chatId, record);
        return new FetchResult(info, payload);
    }

    private static DownloadAttempt.Outcome outcomeOf(Throwable error) {
        if (error instanceof AccessDeniedException)      return DownloadAttempt.Outcome.UNAVAILABLE;
        if (error instanceof ForbiddenResponseException) return DownloadAttempt.Outcome.FORBIDDEN;
        if (error instanceof EmptyPayloadException)      return DownloadAttempt.Outcome.EMPTY_PAYLOAD;
        return DownloadAttempt.Outcome.TRANSIENT;
    }
}
