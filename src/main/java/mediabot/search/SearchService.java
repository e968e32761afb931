package mediabot.search;

import mediabot.AppConfig;
import mediabot.MediaPipeline;
import mediabot.delivery.DeliveryOutcome;
import mediabot.download.MediaEngine;
import mediabot.error.NoResultsException;
import mediabot.model.MediaInfo;
import mediabot.model.Profile;
import mediabot.model.RequestContext;
import mediabot.transport.ChatAction;
import mediabot.transport.ChatTransport;
import mediabot.util.MediaFormatting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Поиск музыки по тексту. Показывает найденное и сразу качает первый
 * результат как аудио, выбирать из списка пользователю не даём.
 */
public class SearchService {

    private static final Logger log = LoggerFactory.getLogger(SearchService.class);

    private final MediaEngine   engine;
    private final MediaPipeline pipeline;
    private final ChatTransport chat;
    private final int           resultLimit;
    private final long          maxDurationSeconds;

    public SearchService(AppConfig config, MediaEngine engine, MediaPipeline pipeline, ChatTransport chat) {
        this.engine             = engine;
        this.pipeline           = pipeline;
        this.chat               = chat;
        this.resultLimit        = config.searchResultLimit();
        this.maxDurationSeconds = config.searchMaxDurationSeconds();
    }

    /**
     * Кандидаты без длительности и длиннее лимита отбрасываются:
     * это обычно стримы и многочасовые сборники.
     */
    public List<MediaInfo> search(String query) {
        List<MediaInfo> candidates = engine.search(query, resultLimit).stream()
                .filter(MediaInfo::hasDuration)
                .filter(c -> c.durationSeconds() < maxDurationSeconds)
                .filter(c -> c.webpageUrl() != null)
                .limit(resultLimit)
                .toList();

        log.info("Search '{}' returned {} usable candidate(s)", query, candidates.size());
        if (candidates.isEmpty()) {
            throw new NoResultsException("No results for query: " + query);
        }
        return candidates;
    }

    public DeliveryOutcome searchAndDownload(long chatId, String query) {
        chat.sendMessage(chatId, "🔍 <b>Ищу:</b> <code>%s</code>".formatted(MediaFormatting.escapeHtml(query)));
        chat.sendChatAction(chatId, ChatAction.TYPING);

        List<MediaInfo> results = search(query);
        chat.sendMessage(chatId, renderResults(results));

        MediaInfo first = results.get(0);
        return pipeline.process(new RequestContext(chatId, first.webpageUrl(), Profile.AUDIO));
    }

    static String renderResults(List<MediaInfo> results) {
        var sb = new StringBuilder("🎵 <b>Лучшие результаты:</b>\n\n");
        for (int i = 0; i < results.size(); i++) {
            MediaInfo r = results.get(i);
            sb.append(i + 1).append(". ").append(MediaFormatting.escapeHtml(r.safeTitle())).append('\n')
              .append("   ⏱ ").append(r.formattedDuration()).append("\n\n");
        }
        sb.append("⬇️ <b>Скачиваю первый результат...</b>");
        return sb.toString();
    }
}
