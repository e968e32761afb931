package mediabot;

import mediabot.delivery.DeliveryOutcome;
import mediabot.delivery.DeliveryService;
import mediabot.download.DownloadOrchestrator;
import mediabot.model.FetchResult;
import mediabot.model.RequestContext;

/** Загрузка и доставка одним вызовом. Общий путь для ссылки и поиска. */
public class MediaPipeline {

    private final DownloadOrchestrator orchestrator;
    private final DeliveryService      delivery;

    public MediaPipeline(DownloadOrchestrator orchestrator, DeliveryService delivery) {
        this.orchestrator = orchestrator;
        this.delivery     = delivery;
    }

    public DeliveryOutcome process(RequestContext ctx) {
        FetchResult result = orchestrator.fetch(ctx);
        return delivery.deliver(ctx, result.info(), result.payload());
    }
}
