package mediabot.model;

/**
 * Неизменяемые параметры одного запроса на загрузку.
 * Создаётся в момент, когда диалог принял ссылку, и дальше только читается.
 */
public record RequestContext(long chatId, String url, Profile profile) {

    public RequestContext {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        if (profile == null) {
            throw new IllegalArgumentException("profile is required");
        }
    }
}
