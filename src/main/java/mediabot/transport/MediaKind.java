package mediabot.transport;

/** Канал отправки файла. DOCUMENT подходит для всего и служит запасным. */
public enum MediaKind {
    VIDEO,
    AUDIO,
    DOCUMENT
}
