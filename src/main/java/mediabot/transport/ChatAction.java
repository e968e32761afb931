package mediabot.transport;

/** Индикатор "бот что-то делает" в шапке чата. */
public enum ChatAction {

    TYPING("typing"),
    UPLOAD_VIDEO("upload_video"),
    UPLOAD_AUDIO("upload_audio"),
    UPLOAD_DOCUMENT("upload_document");

    private final String wireName;

    ChatAction(String wireName) {
        this.wireName = wireName;
    }

    /** Значение поля action в Bot API */
    public String wireName() {
        return wireName;
    }
}
