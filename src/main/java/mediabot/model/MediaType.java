package mediabot.model;

/** Что именно пользователь хочет получить: видео целиком или только звук. */
public enum MediaType {
    VIDEO,
    AUDIO
}
