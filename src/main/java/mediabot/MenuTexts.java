package mediabot;

import mediabot.model.MenuCommand;
import mediabot.transport.Keyboard;

/** Тексты главного меню и справки. */
final class MenuTexts {

    static final String WELCOME = """
            🎉 <b>Добро пожаловать!</b>

            ⚡ <b>Что я умею:</b>

            • <b>Download Video</b>: видео в хорошем качестве (720p)
            • <b>Fast Download</b>: пониже качество, зато быстро
            • <b>HD Video</b>: до 1080p, если влезет в лимит Telegram
            • <b>Audio Only</b>: только звуковая дорожка
            • <b>Search Music</b>: поиск песни по названию или строчке

            <code>Выберите действие ниже 👇</code>""";

    static final String HELP = """
            🛠 <b>Как пользоваться</b>

            1. Выберите режим в меню
            2. Отправьте ссылку (или запрос для поиска)
            3. Дождитесь файла

            🔍 <b>Поиск музыки</b> скачивает первый подходящий результат короче 30 минут.

            💡 <b>Полезно знать:</b>
            • при сбое загрузка автоматически повторяется до трёх раз
            • пустые и битые файлы не отправляются
            • большие видео загружаются дольше
            • лимит Telegram для ботов: 50 MB""";

    private MenuTexts() {
    }

    static Keyboard mainKeyboard() {
        return Keyboard.grid(MenuCommand.buttons().stream().map(MenuCommand::label).toList(), 2);
    }
}
