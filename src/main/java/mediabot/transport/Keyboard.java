package mediabot.transport;

import java.util.ArrayList;
import java.util.List;

/**
 * Reply-клавиатура в терминах ядра: строки кнопок или команда убрать
 * клавиатуру. TelegramClient переводит её в ReplyKeyboardMarkup.
 */
public record Keyboard(List<List<String>> rows, boolean removeKeyboard) {

    public Keyboard {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static Keyboard of(List<List<String>> rows) {
        return new Keyboard(rows, false);
    }

    public static Keyboard remove() {
        return new Keyboard(List.of(), true);
    }

    /** Раскладывает кнопки по строкам заданной ширины */
    public static Keyboard grid(List<String> labels, int columns) {
        var rows = new ArrayList<List<String>>();
        for (int i = 0; i < labels.size(); i += columns) {
            rows.add(List.copyOf(labels.subList(i, Math.min(i + columns, labels.size()))));
        }
        return of(rows);
    }
}
