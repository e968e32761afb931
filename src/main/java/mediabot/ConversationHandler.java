package mediabot;

import mediabot.model.ConversationState;
import mediabot.model.MenuCommand;
import mediabot.model.Profile;
import mediabot.model.RequestContext;
import mediabot.search.SearchService;
import mediabot.transport.ChatTransport;
import mediabot.transport.Keyboard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Машина состояний диалога.
 *
 * IDLE + выбор профиля → AWAITING_URL, ссылка → PROCESSING → IDLE.
 * IDLE + поиск → AWAITING_SEARCH_QUERY, запрос → PROCESSING → IDLE.
 *
 * Ввод в режиме ожидания одноразовый: неверная ссылка не вызывает
 * повторный запрос, а возвращает в главное меню. PROCESSING снимается
 * в finally задачи, иначе пользователь навсегда застрянет. Остальные
 * записи в хранилище никогда не затирают PROCESSING, даже если два
 * update одного чата обрабатываются параллельно.
 */
public class ConversationHandler {

    private static final Logger log = LoggerFactory.getLogger(ConversationHandler.class);

    static final String BUSY        = "⏳ <b>Запрос уже обрабатывается</b>, подождите.";
    static final String OVERLOAD    = "⏳ <b>Сервер перегружен</b>, попробуйте через пару минут.";
    static final String SHORT_QUERY = "❌ <b>Введите хотя бы 2 символа</b>";

    private final ConversationStore store;
    private final ChatTransport     chat;
    private final UrlValidator      validator;
    private final RequestDispatcher dispatcher;
    private final MediaPipeline     pipeline;
    private final SearchService     search;
    private final Supplier<String>  statusReport;

    public ConversationHandler(ConversationStore store, ChatTransport chat, UrlValidator validator,
                               RequestDispatcher dispatcher, MediaPipeline pipeline,
                               SearchService search, Supplier<String> statusReport) {
        this.store        = store;
        this.chat         = chat;
        this.validator    = validator;
        this.dispatcher   = dispatcher;
        this.pipeline     = pipeline;
        this.search       = search;
        this.statusReport = statusReport;
    }

    /** Точка входа для любого текстового сообщения */
    public void onText(long chatId, String rawText) {
        String text = rawText == null ? "" : rawText.strip();
        Optional<MenuCommand> command = MenuCommand.classify(text);
        ConversationState state = store.get(chatId);

        log.debug("chatId={} state={} command={}", chatId, state.mode(), command.orElse(null));

        if (state.isProcessing()) {
            onTextWhileProcessing(chatId, command);
            return;
        }
        if (command.isPresent()) {
            onCommand(chatId, command.get());
            return;
        }
        switch (state.mode()) {
            case AWAITING_URL          -> acceptUrl(chatId, state, text);
            case AWAITING_SEARCH_QUERY -> acceptQuery(chatId, state, text);
            default                    -> showMainMenu(chatId);
        }
    }

    // ── Команды меню ───────────────────────────────────────────────────────

    private void onCommand(long chatId, MenuCommand command) {
        if (command.selectsProfile()) {
            if (!store.putUnlessProcessing(chatId, ConversationState.awaitingUrl(command.profile()))) {
                chat.sendMessage(chatId, BUSY);
                return;
            }
            chat.sendMessage(chatId, urlPrompt(command.profile()), Keyboard.remove());
            return;
        }
        switch (command) {
            case SEARCH_MUSIC -> {
                if (!store.putUnlessProcessing(chatId, ConversationState.awaitingSearchQuery())) {
                    chat.sendMessage(chatId, BUSY);
                    return;
                }
                chat.sendMessage(chatId, "🎵 <b>Поиск музыки</b>\n\nОтправьте название песни или строчку из текста:",
                        Keyboard.remove());
            }
            case STATUS -> chat.sendMessage(chatId, statusReport.get());
            case HELP   -> chat.sendMessage(chatId, MenuTexts.HELP);
            default     -> showMainMenu(chatId);
        }
    }

    private void onTextWhileProcessing(long chatId, Optional<MenuCommand> command) {
        if (command.isPresent() && command.get() == MenuCommand.STATUS) {
            chat.sendMessage(chatId, statusReport.get());
        } else if (command.isPresent() && command.get() == MenuCommand.HELP) {
            chat.sendMessage(chatId, MenuTexts.HELP);
        } else {
            chat.sendMessage(chatId, BUSY);
        }
    }

    // ── Ожидаемый ввод ─────────────────────────────────────────────────────

    private void acceptUrl(long chatId, ConversationState state, String text) {
        if (!validator.isSupportedUrl(text)) {
            chat.sendMessage(chatId, FailureMessages.UNSUPPORTED_URL);
            showMainMenu(chatId);
            return;
        }
        var ctx = new RequestContext(chatId, UrlValidator.normalize(text), state.profile());
        dispatch(chatId, state, "🚀 <b>Начинаю загрузку с проверкой файла...</b>",
                () -> pipeline.process(ctx));
    }

    private void acceptQuery(long chatId, ConversationState state, String query) {
        if (query.length() < 2) {
            chat.sendMessage(chatId, SHORT_QUERY);
            showMainMenu(chatId);
            return;
        }
        dispatch(chatId, state, null, () -> search.searchAndDownload(chatId, query));
    }

    /**
     * Переводит диалог в PROCESSING и отдаёт задачу в пул.
     * Пока задача не принята пулом, PROCESSING снимает finally этого
     * метода; после приёма его снимает сама задача.
     */
    private void dispatch(long chatId, ConversationState expected, String ack, Runnable work) {
        if (!store.transition(chatId, expected, ConversationState.processing())) {
            log.debug("State of chatId={} changed concurrently, showing menu", chatId);
            showMainMenu(chatId);
            return;
        }

        boolean accepted = false;
        try {
            if (ack != null) chat.sendMessage(chatId, ack);
            accepted = dispatcher.submit(() -> runGuarded(chatId, work));
            if (!accepted) chat.sendMessage(chatId, OVERLOAD);
        } finally {
            if (!accepted) {
                store.reset(chatId);
                showMainMenuQuietly(chatId);
            }
        }
    }

    private void runGuarded(long chatId, Runnable work) {
        try {
            work.run();
        } catch (Exception e) {
            log.error("Request failed for chatId={}: {}", chatId, e.getMessage(), e);
            chat.sendMessage(chatId, FailureMessages.describe(e));
        } finally {
            store.reset(chatId);
            showMainMenuQuietly(chatId);
        }
    }

    // ── Меню ───────────────────────────────────────────────────────────────

    /**
     * Главное меню возвращает диалог в IDLE. Если в этот момент по чату
     * уже идёт задача, меню не показывается и отвечаем BUSY.
     */
    public void showMainMenu(long chatId) {
        if (!store.resetUnlessProcessing(chatId)) {
            chat.sendMessage(chatId, BUSY);
            return;
        }
        chat.sendMessage(chatId, MenuTexts.WELCOME, MenuTexts.mainKeyboard());
    }

    private void showMainMenuQuietly(long chatId) {
        try {
            showMainMenu(chatId);
        } catch (RuntimeException e) {
            log.warn("Could not render menu for chatId={}: {}", chatId, e.getMessage());
        }
    }

    private static String urlPrompt(Profile profile) {
        return """
                📋 <b>%s</b>

                🔗 <b>Отправьте ссылку на видео</b>

                🌐 <b>Поддерживаются:</b>
                %s

                <code>Вставьте ссылку ниже...</code>""".formatted(profile.description(), UrlValidator.SUPPORTED_PLATFORMS);
    }
}
