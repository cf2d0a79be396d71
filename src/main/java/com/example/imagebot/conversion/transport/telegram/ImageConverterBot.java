package com.example.imagebot.conversion.transport.telegram;

import com.example.imagebot.conversion.controller.ConversionChatController;
import com.example.imagebot.conversion.transport.ChatUpdateDispatcher;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Document;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.PhotoSize;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

@Slf4j
public class ImageConverterBot extends TelegramLongPollingBot {

    private final String botUsername;
    private final ConversionChatController controller;
    private final ChatUpdateDispatcher dispatcher;

    public ImageConverterBot(String botToken, String botUsername, ConversionChatController controller,
            ChatUpdateDispatcher dispatcher) {
        super(botToken);
        this.botUsername = botUsername;
        this.controller = controller;
        this.dispatcher = dispatcher;
    }

    @Override
    public String getBotUsername() {
        return botUsername;
    }

    @Override
    public void onUpdateReceived(Update update) {
        if (update.hasCallbackQuery()) {
            CallbackQuery query = update.getCallbackQuery();
            long chatId = query.getMessage().getChatId();
            dispatcher.submit(chatId, () -> controller.onFormatChoice(chatId, query.getData(),
                    () -> answerCallback(query.getId())));
            return;
        }
        if (!update.hasMessage()) {
            return;
        }

        Message message = update.getMessage();
        long chatId = message.getChatId();
        if (message.hasText() && message.getText().startsWith("/")) {
            long requesterId = message.getFrom() != null ? message.getFrom().getId() : chatId;
            dispatcher.submit(chatId, () -> handleCommand(chatId, requesterId, message.getText()));
        } else if (message.hasPhoto()) {
            List<PhotoSize> sizes = message.getPhoto();
            PhotoSize largest = sizes.get(sizes.size() - 1);
            dispatcher.submit(chatId, () -> controller.onImage(chatId, largest.getFileId(),
                    largest.getFileUniqueId(), sizeOf(largest.getFileSize())));
        } else if (message.hasDocument()) {
            Document document = message.getDocument();
            dispatcher.submit(chatId, () -> controller.onDocument(chatId, document.getMimeType(),
                    document.getFileName(), document.getFileId(), sizeOf(document.getFileSize())));
        }
    }

    private void handleCommand(long chatId, long requesterId, String text) {
        String[] parts = text.trim().split("\\s+");
        String command = parts[0].toLowerCase(Locale.ROOT);
        int mention = command.indexOf('@');
        if (mention > 0) {
            command = command.substring(0, mention);
        }
        switch (command) {
            case "/start" -> controller.onStart(chatId);
            case "/help" -> controller.onHelp(chatId);
            case "/stats" -> controller.onStats(chatId, requesterId, parts.length > 1 ? parts[1] : null);
            default -> log.debug("Ignoring unknown command {} in chat={}", command, chatId);
        }
    }

    private void answerCallback(String callbackQueryId) {
        try {
            execute(AnswerCallbackQuery.builder().callbackQueryId(callbackQueryId).build());
        } catch (TelegramApiException ex) {
            log.warn("Could not answer callback query {}: {}", callbackQueryId, ex.getMessage());
        }
    }

    private static long sizeOf(Number fileSize) {
        return fileSize == null ? 0 : fileSize.longValue();
    }
}
