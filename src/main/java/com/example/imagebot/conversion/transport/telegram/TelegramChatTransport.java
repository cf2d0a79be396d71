package com.example.imagebot.conversion.transport.telegram;

import com.example.imagebot.conversion.model.FormatChoice;
import com.example.imagebot.conversion.model.StatusHandle;
import com.example.imagebot.conversion.support.TempFileStorage;
import com.example.imagebot.conversion.support.TransportException;
import com.example.imagebot.conversion.transport.ChatTransport;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.telegram.telegrambots.meta.api.methods.GetFile;
import org.telegram.telegrambots.meta.api.methods.send.SendDocument;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.InputFile;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

@Slf4j
public class TelegramChatTransport implements ChatTransport {

    private final TelegramSender sender;
    private final TempFileStorage storage;

    public TelegramChatTransport(TelegramSender sender, TempFileStorage storage) {
        this.sender = sender;
        this.storage = storage;
    }

    @Override
    public void sendText(long userId, String text) {
        try {
            sender.execute(SendMessage.builder()
                    .chatId(Long.toString(userId))
                    .text(text)
                    .build());
        } catch (TelegramApiException ex) {
            throw new TransportException("Failed to send message to chat %d".formatted(userId), ex);
        }
    }

    @Override
    public StatusHandle sendOrEditStatus(long userId, StatusHandle handle, String text,
            List<List<FormatChoice>> choices) {
        if (handle != null) {
            try {
                sender.execute(EditMessageText.builder()
                        .chatId(Long.toString(handle.chatId()))
                        .messageId(handle.messageId())
                        .text(text)
                        .replyMarkup(toKeyboard(choices))
                        .build());
                return handle;
            } catch (TelegramApiException ex) {
                log.debug("Editing status message {} failed, sending a new one: {}", handle, ex.getMessage());
            }
        }

        try {
            SendMessage.SendMessageBuilder message = SendMessage.builder()
                    .chatId(Long.toString(userId))
                    .text(text);
            if (!choices.isEmpty()) {
                message.replyMarkup(toKeyboard(choices));
            }
            Message sent = sender.execute(message.build());
            return new StatusHandle(sent.getChatId(), sent.getMessageId());
        } catch (TelegramApiException ex) {
            throw new TransportException("Failed to send status to chat %d".formatted(userId), ex);
        }
    }

    @Override
    public void editStatus(long userId, StatusHandle handle, String text) {
        try {
            sender.execute(EditMessageText.builder()
                    .chatId(Long.toString(handle.chatId()))
                    .messageId(handle.messageId())
                    .text(text)
                    .build());
        } catch (TelegramApiException ex) {
            throw new TransportException("Failed to edit status message %d".formatted(handle.messageId()), ex);
        }
    }

    @Override
    public void sendDocument(long userId, Path document, String filename, String caption) {
        try {
            sender.execute(SendDocument.builder()
                    .chatId(Long.toString(userId))
                    .document(new InputFile(document.toFile(), filename))
                    .caption(caption)
                    .build());
        } catch (TelegramApiException ex) {
            throw new TransportException("Failed to send %s to chat %d".formatted(filename, userId), ex);
        }
    }

    @Override
    public Path download(String fileRef, String suffix) {
        Path target = null;
        try {
            org.telegram.telegrambots.meta.api.objects.File remote = sender.execute(GetFile.builder()
                    .fileId(fileRef)
                    .build());
            File downloaded = sender.downloadFile(remote);
            target = storage.newFile("download-", suffix);
            Files.move(downloaded.toPath(), target, StandardCopyOption.REPLACE_EXISTING);
            return target;
        } catch (TelegramApiException | IOException ex) {
            deleteQuietly(target);
            throw new TransportException("Failed to download file %s".formatted(fileRef), ex);
        }
    }

    private static InlineKeyboardMarkup toKeyboard(List<List<FormatChoice>> choices) {
        List<List<InlineKeyboardButton>> rows = choices.stream()
                .map(row -> row.stream()
                        .map(choice -> InlineKeyboardButton.builder()
                                .text(choice.label())
                                .callbackData(choice.callbackData())
                                .build())
                        .toList())
                .toList();
        return InlineKeyboardMarkup.builder().keyboard(rows).build();
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            log.warn("Failed to delete {}: {}", path, ex.getMessage());
        }
    }
}
