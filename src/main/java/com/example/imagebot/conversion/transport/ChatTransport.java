package com.example.imagebot.conversion.transport;

import com.example.imagebot.conversion.model.FormatChoice;
import com.example.imagebot.conversion.model.StatusHandle;
import java.nio.file.Path;
import java.util.List;

public interface ChatTransport {

    void sendText(long userId, String text);

    /**
     * Edits the message behind {@code handle} when there is one, otherwise sends a new message.
     * A failed edit falls back to sending a new message.
     *
     * @return the handle of the message now showing {@code text}
     */
    StatusHandle sendOrEditStatus(long userId, StatusHandle handle, String text, List<List<FormatChoice>> choices);

    void editStatus(long userId, StatusHandle handle, String text);

    void sendDocument(long userId, Path document, String filename, String caption);

    Path download(String fileRef, String suffix);
}
