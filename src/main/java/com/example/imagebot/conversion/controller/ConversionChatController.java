package com.example.imagebot.conversion.controller;

import com.example.imagebot.conversion.model.FormatChoice;
import com.example.imagebot.conversion.model.IntakeResult;
import com.example.imagebot.conversion.model.StatisticsScope;
import com.example.imagebot.conversion.model.TargetFormat;
import com.example.imagebot.conversion.service.BatchConversionService;
import com.example.imagebot.conversion.service.ImageIntakeService;
import com.example.imagebot.conversion.service.SessionPresenter;
import com.example.imagebot.conversion.service.SessionStore;
import com.example.imagebot.conversion.service.StatisticsAggregator;
import com.example.imagebot.conversion.support.ArchiveException;
import com.example.imagebot.conversion.support.IntakeRejectedException;
import com.example.imagebot.conversion.support.TransportException;
import com.example.imagebot.conversion.transport.ChatTransport;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Controller;
import org.springframework.util.StringUtils;

@Slf4j
@Controller
public class ConversionChatController {

    static final String NO_PERMISSION_TEXT = "You don't have permission to view statistics.";
    static final String IMAGE_ERROR_TEXT = "Sorry, there was an error processing your image. Please try again.";
    static final String FILE_ERROR_TEXT = "Sorry, there was an error processing your file. Please try again.";
    static final String CRITICAL_ERROR_TEXT = "Sorry, a critical error occurred during conversion. Please try again.";
    static final String UNREADABLE_ARCHIVE_TEXT = "Could not read the ZIP archive. Please check the file and try again.";
    static final String UNKNOWN_FORMAT_TEXT = "Unknown format selected. Please pick one of the buttons.";

    private final ImageIntakeService intakeService;
    private final BatchConversionService conversionService;
    private final StatisticsAggregator statistics;
    private final SessionStore sessionStore;
    private final SessionPresenter presenter;
    private final ChatTransport transport;
    private final String adminId;

    public ConversionChatController(ImageIntakeService intakeService,
            BatchConversionService conversionService,
            StatisticsAggregator statistics,
            SessionStore sessionStore,
            SessionPresenter presenter,
            ChatTransport transport,
            @Value("${app.telegram.admin-id:}") String adminId) {
        this.intakeService = intakeService;
        this.conversionService = conversionService;
        this.statistics = statistics;
        this.sessionStore = sessionStore;
        this.presenter = presenter;
        this.transport = transport;
        this.adminId = adminId == null ? "" : adminId.trim();
    }

    public void onStart(long userId) {
        replyQuietly(userId, presenter.welcomeText());
    }

    public void onHelp(long userId) {
        replyQuietly(userId, presenter.helpText());
    }

    public void onStats(long userId, long requesterId, String scopeArgument) {
        if (!StringUtils.hasText(adminId) || !adminId.equals(Long.toString(requesterId))) {
            log.warn("Rejected statistics request from user={}", requesterId);
            replyQuietly(userId, NO_PERMISSION_TEXT);
            return;
        }
        StatisticsScope scope = StatisticsScope.fromArgument(scopeArgument);
        replyQuietly(userId, presenter.statisticsText(statistics.query(scope)));
    }

    public void onImage(long userId, String fileRef, String uniqueId, long declaredSize) {
        try {
            IntakeResult result = intakeService.acceptPhoto(userId, fileRef, uniqueId, declaredSize);
            log.info("Staged image for user={} pending={}", userId, result.pendingCount());
        } catch (IntakeRejectedException ex) {
            log.warn("Image from user={} rejected: {}", userId, ex.getMessage());
            replyQuietly(userId, rejectionText(ex));
        } catch (RuntimeException ex) {
            log.error("Error handling image: {}", ex.getMessage(), ex);
            replyQuietly(userId, IMAGE_ERROR_TEXT);
        }
    }

    public void onDocument(long userId, String mimeType, String fileName, String fileRef, long declaredSize) {
        try {
            IntakeResult result = intakeService.acceptArchive(userId, mimeType, fileName, fileRef, declaredSize);
            log.info("Staged {} images from archive for user={} pending={}", result.added(), userId,
                    result.pendingCount());
            if (result.rejected() > 0) {
                replyQuietly(userId, ("Batch limit reached: %d image(s) from the archive were not added. "
                        + "Convert the current batch first.").formatted(result.rejected()));
            }
        } catch (IntakeRejectedException ex) {
            log.warn("Document from user={} rejected: {}", userId, ex.getMessage());
            replyQuietly(userId, rejectionText(ex));
        } catch (ArchiveException ex) {
            log.warn("Unreadable archive from user={}: {}", userId, ex.getMessage(), ex);
            replyQuietly(userId, UNREADABLE_ARCHIVE_TEXT);
        } catch (RuntimeException ex) {
            log.error("Error handling document: {}", ex.getMessage(), ex);
            replyQuietly(userId, FILE_ERROR_TEXT);
        }
    }

    public void onFormatChoice(long userId, String callbackData, Runnable acknowledge) {
        try {
            acknowledge.run();
        } catch (TransportException ex) {
            log.warn("Could not answer callback for user={}: {}", userId, ex.getMessage());
        }

        Optional<TargetFormat> targetFormat = parseChoice(callbackData);
        if (targetFormat.isEmpty()) {
            log.warn("Unknown format choice '{}' from user={}", callbackData, userId);
            replyQuietly(userId, UNKNOWN_FORMAT_TEXT);
            return;
        }

        try {
            conversionService.convert(userId, targetFormat.get());
        } catch (RuntimeException ex) {
            log.error("Error in format choice for user={}: {}", userId, ex.getMessage(), ex);
            sessionStore.clear(userId);
            replyQuietly(userId, CRITICAL_ERROR_TEXT);
        }
    }

    static Optional<TargetFormat> parseChoice(String callbackData) {
        if (callbackData == null || !callbackData.startsWith(FormatChoice.CALLBACK_PREFIX)) {
            return Optional.empty();
        }
        return TargetFormat.fromToken(callbackData.substring(FormatChoice.CALLBACK_PREFIX.length()));
    }

    private String rejectionText(IntakeRejectedException ex) {
        return switch (ex.getReason()) {
            case UNSUPPORTED_DOCUMENT -> "Please send a ZIP file containing images or send images directly.";
            case FILE_TOO_LARGE -> "This file is too large. Please send files up to the size limit (see /help).";
            case BATCH_FULL -> "Batch limit reached. Please choose a format to convert the current images first.";
            case NO_SUPPORTED_IMAGES -> "The ZIP file did not contain any supported image files.";
        };
    }

    private void replyQuietly(long userId, String text) {
        try {
            transport.sendText(userId, text);
        } catch (TransportException ex) {
            log.error("Failed to send message to user={}: {}", userId, ex.getMessage(), ex);
        }
    }
}
