package com.example.imagebot.conversion.service;

import com.example.imagebot.conversion.model.BatchOutcome;
import com.example.imagebot.conversion.model.ConversionResult;
import com.example.imagebot.conversion.model.StagedImage;
import com.example.imagebot.conversion.model.StatusHandle;
import com.example.imagebot.conversion.model.TargetFormat;
import com.example.imagebot.conversion.support.ArchiveCodec;
import com.example.imagebot.conversion.support.ArchiveMember;
import com.example.imagebot.conversion.support.ImageCodec;
import com.example.imagebot.conversion.support.TempFileStorage;
import com.example.imagebot.conversion.support.TransportException;
import com.example.imagebot.conversion.transport.ChatTransport;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class BatchConversionService {

    static final String NOTHING_STAGED_TEXT = "No images found to convert. Please send images first.";
    static final String NOTHING_CONVERTED_TEXT = "No images were successfully converted.";

    private static final DateTimeFormatter ARCHIVE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final SessionStore sessionStore;
    private final ConversionPipeline pipeline;
    private final ImageCodec imageCodec;
    private final ArchiveCodec archiveCodec;
    private final TempFileStorage storage;
    private final SessionPresenter presenter;
    private final ChatTransport transport;
    private final Clock clock;
    private final Semaphore batchPermits;

    public BatchConversionService(SessionStore sessionStore,
            ConversionPipeline pipeline,
            ImageCodec imageCodec,
            ArchiveCodec archiveCodec,
            TempFileStorage storage,
            SessionPresenter presenter,
            ChatTransport transport,
            Clock clock,
            @Value("${app.conversion.max-concurrent-batches:4}") int maxConcurrentBatches) {
        this.sessionStore = sessionStore;
        this.pipeline = pipeline;
        this.imageCodec = imageCodec;
        this.archiveCodec = archiveCodec;
        this.storage = storage;
        this.presenter = presenter;
        this.transport = transport;
        this.clock = clock;
        this.batchPermits = new Semaphore(Math.max(1, maxConcurrentBatches), true);
    }

    /**
     * Converts everything the user has staged. The session is detached up front; staged files,
     * outputs and the archive are gone when this returns, whatever the outcome. An unavailable
     * target format leaves the session untouched so another format can be picked.
     */
    public Optional<BatchOutcome> convert(long userId, TargetFormat targetFormat) {
        if (sessionStore.snapshot(userId).isEmpty()) {
            transport.sendText(userId, NOTHING_STAGED_TEXT);
            return Optional.empty();
        }
        if (!imageCodec.canEncode(targetFormat)) {
            log.warn("No encoder for {} available, keeping session of user={}", targetFormat, userId);
            transport.sendText(userId, presenter.unavailableFormatText(targetFormat));
            return Optional.empty();
        }

        List<StagedImage> batch = sessionStore.take(userId);
        if (batch.isEmpty()) {
            transport.sendText(userId, NOTHING_STAGED_TEXT);
            return Optional.empty();
        }
        BatchOutcome outcome = null;
        Path archive = null;
        boolean permitted = false;
        try {
            String preparing = presenter.preparingText(batch.size(), targetFormat);
            log.info("user={} {}", userId, preparing);
            StatusHandle status = transport.sendOrEditStatus(userId, null, preparing, List.of());

            batchPermits.acquire();
            permitted = true;
            outcome = pipeline.run(batch, targetFormat, new StatusProgressListener(userId, status));

            if (outcome.isEmpty()) {
                transport.sendText(userId, NOTHING_CONVERTED_TEXT);
            } else {
                archive = storage.newFile("converted_images_", ".zip");
                archiveCodec.pack(toArchiveMembers(outcome.results()), archive);
                String archiveName = "converted_images_%s.zip".formatted(LocalDateTime.now(clock)
                        .format(ARCHIVE_TIMESTAMP));
                transport.sendDocument(userId, archive, archiveName,
                        presenter.captionText(outcome.processedCount(), targetFormat));
                log.info("Sent {} with {} images to user={}", archiveName, outcome.processedCount(), userId);
            }

            String summary = presenter.summaryText(outcome);
            editStatusQuietly(userId, status, summary);
            log.info("user={} {}", userId, summary.replace('\n', ' '));
            return Optional.of(outcome);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to allocate archive for user %d".formatted(userId), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to convert for user %d".formatted(userId), ex);
        } finally {
            if (permitted) {
                batchPermits.release();
            }
            batch.forEach(StagedImage::deleteSilently);
            if (outcome != null) {
                outcome.results().forEach(ConversionResult::deleteSilently);
            }
            deleteQuietly(archive);
        }
    }

    private static List<ArchiveMember> toArchiveMembers(List<ConversionResult> results) {
        return results.stream()
                .map(result -> new ArchiveMember(result.archiveName(), result.outputRef()))
                .toList();
    }

    private void editStatusQuietly(long userId, StatusHandle status, String text) {
        try {
            transport.editStatus(userId, status, text);
        } catch (TransportException ex) {
            log.warn("Could not update status message for user={}: {}", userId, ex.getMessage());
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            log.warn("Failed to delete archive {}: {}", path, ex.getMessage());
        }
    }

    private final class StatusProgressListener implements ProgressListener {
        private final long userId;
        private final StatusHandle status;

        private StatusProgressListener(long userId, StatusHandle status) {
            this.userId = userId;
            this.status = status;
        }

        @Override
        public void onProgress(int converted, int total, long originalBytes, long convertedBytes) {
            editStatusQuietly(userId, status, presenter.progressText(converted, total, originalBytes, convertedBytes));
        }

        @Override
        public void onItemFailed(String originalName) {
            try {
                transport.sendText(userId, presenter.itemFailedText(originalName));
            } catch (TransportException ex) {
                log.warn("Could not notify user={} about failed item {}: {}", userId, originalName, ex.getMessage());
            }
        }
    }
}
