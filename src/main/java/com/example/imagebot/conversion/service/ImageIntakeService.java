package com.example.imagebot.conversion.service;

import com.example.imagebot.conversion.model.IntakeResult;
import com.example.imagebot.conversion.model.StagedImage;
import com.example.imagebot.conversion.model.StatusHandle;
import com.example.imagebot.conversion.support.ArchiveCodec;
import com.example.imagebot.conversion.support.ArchiveExtraction;
import com.example.imagebot.conversion.support.ArchiveMember;
import com.example.imagebot.conversion.support.IntakeRejectedException;
import com.example.imagebot.conversion.support.IntakeRejectedException.Reason;
import com.example.imagebot.conversion.transport.ChatTransport;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.unit.DataSize;

@Slf4j
@Service
public class ImageIntakeService {

    private static final Set<String> ARCHIVE_MIME_TYPES =
            Set.of("application/zip", "application/x-zip-compressed");

    private final SessionStore sessionStore;
    private final ArchiveCodec archiveCodec;
    private final SessionPresenter presenter;
    private final ChatTransport transport;
    private final long maxFileBytes;

    public ImageIntakeService(SessionStore sessionStore,
            ArchiveCodec archiveCodec,
            SessionPresenter presenter,
            ChatTransport transport,
            @Value("${app.conversion.max-file-size:20MB}") DataSize maxFileSize) {
        this.sessionStore = sessionStore;
        this.archiveCodec = archiveCodec;
        this.presenter = presenter;
        this.transport = transport;
        this.maxFileBytes = maxFileSize.toBytes();
    }

    public IntakeResult acceptPhoto(long userId, String fileRef, String uniqueId, long declaredSize) {
        requireWithinSizeLimit(declaredSize);
        String originalName = "image_%s.jpg".formatted(uniqueId);
        Path downloaded = transport.download(fileRef, "_" + originalName);
        StagedImage image = new StagedImage(downloaded, originalName);
        log.info("Downloaded direct image to {} (original: {})", downloaded, originalName);

        int pending;
        try {
            requireWithinSizeLimit(Files.size(downloaded));
            pending = sessionStore.add(userId, image);
        } catch (IOException ex) {
            image.deleteSilently();
            throw new UncheckedIOException("Failed to inspect downloaded image %s".formatted(originalName), ex);
        } catch (RuntimeException ex) {
            image.deleteSilently();
            throw ex;
        }

        refreshStatus(userId);
        return new IntakeResult(1, 0, pending);
    }

    public IntakeResult acceptArchive(long userId, String mimeType, String fileName, String fileRef,
            long declaredSize) {
        if (!isArchive(mimeType, fileName)) {
            throw new IntakeRejectedException(Reason.UNSUPPORTED_DOCUMENT,
                    "Unsupported document type %s".formatted(mimeType));
        }
        requireWithinSizeLimit(declaredSize);

        Path archive = transport.download(fileRef, ".zip");
        log.info("Downloaded ZIP to {}", archive);
        ArchiveExtraction extraction;
        try {
            extraction = archiveCodec.extract(archive, sessionStore.remainingCapacity(userId));
        } finally {
            deleteQuietly(archive);
            log.info("Cleaned up downloaded ZIP: {}", archive);
        }

        if (extraction.isEmpty()) {
            if (extraction.overflow() > 0) {
                throw new IntakeRejectedException(Reason.BATCH_FULL,
                        "No room left for the %d images of %s".formatted(extraction.overflow(), fileName));
            }
            throw new IntakeRejectedException(Reason.NO_SUPPORTED_IMAGES,
                    "Archive %s holds no supported images".formatted(fileName));
        }

        int added = 0;
        int pending = sessionStore.snapshot(userId).size();
        List<ArchiveMember> members = extraction.members();
        for (ArchiveMember member : members) {
            StagedImage image = new StagedImage(member.file(), member.name());
            try {
                pending = sessionStore.add(userId, image);
                added++;
                log.info("Stored {} from ZIP to {}", member.name(), image.storageRef());
            } catch (IntakeRejectedException ex) {
                discard(members.subList(added, members.size()));
                break;
            } catch (RuntimeException ex) {
                discard(members.subList(added, members.size()));
                throw ex;
            }
        }
        int rejected = extraction.overflow() + members.size() - added;
        if (rejected > 0) {
            log.warn("Dropped {} images from archive {} for user={} because the batch is full", rejected, fileName,
                    userId);
        }

        refreshStatus(userId);
        return new IntakeResult(added, rejected, pending);
    }

    public void refreshStatus(long userId) {
        List<StagedImage> pending = sessionStore.snapshot(userId);
        if (pending.isEmpty()) {
            return;
        }
        String text = presenter.statusText(pending);
        StatusHandle previous = sessionStore.statusHandle(userId).orElse(null);
        StatusHandle current = transport.sendOrEditStatus(userId, previous, text, presenter.formatChoices());
        sessionStore.updateStatusHandle(userId, current);
    }

    private void requireWithinSizeLimit(long size) {
        if (size > maxFileBytes) {
            throw new IntakeRejectedException(Reason.FILE_TOO_LARGE,
                    "File of %d bytes exceeds the %d byte limit".formatted(size, maxFileBytes));
        }
    }

    private static boolean isArchive(String mimeType, String fileName) {
        if (mimeType != null && ARCHIVE_MIME_TYPES.contains(mimeType.toLowerCase(Locale.ROOT))) {
            return true;
        }
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".zip");
    }

    private static void discard(List<ArchiveMember> members) {
        members.forEach(member -> deleteQuietly(member.file()));
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            log.warn("Failed to delete {}: {}", path, ex.getMessage());
        }
    }
}
