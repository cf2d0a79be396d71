package com.example.imagebot.conversion.support;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

@Slf4j
@Component
public class ArchiveCodec {

    public static final Set<String> SUPPORTED_IMAGE_EXTENSIONS =
            Set.of("jpg", "jpeg", "png", "webp", "gif", "tiff", "bmp", "avif");

    private final TempFileStorage storage;
    private final long maxMemberBytes;
    private final long maxInflatedBytes;

    public ArchiveCodec(TempFileStorage storage,
            @Value("${app.conversion.max-file-size:20MB}") DataSize maxMemberSize,
            @Value("${app.conversion.max-archive-inflated-size:256MB}") DataSize maxInflatedSize) {
        this.storage = storage;
        this.maxMemberBytes = maxMemberSize.toBytes();
        this.maxInflatedBytes = maxInflatedSize.toBytes();
    }

    /**
     * Stages at most {@code maxMembers} image entries of {@code archive} as files, inflating no more
     * than the configured byte budget. Entries in subdirectories are flattened to their file name.
     * The staged files belong to the caller.
     *
     * @throws ArchiveException when the archive cannot be read; nothing stays staged in that case
     */
    public ArchiveExtraction extract(Path archive, int maxMembers) {
        List<ArchiveMember> members = new ArrayList<>();
        int overflow = 0;
        long inflated = 0;
        try (ZipFile zipFile = ZipFile.builder().setPath(archive).get()) {
            for (ZipArchiveEntry entry : Collections.list(zipFile.getEntries())) {
                if (entry.isDirectory()) {
                    continue;
                }
                String name = flatten(entry.getName());
                if (!isSupportedImageName(name)) {
                    log.info("Skipping non-image archive entry {}", entry.getName());
                    continue;
                }
                if (members.size() >= maxMembers || inflated >= maxInflatedBytes) {
                    overflow++;
                    continue;
                }
                if (entry.getSize() > maxMemberBytes) {
                    log.warn("Skipping archive entry {} of {} bytes, limit is {}", entry.getName(), entry.getSize(),
                            maxMemberBytes);
                    continue;
                }

                long budget = Math.min(maxMemberBytes, maxInflatedBytes - inflated);
                Optional<Path> staged;
                try (InputStream in = zipFile.getInputStream(entry)) {
                    staged = storage.stage(in, name, budget);
                }
                if (staged.isEmpty()) {
                    if (budget < maxMemberBytes) {
                        log.warn("Archive {} exceeds {} inflated bytes, dropping remaining images",
                                archive.getFileName(), maxInflatedBytes);
                        inflated = maxInflatedBytes;
                        overflow++;
                    } else {
                        log.warn("Skipping archive entry {} exceeding {} bytes once inflated", entry.getName(),
                                maxMemberBytes);
                    }
                    continue;
                }
                inflated += Files.size(staged.get());
                members.add(new ArchiveMember(name, staged.get()));
            }
        } catch (IOException | RuntimeException ex) {
            members.forEach(member -> deleteQuietly(member.file()));
            throw new ArchiveException("Unreadable ZIP archive %s".formatted(archive.getFileName()), ex);
        }
        log.debug("Staged {} image members from {} ({} bytes), {} left over", members.size(), archive.getFileName(),
                inflated, overflow);
        return new ArchiveExtraction(members, overflow);
    }

    public void pack(List<ArchiveMember> members, Path target) {
        try (OutputStream out = Files.newOutputStream(target);
                ZipArchiveOutputStream zip = new ZipArchiveOutputStream(out)) {
            for (ArchiveMember member : members) {
                zip.putArchiveEntry(new ZipArchiveEntry(member.name()));
                try (InputStream in = Files.newInputStream(member.file())) {
                    in.transferTo(zip);
                }
                zip.closeArchiveEntry();
                log.debug("Added {} to archive", member.name());
            }
            zip.finish();
        } catch (IOException ex) {
            throw new ArchiveException("Failed to pack archive %s".formatted(target.getFileName()), ex);
        }
    }

    public static boolean isSupportedImageName(String name) {
        if (name == null) {
            return false;
        }
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return false;
        }
        return SUPPORTED_IMAGE_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static String flatten(String entryName) {
        String normalized = entryName.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            log.warn("Failed to delete staged archive member {}: {}", path, ex.getMessage());
        }
    }
}
