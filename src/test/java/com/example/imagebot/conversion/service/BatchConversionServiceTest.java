package com.example.imagebot.conversion.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.imagebot.conversion.model.BatchOutcome;
import com.example.imagebot.conversion.model.ConversionResult;
import com.example.imagebot.conversion.model.StagedImage;
import com.example.imagebot.conversion.model.StatusHandle;
import com.example.imagebot.conversion.model.TargetFormat;
import com.example.imagebot.conversion.support.ArchiveCodec;
import com.example.imagebot.conversion.support.ArchiveMember;
import com.example.imagebot.conversion.support.ImageCodec;
import com.example.imagebot.conversion.support.TempFileStorage;
import com.example.imagebot.conversion.transport.ChatTransport;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.util.unit.DataSize;

class BatchConversionServiceTest {

    private static final long USER = 7L;
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    private static final StatusHandle STATUS = new StatusHandle(USER, 10);

    @TempDir
    Path tempDir;

    private final ConversionPipeline pipeline = mock(ConversionPipeline.class);
    private final ArchiveCodec archiveCodec = mock(ArchiveCodec.class);
    private final ChatTransport transport = mock(ChatTransport.class);
    private final ImageCodec imageCodec = mock(ImageCodec.class);
    private final SessionStore sessionStore = new SessionStore(CLOCK, 50);
    private TempFileStorage storage;
    private BatchConversionService service;

    @BeforeEach
    void setUp() throws IOException {
        storage = new TempFileStorage(tempDir.toString());
        SessionPresenter presenter = new SessionPresenter(mock(ImageCodec.class), DataSize.ofMegabytes(20), 50);
        service = new BatchConversionService(sessionStore, pipeline, imageCodec, archiveCodec, storage, presenter,
                transport, CLOCK, 2);
        when(imageCodec.canEncode(any())).thenReturn(true);
        when(transport.sendOrEditStatus(eq(USER), isNull(), anyString(), anyList())).thenReturn(STATUS);
    }

    @Test
    void deliversArchiveAndSummaryForPartiallySuccessfulBatch() throws IOException {
        stage("a.png", "b.png", "c.png");
        ConversionResult first = result("a.webp", 1_000_000, 400_000);
        ConversionResult second = result("c.webp", 600_000, 300_000);
        when(pipeline.run(anyList(), eq(TargetFormat.WEBP), any()))
                .thenReturn(new BatchOutcome(List.of(first, second), 3, 2, 1, 0, 1_600_000, 700_000,
                        Duration.ofMillis(1500)));
        AtomicReference<Path> sentArchive = new AtomicReference<>();
        doAnswer(invocation -> {
            Path archive = invocation.getArgument(1);
            assertThat(archive).exists();
            sentArchive.set(archive);
            return null;
        }).when(transport).sendDocument(eq(USER), any(), anyString(), anyString());

        Optional<BatchOutcome> outcome = service.convert(USER, TargetFormat.WEBP);

        assertThat(outcome).get().extracting(BatchOutcome::processedCount).isEqualTo(2);
        verify(transport).sendOrEditStatus(USER, null, "Preparing to convert 3 images to WEBP...", List.of());
        verify(transport).sendDocument(eq(USER), any(), eq("converted_images_20240501_100000.zip"),
                eq("Converted 2 images to WEBP."));

        ArgumentCaptor<String> summary = ArgumentCaptor.forClass(String.class);
        verify(transport).editStatus(eq(USER), eq(STATUS), summary.capture());
        assertThat(summary.getValue())
                .contains("- Processed: 2/3 images")
                .contains("(56.3%)")
                .contains("- Time taken: 1.5 seconds");

        assertThat(sentArchive.get()).doesNotExist();
        assertThat(first.outputRef()).doesNotExist();
        assertThat(second.outputRef()).doesNotExist();
        assertThat(sessionStore.snapshot(USER)).isEmpty();
    }

    @Test
    void packsResultsUnderTheirArchiveNames() throws IOException {
        stage("a.png");
        ConversionResult only = result("a.gif", 10, 5);
        when(pipeline.run(anyList(), eq(TargetFormat.GIF), any()))
                .thenReturn(new BatchOutcome(List.of(only), 1, 1, 0, 0, 10, 5, Duration.ZERO));

        service.convert(USER, TargetFormat.GIF);

        verify(archiveCodec).pack(eq(List.of(new ArchiveMember("a.gif", only.outputRef()))), any(Path.class));
    }

    @Test
    void sendsNoArchiveWhenNothingConverted() throws IOException {
        List<StagedImage> staged = stage("bad.png");
        when(pipeline.run(anyList(), eq(TargetFormat.PNG), any()))
                .thenReturn(new BatchOutcome(List.of(), 1, 0, 1, 0, 0, 0, Duration.ZERO));

        service.convert(USER, TargetFormat.PNG);

        verify(transport).sendText(USER, BatchConversionService.NOTHING_CONVERTED_TEXT);
        verify(archiveCodec, never()).pack(anyList(), any());
        verify(transport, never()).sendDocument(eq(USER), any(), anyString(), anyString());
        assertThat(staged.get(0).storageRef()).doesNotExist();
        assertThat(sessionStore.snapshot(USER)).isEmpty();
    }

    @Test
    void answersWhenNothingIsStaged() {
        Optional<BatchOutcome> outcome = service.convert(USER, TargetFormat.PNG);

        assertThat(outcome).isEmpty();
        verify(transport).sendText(USER, BatchConversionService.NOTHING_STAGED_TEXT);
        verify(pipeline, never()).run(anyList(), any(), any());
    }

    @Test
    void keepsSessionWhenTargetFormatHasNoEncoder() throws IOException {
        List<StagedImage> staged = stage("a.png", "b.png");
        when(imageCodec.canEncode(TargetFormat.AVIF)).thenReturn(false);

        Optional<BatchOutcome> outcome = service.convert(USER, TargetFormat.AVIF);

        assertThat(outcome).isEmpty();
        verify(transport).sendText(USER, "AVIF encoding is unavailable right now. Please choose another format.");
        verify(pipeline, never()).run(anyList(), any(), any());
        assertThat(sessionStore.snapshot(USER)).hasSize(2);
        assertThat(staged).allSatisfy(image -> assertThat(image.storageRef()).exists());
    }

    @Test
    void idleSweepDuringConversionLeavesBatchInputsAlone() throws IOException {
        List<StagedImage> staged = stage("a.png", "b.png");
        AtomicReference<List<StagedImage>> swept = new AtomicReference<>();
        when(pipeline.run(anyList(), eq(TargetFormat.PNG), any())).thenAnswer(invocation -> {
            swept.set(sessionStore.expireIdleSessions(Instant.MAX));
            List<StagedImage> batch = invocation.getArgument(0);
            assertThat(batch).allSatisfy(image -> assertThat(image.storageRef()).exists());
            return new BatchOutcome(List.of(), 2, 0, 2, 0, 0, 0, Duration.ZERO);
        });

        service.convert(USER, TargetFormat.PNG);

        assertThat(swept.get()).isEmpty();
        assertThat(staged).allSatisfy(image -> assertThat(image.storageRef()).doesNotExist());
    }

    @Test
    void imagesSentDuringConversionStartANewBatch() throws IOException {
        stage("a.png");
        when(pipeline.run(anyList(), eq(TargetFormat.PNG), any())).thenAnswer(invocation -> {
            stage("late.png");
            return new BatchOutcome(List.of(), 1, 0, 1, 0, 0, 0, Duration.ZERO);
        });

        service.convert(USER, TargetFormat.PNG);

        assertThat(sessionStore.snapshot(USER)).extracting(StagedImage::originalName).containsExactly("late.png");
        assertThat(sessionStore.snapshot(USER).get(0).storageRef()).exists();
    }

    @Test
    void clearsSessionWhenPipelineFails() throws IOException {
        List<StagedImage> staged = stage("a.png", "b.png");
        when(pipeline.run(anyList(), any(), any())).thenThrow(new IllegalStateException("codec crashed"));

        assertThatThrownBy(() -> service.convert(USER, TargetFormat.BMP)).isInstanceOf(IllegalStateException.class);

        assertThat(sessionStore.snapshot(USER)).isEmpty();
        assertThat(staged).allSatisfy(image -> assertThat(image.storageRef()).doesNotExist());
    }

    private List<StagedImage> stage(String... names) throws IOException {
        for (String name : names) {
            Path path = storage.stage(new ByteArrayInputStream(new byte[] { 1, 2, 3 }), name, 1024).orElseThrow();
            sessionStore.add(USER, new StagedImage(path, name));
        }
        return sessionStore.snapshot(USER);
    }

    private ConversionResult result(String archiveName, long originalSize, long convertedSize) throws IOException {
        Path output = storage.newFile("converted-", archiveName);
        Files.write(output, new byte[] { 1 });
        return new ConversionResult(output, archiveName, originalSize, convertedSize);
    }
}
