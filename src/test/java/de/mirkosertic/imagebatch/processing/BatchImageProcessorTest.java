package de.mirkosertic.imagebatch.processing;

import de.mirkosertic.imagebatch.config.ApplicationConfig;
import de.mirkosertic.imagebatch.progress.ProgressReporter;
import de.mirkosertic.imagebatch.scan.ReferenceScanner;
import de.mirkosertic.imagebatch.vault.FilePatternMatcher;
import de.mirkosertic.imagebatch.vault.FileSystemVaultStore;
import de.mirkosertic.imagebatch.vault.SupportedImageFormats;
import de.mirkosertic.imagebatch.vault.VaultStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Tests for BatchImageProcessor against a vault on disk. The image transformation is
 * faked: it prefixes the file content with {@code converted:} and fails for content
 * starting with {@code broken}.
 */
@DisplayName("BatchImageProcessor Tests")
class BatchImageProcessorTest {

    private static final ProcessingSettings TO_WEBP = new ProcessingSettings(OutputFormat.WEBP, 0.75, ResizeMode.NONE,
            600, 800, 800, EnlargeReduce.AUTO, false, List.of(), true);

    @TempDir
    Path vaultDir;

    private ApplicationConfig config;
    private FileSystemVaultStore store;
    private ImageProcessor imageProcessor;
    private ProgressReporter progressReporter;
    private BatchImageProcessor batchProcessor;

    @BeforeEach
    void setUp() throws Exception {
        config = mock(ApplicationConfig.class);
        when(config.getNoteSettings()).thenReturn(TO_WEBP);
        when(config.getVaultSettings()).thenReturn(TO_WEBP);
        when(config.getConflictMode()).thenReturn(ConflictMode.INCREMENT);
        when(config.getMaxImageBytes()).thenReturn(-1L);

        imageProcessor = mock(ImageProcessor.class);
        when(imageProcessor.transform(any(), anyString(), any())).thenAnswer(invocation -> {
            final String content = new String(invocation.<byte[]>getArgument(0), StandardCharsets.UTF_8);
            if (content.startsWith("broken")) {
                throw new ImageProcessingException("Unsupported or corrupt image data");
            }
            return ("converted:" + content).getBytes(StandardCharsets.UTF_8);
        });

        progressReporter = mock(ProgressReporter.class);

        createFile("images/a.png", "png-a");
        createFile("images/b.jpg", "jpg-b");

        store = spy(new FileSystemVaultStore(vaultDir, new FilePatternMatcher(List.of())));
        batchProcessor = newBatchProcessor(store);
    }

    @Test
    @DisplayName("Should convert, rename and relink every image of a note")
    void shouldConvertAllImagesOfNote() throws Exception {
        // Given
        createFile("note.md", "![[a.png]]\n![b](images/b.jpg)\n");

        // When
        final RunSummary summary = batchProcessor.processImagesInNote("note.md");

        // Then
        assertThat(summary.count(ProcessingOutcome.PROCESSED_AND_RENAMED)).isEqualTo(2);
        assertThat(summary.processedCount()).isEqualTo(2);
        assertThat(summary.renames()).containsExactly(
                new RunSummary.Rename("images/a.png", "images/a.webp"),
                new RunSummary.Rename("images/b.jpg", "images/b.webp"));

        assertThat(vaultDir.resolve("images/a.png")).doesNotExist();
        assertThat(vaultDir.resolve("images/b.jpg")).doesNotExist();
        assertThat(read("images/a.webp")).isEqualTo("converted:png-a");
        assertThat(read("images/b.webp")).isEqualTo("converted:jpg-b");

        final String note = read("note.md");
        assertThat(note).contains("a.webp", "images/b.webp").doesNotContain("a.png", "b.jpg");

        verify(store, times(2)).rename(anyString(), anyString());
        verify(store, times(2)).writeBinary(anyString(), any());
    }

    @Test
    @DisplayName("Should continue with the next image when one cannot be decoded")
    void shouldIsolateTransformFailures() throws Exception {
        // Given: b.jpg is not a decodable image
        createFile("images/b.jpg", "broken-b");
        createFile("note.md", "![[a.png]]\n![b](images/b.jpg)\n");

        // When
        final RunSummary summary = batchProcessor.processImagesInNote("note.md");

        // Then
        assertThat(summary.processedCount()).isEqualTo(1);
        assertThat(summary.count(ProcessingOutcome.SKIPPED_BY_ERROR)).isEqualTo(1);
        assertThat(read("images/a.webp")).isEqualTo("converted:png-a");
        assertThat(read("images/b.jpg")).isEqualTo("broken-b");
        assertThat(vaultDir.resolve("images/b.webp")).doesNotExist();
        assertThat(read("note.md")).contains("a.webp", "images/b.jpg");
    }

    @Test
    @DisplayName("Should roll back the rename when writing the converted image fails")
    void shouldRollBackRenameOnWriteFailure() throws Exception {
        // Given
        createFile("note.md", "![[a.png]] ![[b.jpg]]");
        doThrow(new IOException("disk full")).when(store).writeBinary(eq("images/a.webp"), any());

        // When
        final RunSummary summary = batchProcessor.processImagesInNote("note.md");

        // Then: a.png is back in place and untouched, b.jpg was processed normally
        assertThat(summary.count(ProcessingOutcome.SKIPPED_BY_ERROR)).isEqualTo(1);
        assertThat(summary.count(ProcessingOutcome.PROCESSED_AND_RENAMED)).isEqualTo(1);
        assertThat(read("images/a.png")).isEqualTo("png-a");
        assertThat(vaultDir.resolve("images/a.webp")).doesNotExist();
        assertThat(read("note.md")).isEqualTo("![[a.png]] ![[b.webp]]");
        verify(store).rename("images/a.webp", "images/a.png");
    }

    @Test
    @DisplayName("Should neither write nor relink when the renamed file cannot be resolved")
    void shouldStopWhenRenamedFileCannotBeResolved() throws Exception {
        // Given
        createFile("note.md", "![[a.png]]");
        doReturn(null).when(store).resolve("images/a.webp");

        // When
        final RunSummary summary = batchProcessor.processImagesInNote("note.md");

        // Then: the rename stays, but nothing else happened
        assertThat(summary.count(ProcessingOutcome.SKIPPED_BY_ERROR)).isEqualTo(1);
        assertThat(read("images/a.webp")).isEqualTo("png-a");
        assertThat(read("note.md")).isEqualTo("![[a.png]]");
        verify(store, never()).writeBinary(anyString(), any());
        verify(store, never()).write(anyString(), anyString());
    }

    @Test
    @DisplayName("Should only relink documents that are part of the scope")
    void shouldRespectScopeWhenRelinking() throws Exception {
        // Given: two notes referencing the same image
        createFile("first.md", "![[a.png]]");
        createFile("second.md", "![[a.png]]");

        // When
        batchProcessor.processImagesInNote("first.md");

        // Then
        assertThat(read("first.md")).isEqualTo("![[a.webp]]");
        assertThat(read("second.md")).isEqualTo("![[a.png]]");
    }

    @Test
    @DisplayName("Should not relink any document in folder scope")
    void shouldNotRelinkInFolderScope() throws Exception {
        createFile("note.md", "![[a.png]]");

        final RunSummary summary = batchProcessor.processImagesInFolder("images", false);

        assertThat(summary.processedCount()).isEqualTo(2);
        assertThat(read("images/a.webp")).isEqualTo("converted:png-a");
        assertThat(read("note.md")).isEqualTo("![[a.png]]");
        verify(store, never()).write(anyString(), anyString());
    }

    @Test
    @DisplayName("Should relink notes and canvases of a linked folder")
    void shouldRelinkLinkedFolder() throws Exception {
        createFile("journal/day.md", "![[a.png]]");
        createFile("journal/board.canvas", "{\"nodes\":[{\"type\":\"file\",\"file\":\"images/a.png\"}]}");
        createFile("elsewhere.md", "![[b.jpg]]");

        final RunSummary summary = batchProcessor.processLinkedImagesInFolder("journal", false);

        assertThat(summary.total()).isEqualTo(1);
        assertThat(read("journal/day.md")).isEqualTo("![[a.webp]]");
        assertThat(read("journal/board.canvas")).contains("\"images/a.webp\"");
        assertThat(read("images/b.jpg")).isEqualTo("jpg-b");
    }

    @Test
    @DisplayName("Should not touch the vault when the settings cannot change anything")
    void shouldExitEarlyForNoOpSettings() {
        // Given
        final ProcessingSettings noOp = new ProcessingSettings(OutputFormat.ORIGINAL, 1.0, ResizeMode.NONE,
                600, 800, 800, EnlargeReduce.AUTO, false, List.of(), true);
        when(config.getNoteSettings()).thenReturn(noOp);
        final VaultStore untouchedStore = mock(VaultStore.class);
        final BatchImageProcessor processor = newBatchProcessor(untouchedStore);

        // When
        final RunSummary summary = processor.processImagesInNote("note.md");

        // Then
        assertThat(summary.skipped()).isTrue();
        assertThat(summary.processedCount()).isZero();
        verifyNoInteractions(untouchedStore, imageProcessor);
        verify(progressReporter).nothingToDo(anyString());
        verify(progressReporter, never()).start(anyInt());
    }

    @Test
    @DisplayName("Should process vault images in a stable order")
    void shouldProcessInStableOrder() throws Exception {
        createFile("images/c.png", "png-c");
        createFile("b-note.md", "![[b.jpg]]");
        createFile("a-note.md", "![[c.png]] ![[a.png]]");

        final RunSummary summary = batchProcessor.processAllVaultImages();

        assertThat(summary.renames()).extracting(RunSummary.Rename::oldPath)
                .containsExactly("images/c.png", "images/a.png", "images/b.jpg");
    }

    @Test
    @DisplayName("Should transform an image once no matter how often it is referenced")
    void shouldTransformEachImageOnce() throws Exception {
        createFile("one.md", "![[a.png]] ![[a.png]] ![x](images/a.png)");
        createFile("two.md", "![[images/a.png]]");
        createFile("board.canvas", "{\"nodes\":[{\"type\":\"file\",\"file\":\"images/a.png\"}]}");

        final RunSummary summary = batchProcessor.processAllVaultImages();

        assertThat(summary.total()).isEqualTo(1);
        verify(imageProcessor, times(1)).transform(any(), anyString(), any());
        assertThat(read("one.md")).isEqualTo("![[a.webp]] ![[a.webp]] ![x](images/a.webp)");
        assertThat(read("two.md")).isEqualTo("![[images/a.webp]]");
        assertThat(read("board.canvas")).contains("\"images/a.webp\"");
    }

    @Test
    @DisplayName("Should pick a free name when the converted name is taken")
    void shouldIncrementOnConflict() throws Exception {
        createFile("images/a.webp", "existing");
        createFile("note.md", "![[images/a.png]]");

        final RunSummary summary = batchProcessor.processImagesInNote("note.md");

        assertThat(summary.renames()).containsExactly(new RunSummary.Rename("images/a.png", "images/a-1.webp"));
        assertThat(read("images/a.webp")).isEqualTo("existing");
        assertThat(read("images/a-1.webp")).isEqualTo("converted:png-a");
        assertThat(read("note.md")).isEqualTo("![[images/a-1.webp]]");
    }

    @Test
    @DisplayName("Should skip the image in reuse mode when the converted name is taken")
    void shouldSkipOnConflictInReuseMode() throws Exception {
        when(config.getConflictMode()).thenReturn(ConflictMode.REUSE);
        createFile("images/a.webp", "existing");
        createFile("note.md", "![[a.png]]");

        final RunSummary summary = batchProcessor.processImagesInNote("note.md");

        assertThat(summary.count(ProcessingOutcome.SKIPPED_BY_ERROR)).isEqualTo(1);
        assertThat(read("images/a.webp")).isEqualTo("existing");
        assertThat(read("images/a.png")).isEqualTo("png-a");
    }

    @Test
    @DisplayName("Should skip images already in the target format without reading them")
    void shouldSkipImagesAlreadyInTargetFormat() throws Exception {
        createFile("images/c.webp", "webp-c");
        createFile("note.md", "![[c.webp]] ![[a.png]]");

        final RunSummary summary = batchProcessor.processImagesInNote("note.md");

        assertThat(summary.total()).isEqualTo(2);
        assertThat(summary.count(ProcessingOutcome.SKIPPED_BY_FILTER)).isEqualTo(1);
        assertThat(summary.count(ProcessingOutcome.PROCESSED_AND_RENAMED)).isEqualTo(1);
        verify(store, never()).readBinary("images/c.webp");
        verify(progressReporter).start(2);
        verify(progressReporter, times(2)).targetCompleted();
        verify(progressReporter).complete(1);
    }

    @Test
    @DisplayName("Should keep the name when only compressing in the same format")
    void shouldNotRenameWithinSameFormat() throws Exception {
        final ProcessingSettings toJpeg = new ProcessingSettings(OutputFormat.JPEG, 0.5, ResizeMode.NONE,
                600, 800, 800, EnlargeReduce.AUTO, false, List.of(), false);
        when(config.getNoteSettings()).thenReturn(toJpeg);
        createFile("note.md", "![[b.jpg]]");

        final RunSummary summary = batchProcessor.processImagesInNote("note.md");

        assertThat(summary.count(ProcessingOutcome.PROCESSED_NO_RENAME)).isEqualTo(1);
        assertThat(summary.renames()).isEmpty();
        assertThat(read("images/b.jpg")).isEqualTo("converted:jpg-b");
        assertThat(read("note.md")).isEqualTo("![[b.jpg]]");
    }

    @Test
    @DisplayName("Should skip images above the configured size limit")
    void shouldSkipOversizedImages() throws Exception {
        when(config.getMaxImageBytes()).thenReturn(3L);
        createFile("note.md", "![[a.png]]");

        final RunSummary summary = batchProcessor.processImagesInNote("note.md");

        assertThat(summary.count(ProcessingOutcome.SKIPPED_BY_ERROR)).isEqualTo(1);
        verify(store, never()).readBinary(anyString());
        assertThat(read("images/a.png")).isEqualTo("png-a");
    }

    @Test
    @DisplayName("Should report when a note has no images")
    void shouldReportEmptyNote() throws Exception {
        createFile("note.md", "plain text with [[Other note]] and ![web](https://example.com/x.png)");

        final RunSummary summary = batchProcessor.processImagesInNote("note.md");

        assertThat(summary.skipped()).isTrue();
        assertThat(summary.total()).isZero();
        verify(progressReporter).nothingToDo("No images found in the note.");
        verifyNoInteractions(imageProcessor);
    }

    @Test
    @DisplayName("Should reject a second run while one is active")
    void shouldRejectConcurrentRuns() throws Exception {
        // Given: the transformation tries to start another run
        createFile("note.md", "![[a.png]]");
        final AtomicReference<Throwable> nested = new AtomicReference<>();
        doAnswer(invocation -> {
            try {
                batchProcessor.processAllVaultImages();
            } catch (final IllegalStateException e) {
                nested.set(e);
            }
            return new byte[]{1};
        }).when(imageProcessor).transform(any(), anyString(), any());

        // When
        batchProcessor.processImagesInNote("note.md");

        // Then
        assertThat(nested.get()).isInstanceOf(IllegalStateException.class);
        assertThat(batchProcessor.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should propagate invalid scopes as setup errors")
    void shouldRejectInvalidScope() {
        assertThatThrownBy(() -> batchProcessor.processImagesInNote("missing.md"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> batchProcessor.processImagesInFolder("missing", true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(batchProcessor.isRunning()).isFalse();
    }

    private BatchImageProcessor newBatchProcessor(final VaultStore vaultStore) {
        return new BatchImageProcessor(
                config,
                vaultStore,
                new ReferenceScanner(vaultStore, new SupportedImageFormats(), false),
                new EligibilityFilter(),
                imageProcessor,
                new VaultConflictResolver(vaultStore),
                new PathReferenceRewriter(),
                progressReporter);
    }

    private void createFile(final String relativePath, final String content) throws IOException {
        final Path file = vaultDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private String read(final String relativePath) throws IOException {
        return Files.readString(vaultDir.resolve(relativePath));
    }
}
