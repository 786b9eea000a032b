package de.mirkosertic.imagebatch.cli;

import de.mirkosertic.imagebatch.processing.BatchImageProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Exercises the picocli command tree with a mocked {@link BatchLauncher}, so no vault,
 * configuration or logging setup is involved.
 */
@DisplayName("ImageBatchCommand Tests")
class ImageBatchCommandTest {

    private record CliResult(int exitCode, String output) {
    }

    private BatchLauncher launcher;
    private BatchImageProcessor processor;

    @BeforeEach
    void setUp() {
        launcher = mock(BatchLauncher.class);
        processor = mock(BatchImageProcessor.class);
    }

    private CliResult execute(final String... args) {
        final StringWriter output = new StringWriter();
        final PrintWriter writer = new PrintWriter(output, true);
        final CommandLine commandLine = new CommandLine(new ImageBatchCommand(), new CommandFactory(launcher));
        commandLine.setOut(writer);
        commandLine.setErr(writer);
        final int exitCode = commandLine.execute(args);
        writer.flush();
        return new CliResult(exitCode, output.toString());
    }

    /**
     * Runs the operation handed to the launcher against the mocked processor.
     */
    private void runLaunchedOperation() {
        final ArgumentCaptor<BatchOperation> operation = ArgumentCaptor.forClass(BatchOperation.class);
        verify(launcher).launch(operation.capture());
        operation.getValue().runOn(processor);
    }

    @Nested
    @DisplayName("Subcommands")
    class SubcommandTests {

        @Test
        @DisplayName("note runs the note scope")
        void noteRunsNoteScope() {
            final CliResult result = execute("note", "journal/today.md");

            assertThat(result.exitCode()).isZero();
            runLaunchedOperation();
            verify(processor).processImagesInNote("journal/today.md");
        }

        @Test
        @DisplayName("folder is flat unless --recursive is given")
        void folderRecursion() {
            assertThat(execute("folder", "images").exitCode()).isZero();
            runLaunchedOperation();
            verify(processor).processImagesInFolder("images", false);
        }

        @Test
        @DisplayName("folder accepts --recursive before the path")
        void folderRecursiveBeforePath() {
            assertThat(execute("folder", "--recursive", "images").exitCode()).isZero();
            runLaunchedOperation();
            verify(processor).processImagesInFolder("images", true);
        }

        @Test
        @DisplayName("linked-folder accepts -r after the path")
        void linkedFolderShortOption() {
            assertThat(execute("linked-folder", "notes", "-r").exitCode()).isZero();
            runLaunchedOperation();
            verify(processor).processLinkedImagesInFolder("notes", true);
        }

        @Test
        @DisplayName("vault runs the vault scope")
        void vaultRunsVaultScope() {
            assertThat(execute("vault").exitCode()).isZero();
            runLaunchedOperation();
            verify(processor).processAllVaultImages();
        }

        @Test
        @DisplayName("a failed run propagates the launcher's exit code")
        void failedRunExitCode() {
            when(launcher.launch(any())).thenReturn(1);

            assertThat(execute("vault").exitCode()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Usage errors")
    class UsageErrorTests {

        @Test
        @DisplayName("no subcommand is a usage error")
        void missingCommand() {
            final CliResult result = execute();

            assertThat(result.exitCode()).isEqualTo(CommandLine.ExitCode.USAGE);
            assertThat(result.output()).contains("Missing command");
            verifyNoInteractions(launcher);
        }

        @Test
        @DisplayName("unknown subcommands, missing paths and extra arguments are rejected")
        void invalidArguments() {
            assertThat(execute("resize", "a.png").exitCode()).isEqualTo(CommandLine.ExitCode.USAGE);
            assertThat(execute("note").exitCode()).isEqualTo(CommandLine.ExitCode.USAGE);
            assertThat(execute("note", "a.md", "-r").exitCode()).isEqualTo(CommandLine.ExitCode.USAGE);
            assertThat(execute("folder", "a", "b").exitCode()).isEqualTo(CommandLine.ExitCode.USAGE);
            assertThat(execute("vault", "extra").exitCode()).isEqualTo(CommandLine.ExitCode.USAGE);
            verifyNoInteractions(launcher);
        }
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists all subcommands")
        void helpListsSubcommands() {
            final CliResult result = execute("--help");

            assertThat(result.exitCode()).isZero();
            assertThat(result.output()).contains("note", "folder", "linked-folder", "vault", "help");
        }

        @Test
        @DisplayName("--version shows the version")
        void versionOutput() {
            final CliResult result = execute("--version");

            assertThat(result.exitCode()).isZero();
            assertThat(result.output()).contains("vault-image-batch");
        }
    }
}
