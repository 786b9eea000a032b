package de.mirkosertic.imagebatch.progress;

import de.mirkosertic.imagebatch.NotificationService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("ProgressReporter Tests")
class ProgressReporterTest {

    private StatusSurface surface;
    private StatusIndicator indicator;
    private NotificationService notificationService;
    private ProgressReporter reporter;

    @BeforeEach
    void setUp() {
        surface = mock(StatusSurface.class);
        indicator = mock(StatusIndicator.class);
        notificationService = mock(NotificationService.class);
        when(surface.createIndicator()).thenReturn(indicator);

        reporter = new ProgressReporter(surface, notificationService, 100);
    }

    @AfterEach
    void tearDown() {
        reporter.shutdown();
    }

    @Test
    @DisplayName("Should count attempted targets and show the summary")
    void shouldReportProgressAndSummary() {
        reporter.start(3);
        reporter.targetCompleted();
        reporter.targetCompleted();
        reporter.targetCompleted();
        reporter.complete(2);

        final InOrder inOrder = inOrder(indicator);
        inOrder.verify(indicator).setText("Processing image 1 of 3");
        inOrder.verify(indicator).setText("Processing image 2 of 3");
        inOrder.verify(indicator).setText("Processing image 3 of 3");
        inOrder.verify(indicator).setText(startsWith("Finished processing 2 images, total time: "));
        verify(notificationService).notify(eq("Image Batch"), startsWith("Finished processing 2 images"));
    }

    @Test
    @DisplayName("Should remove the indicator after the dismiss delay")
    void shouldDismissIndicator() {
        reporter.start(1);
        reporter.targetCompleted();
        reporter.complete(1);

        verify(indicator, timeout(2000)).remove();
    }

    @Test
    @DisplayName("Should keep the indicator until the run completes")
    void shouldNotDismissBeforeCompletion() {
        reporter.start(2);
        reporter.targetCompleted();

        verify(indicator, after(300).never()).remove();
        assertThat(reporter.getProgress()).isNotNull();
        assertThat(reporter.getProgress().index()).isEqualTo(1);
        assertThat(reporter.getProgress().total()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should ignore progress outside of a run")
    void shouldIgnoreProgressWithoutRun() {
        reporter.targetCompleted();

        assertThat(reporter.complete(0)).isZero();
        verify(surface, never()).createIndicator();
        verify(notificationService, never()).notify(anyString(), anyString());
    }

    @Test
    @DisplayName("Should format the summary with two decimals")
    void shouldFormatSummary() {
        assertThat(ProgressReporter.summaryText(5, 1234)).isEqualTo("Finished processing 5 images, total time: 1.23 seconds");
        assertThat(ProgressReporter.summaryText(0, 0)).isEqualTo("Finished processing 0 images, total time: 0.00 seconds");
        assertThat(ProgressReporter.progressText(4, 10)).isEqualTo("Processing image 4 of 10");
    }

    @Test
    @DisplayName("Should notify when there is nothing to do")
    void shouldNotifyNothingToDo() {
        reporter.nothingToDo("No images found in the vault.");

        verify(notificationService).notify("Image Batch", "No images found in the vault.");
        verify(surface, never()).createIndicator();
    }
}
