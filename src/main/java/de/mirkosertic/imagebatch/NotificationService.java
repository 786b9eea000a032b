package de.mirkosertic.imagebatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Locale;

/**
 * Shows desktop notifications through the tools the operating system ships with.
 * Failures only ever reach the debug log; a missing notification never fails a run.
 */
public class NotificationService {

    private static final Logger logger = LoggerFactory.getLogger(NotificationService.class);

    private final String os;
    private final boolean enabled;

    public NotificationService(final boolean enabled) {
        this.os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        this.enabled = enabled;
        logger.info("NotificationService initialized for OS: {} (enabled: {})", os, enabled);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void notify(final String title, final String message) {
        if (!enabled) {
            return;
        }
        try {
            if (os.contains("mac")) {
                notifyMacOS(title, message);
            } else if (os.contains("win")) {
                notifyWindows(title, message);
            } else if (os.contains("linux")) {
                notifyLinux(title, message);
            } else {
                logger.debug("Notifications not supported on this OS: {}", os);
            }
        } catch (final IOException e) {
            logger.debug("Failed to send notification: {}", e.getMessage());
        } catch (final InterruptedException e) {
            logger.debug("Interrupted while sending notification");
            Thread.currentThread().interrupt();
        }
    }

    private void notifyMacOS(final String title, final String message) throws IOException {
        final ProcessBuilder pb = new ProcessBuilder(
                "osascript", "-e",
                String.format("display notification \"%s\" with title \"%s\"",
                        escapeForAppleScript(message),
                        escapeForAppleScript(title))
        );
        // fire and forget
        pb.start();
    }

    private void notifyWindows(final String title, final String message) throws IOException, InterruptedException {
        final String script = String.format(
                "[Windows.UI.Notifications.ToastNotificationManager, Windows.UI.Notifications, ContentType = WindowsRuntime] | Out-Null; " +
                "$template = [Windows.UI.Notifications.ToastNotificationManager]::GetTemplateContent([Windows.UI.Notifications.ToastTemplateType]::ToastText02); " +
                "$textNodes = $template.GetElementsByTagName('text'); " +
                "$textNodes.Item(0).AppendChild($template.CreateTextNode('%s')) | Out-Null; " +
                "$textNodes.Item(1).AppendChild($template.CreateTextNode('%s')) | Out-Null; " +
                "$toast = [Windows.UI.Notifications.ToastNotification]::new($template); " +
                "[Windows.UI.Notifications.ToastNotificationManager]::CreateToastNotifier('Vault Image Batch').Show($toast);",
                escapeForPowerShell(title),
                escapeForPowerShell(message)
        );
        final Process p = new ProcessBuilder("powershell", "-Command", script).start();
        p.waitFor();
    }

    private void notifyLinux(final String title, final String message) throws IOException, InterruptedException {
        final Process p = new ProcessBuilder("notify-send", "-a", "Vault Image Batch", title, message).start();
        p.waitFor();
    }

    private static String escapeForAppleScript(final String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static String escapeForPowerShell(final String text) {
        return text.replace("'", "''").replace("\"", "`\"");
    }
}
