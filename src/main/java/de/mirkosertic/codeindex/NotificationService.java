package de.mirkosertic.codeindex;

import de.mirkosertic.codeindex.bulk.BulkProgress;
import de.mirkosertic.codeindex.bulk.BulkProgressListener;
import de.mirkosertic.codeindex.bulk.BulkStatus;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Announces finished bulk runs as a desktop notification. Failures to notify are never fatal.
 */
public class NotificationService implements BulkProgressListener {

    private static final Logger logger = LoggerFactory.getLogger(NotificationService.class);

    private final String os;
    private volatile @Nullable Instant lastAnnouncedRun;

    public NotificationService() {
        this(System.getProperty("os.name"));
    }

    NotificationService(final String osName) {
        this.os = osName.toLowerCase(Locale.ROOT);
        logger.debug("NotificationService initialized for OS: {}", os);
    }

    @Override
    public void onProgress(final BulkProgress progress) {
        if (!progress.status().isFinished() || progress.startTime() == null) {
            return;
        }
        // A late stop() republishes the finished snapshot, announce once per run
        if (progress.startTime().equals(lastAnnouncedRun)) {
            return;
        }
        lastAnnouncedRun = progress.startTime();

        if (progress.status() == BulkStatus.FAILED) {
            notify("Code index failed", String.valueOf(progress.message()));
        } else if (progress.stopped()) {
            notify("Code index stopped", progress.processedFiles() + " of " + progress.totalFiles() + " files indexed");
        } else {
            notify("Code index ready", progress.processedFiles() + " files indexed, " + progress.failedFiles() + " failed");
        }
    }

    public void notify(final String title, final String message) {
        final List<String> command = commandFor(title, message);
        if (command == null) {
            logger.debug("Notifications not supported on this OS: {}", os);
            return;
        }
        try {
            // Fire and forget, the notification tools return immediately or can be left running
            new ProcessBuilder(command).start();
        } catch (final IOException e) {
            logger.debug("Failed to send notification: {}", e.getMessage());
        }
    }

    @Nullable List<String> commandFor(final String title, final String message) {
        if (os.contains("mac")) {
            return List.of("osascript", "-e",
                    String.format("display notification \"%s\" with title \"%s\"",
                            escapeForAppleScript(message), escapeForAppleScript(title)));
        }
        if (os.contains("win")) {
            final String script = String.format(
                    "[Windows.UI.Notifications.ToastNotificationManager, Windows.UI.Notifications, ContentType = WindowsRuntime] | Out-Null; "
                            + "$template = [Windows.UI.Notifications.ToastNotificationManager]::GetTemplateContent([Windows.UI.Notifications.ToastTemplateType]::ToastText02); "
                            + "$textNodes = $template.GetElementsByTagName('text'); "
                            + "$textNodes.Item(0).AppendChild($template.CreateTextNode('%s')) | Out-Null; "
                            + "$textNodes.Item(1).AppendChild($template.CreateTextNode('%s')) | Out-Null; "
                            + "[Windows.UI.Notifications.ToastNotificationManager]::CreateToastNotifier('Code Index').Show("
                            + "[Windows.UI.Notifications.ToastNotification]::new($template));",
                    escapeForPowerShell(title), escapeForPowerShell(message));
            return List.of("powershell", "-Command", script);
        }
        if (os.contains("linux")) {
            return List.of("notify-send", title, message);
        }
        return null;
    }

    static String escapeForAppleScript(final String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    static String escapeForPowerShell(final String text) {
        return text.replace("'", "''").replace("\"", "`\"");
    }
}
