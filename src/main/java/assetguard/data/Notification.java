package assetguard.data;

import java.time.Instant;

/**
 * A derived alert. Never stored; the key is stable across recomputes so callers can track
 * which alerts they have already shown.
 */
public record Notification(String key, String title, String message, NotificationSeverity severity, Instant generatedAt) {
}
