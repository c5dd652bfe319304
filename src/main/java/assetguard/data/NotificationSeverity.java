package assetguard.data;

public enum NotificationSeverity {
    WARNING,
    CRITICAL
}
