package assetguard.label;

/**
 * Progress callbacks for a batch export. Calls may arrive from worker threads.
 */
public interface ExportProgressListener {

    ExportProgressListener NONE = new ExportProgressListener() {
    };

    default void onRunningChanged(boolean running) {
    }

    default void onProgress(int completed, int total, String message) {
    }
}
