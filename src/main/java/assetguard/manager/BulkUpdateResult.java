package assetguard.manager;

import assetguard.data.Asset;

import java.util.List;

/**
 * Outcome of a bulk edit: the assets as they were written, and the requested ids that matched
 * nothing.
 */
public record BulkUpdateResult(List<Asset> updated, List<String> notFound) {

    public BulkUpdateResult {
        updated = List.copyOf(updated);
        notFound = List.copyOf(notFound);
    }

    public int updatedCount() {
        return updated.size();
    }
}
