package assetguard.service;

import java.util.List;
import java.util.Map;

/**
 * The inventory summary sent to the insight backend. Serialized to JSON as-is.
 */
public record InsightSnapshot(int totalAssets, Map<String, Integer> statusCounts, List<RecentTransaction> recentTransactions) {

    public record RecentTransaction(String type, String assetName, String date, String notes) {
    }
}
