package assetguard.manager;

import assetguard.data.AssetStatus;
import assetguard.data.DashboardStats;
import assetguard.store.EntityStore;

import java.sql.SQLException;
import java.util.Map;

public class DashboardDataService {

    private final EntityStore store;

    public DashboardDataService(EntityStore store) {
        this.store = store;
    }

    /**
     * A count for every status, including the ones with no assets.
     */
    public Map<AssetStatus, Integer> statusCounts() throws SQLException {
        return store.countAssetsByStatus();
    }

    public Map<String, Integer> categoryCounts() throws SQLException {
        return store.countAssetsByCategory();
    }

    public DashboardStats getStats() throws SQLException {
        Map<AssetStatus, Integer> counts = statusCounts();
        int total = counts.values().stream().mapToInt(Integer::intValue).sum();
        return new DashboardStats(
                total,
                counts.get(AssetStatus.BORROWED),
                counts.get(AssetStatus.AVAILABLE),
                counts.get(AssetStatus.MAINTENANCE),
                counts.get(AssetStatus.LOST));
    }
}
