package assetguard.data;

public record DashboardStats(int totalAssets, int borrowedAssets, int availableAssets, int maintenanceAssets, int lostAssets) {
}
