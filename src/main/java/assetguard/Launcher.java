package assetguard;

import assetguard.config.AppConfig;
import assetguard.data.DashboardStats;
import assetguard.data.Notification;
import assetguard.db.SampleDataLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Arrays;

/**
 * Opens a session, optionally loads the demo data and prints the dashboard headline numbers and
 * current alerts.
 */
public class Launcher {

    private static final Logger logger = LoggerFactory.getLogger(Launcher.class);

    public static void main(String[] args) throws Exception {
        AppConfig config = AppConfig.load();
        try (AssetGuardSession session = AssetGuardSession.open(config)) {
            if (Arrays.asList(args).contains("--sample-data")) {
                SampleDataLoader.load(session.getStore(), Clock.systemDefaultZone());
            }
            DashboardStats stats = session.getDashboardDataService().getStats();
            logger.info("Assets: {} total, {} available, {} borrowed, {} in maintenance, {} lost",
                    stats.totalAssets(), stats.availableAssets(), stats.borrowedAssets(), stats.maintenanceAssets(), stats.lostAssets());
            for (Notification notification : session.getNotificationCenter().getNotifications()) {
                logger.info("[{}] {}: {}", notification.severity(), notification.title(), notification.message());
            }
        }
    }
}
