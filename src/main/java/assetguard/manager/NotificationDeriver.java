package assetguard.manager;

import assetguard.data.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives the alert set from the current assets and ledger. It keeps no state, so the same input
 * always gives the same notifications with the same keys.
 */
public class NotificationDeriver {

    static final String LOST_TITLE = "Asset Lost Alert";
    static final String OVERDUE_TITLE = "Overdue Alert";

    private final Duration overdueThreshold;

    public NotificationDeriver(Duration overdueThreshold) {
        if (overdueThreshold.isNegative()) {
            throw new IllegalArgumentException("Overdue threshold must not be negative: " + overdueThreshold);
        }
        this.overdueThreshold = overdueThreshold;
    }

    /**
     * @param assets       assets in store order; alerts follow this order
     * @param transactions the ledger in any order
     * @param now          the evaluation instant, also used as {@code generatedAt}
     * @return lost alerts first, then overdue alerts
     */
    public List<Notification> derive(List<Asset> assets, List<Transaction> transactions, Instant now) {
        List<Notification> notifications = new ArrayList<>();

        for (Asset asset : assets) {
            if (asset.getStatus() == AssetStatus.LOST) {
                notifications.add(new Notification(
                        "lost-" + asset.getId(),
                        LOST_TITLE,
                        String.format("%s (%s) is marked as Lost.", asset.getName(), asset.getId()),
                        NotificationSeverity.CRITICAL,
                        now));
            }
        }

        Map<String, Transaction> latestBorrows = latestBorrowByAsset(transactions);
        long thresholdMillis = overdueThreshold.toMillis();
        for (Asset asset : assets) {
            if (asset.getStatus() != AssetStatus.BORROWED) {
                continue;
            }
            Transaction borrow = latestBorrows.get(asset.getId());
            if (borrow == null) {
                continue;
            }
            if (now.toEpochMilli() - borrow.getTimestamp() > thresholdMillis) {
                notifications.add(new Notification(
                        "overdue-" + asset.getId(),
                        OVERDUE_TITLE,
                        String.format("%s held by %s for >%d days.", asset.getName(), borrow.getUserName(), overdueThreshold.toDays()),
                        NotificationSeverity.WARNING,
                        now));
            }
        }
        return notifications;
    }

    // on equal timestamps the first one seen wins; ledger order lists the later insert first
    private static Map<String, Transaction> latestBorrowByAsset(List<Transaction> transactions) {
        Map<String, Transaction> latest = new HashMap<>();
        for (Transaction tx : transactions) {
            if (tx.getType() != TransactionType.BORROW) {
                continue;
            }
            Transaction current = latest.get(tx.getAssetId());
            if (current == null || tx.getTimestamp() > current.getTimestamp()) {
                latest.put(tx.getAssetId(), tx);
            }
        }
        return latest;
    }
}
