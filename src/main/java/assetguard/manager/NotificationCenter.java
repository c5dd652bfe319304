package assetguard.manager;

import assetguard.data.Notification;
import assetguard.data.NotificationSeverity;
import assetguard.store.EntityKind;
import assetguard.store.EntityStore;
import assetguard.store.StoreChangeEvent;
import assetguard.store.StoreChangeListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Clock;
import java.util.List;

/**
 * Holds the current alert set and replaces it wholesale whenever assets or the ledger change.
 * Overdue alerts also depend on time passing, so callers should {@link #refresh()} periodically.
 */
public class NotificationCenter implements StoreChangeListener {

    private static final Logger logger = LoggerFactory.getLogger(NotificationCenter.class);

    private final EntityStore store;
    private final NotificationDeriver deriver;
    private final Clock clock;
    private volatile List<Notification> notifications = List.of();

    public NotificationCenter(EntityStore store, NotificationDeriver deriver, Clock clock) {
        this.store = store;
        this.deriver = deriver;
        this.clock = clock;
    }

    public List<Notification> refresh() throws SQLException {
        List<Notification> derived = deriver.derive(store.listAssets(), store.listTransactions(), clock.instant());
        notifications = List.copyOf(derived);
        logger.debug("Notifications recomputed: {} active", derived.size());
        return notifications;
    }

    public List<Notification> getNotifications() {
        return notifications;
    }

    public long countBySeverity(NotificationSeverity severity) {
        return notifications.stream().filter(n -> n.severity() == severity).count();
    }

    @Override
    public void onStoreChanged(StoreChangeEvent event) {
        if (!event.affects(EntityKind.ASSET) && !event.affects(EntityKind.TRANSACTION)) {
            return;
        }
        try {
            refresh();
        } catch (SQLException e) {
            // the previous set stays visible until the next successful recompute
            logger.error("Failed to recompute notifications after {}", event, e);
        }
    }
}
