package assetguard.manager;

import assetguard.AssetGuardSession;
import assetguard.data.*;
import assetguard.store.EntityStore;
import assetguard.support.MutableClock;
import assetguard.support.TestSessions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationCenterTest {

    private AssetGuardSession session;
    private EntityStore store;
    private NotificationCenter center;
    private MutableClock clock;

    @BeforeEach
    void setUp() throws Exception {
        clock = TestSessions.clock();
        session = TestSessions.open(clock);
        store = session.getStore();
        center = session.getNotificationCenter();
        store.insertAsset(TestSessions.asset("AST-001", "MacBook Pro", "Laptop", AssetStatus.AVAILABLE));
        store.insertAsset(TestSessions.asset("AST-002", "Sony Alpha a7 IV", "Camera", AssetStatus.AVAILABLE));
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    @Test
    @DisplayName("marking an asset Lost raises an alert without any manual refresh")
    void recomputesOnAssetChange() throws Exception {
        Asset asset = store.findAsset("AST-001").orElseThrow();
        asset.setStatus(AssetStatus.LOST);
        session.getCatalogService().editAsset(asset);

        assertThat(center.getNotifications()).extracting(Notification::key).containsExactly("lost-AST-001");
        assertThat(center.countBySeverity(NotificationSeverity.CRITICAL)).isEqualTo(1);
    }

    @Test
    @DisplayName("recovering a lost asset removes its alert")
    void alertDisappears() throws Exception {
        Asset asset = store.findAsset("AST-001").orElseThrow();
        asset.setStatus(AssetStatus.LOST);
        session.getCatalogService().editAsset(asset);
        asset.setStatus(AssetStatus.AVAILABLE);
        session.getCatalogService().editAsset(asset);

        assertThat(center.getNotifications()).isEmpty();
    }

    @Test
    @DisplayName("an overdue alert appears on refresh once enough time has passed and goes away on return")
    void overdueAfterTimePasses() throws Exception {
        session.getLifecycleService().borrow("AST-002", "Alice Chen", "sig", null);
        assertThat(center.getNotifications()).isEmpty();

        clock.advance(Duration.ofDays(8));
        assertThat(center.getNotifications()).isEmpty();
        assertThat(center.refresh()).extracting(Notification::key).containsExactly("overdue-AST-002");

        session.getLifecycleService().returnAsset("AST-002", "Alice Chen", "sig", null);
        assertThat(center.getNotifications()).isEmpty();
    }

    @Test
    @DisplayName("user changes do not trigger a recompute")
    void ignoresUserChanges() throws Exception {
        Asset asset = store.findAsset("AST-001").orElseThrow();
        asset.setStatus(AssetStatus.LOST);
        store.updateAsset(asset);
        clock.advance(Duration.ofMinutes(5));

        store.insertUser(TestSessions.user("U001", "Alice Chen", UserRole.STAFF));

        assertThat(center.getNotifications()).singleElement()
                .extracting(Notification::generatedAt).isEqualTo(TestSessions.NOW);
    }
}
