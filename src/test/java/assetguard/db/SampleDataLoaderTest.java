package assetguard.db;

import assetguard.AssetGuardSession;
import assetguard.data.Asset;
import assetguard.data.AssetStatus;
import assetguard.data.Notification;
import assetguard.data.Transaction;
import assetguard.data.User;
import assetguard.exception.DuplicateIdException;
import assetguard.store.EntityStore;
import assetguard.support.MutableClock;
import assetguard.support.TestSessions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SampleDataLoaderTest {

    private AssetGuardSession session;
    private EntityStore store;
    private MutableClock clock;

    @BeforeEach
    void setUp() throws Exception {
        clock = TestSessions.clock();
        session = TestSessions.open(clock);
        store = session.getStore();
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    @Test
    @DisplayName("the demo inventory loads with a consistent holder on every asset")
    void loadsDemoData() throws Exception {
        SampleDataLoader.load(store, clock);

        assertThat(store.listUsers()).hasSize(4);
        assertThat(store.listAssets()).hasSize(5).allSatisfy(asset ->
                assertThat(asset.getStatus() == AssetStatus.BORROWED).isEqualTo(asset.getCurrentHolder() != null));
        Asset camera = store.findAsset("AST-002").orElseThrow();
        assertThat(camera.getCurrentHolder()).isEqualTo("Alice Chen");
        assertThat(store.listTransactions()).extracting(Transaction::getId).containsExactly("TX-1001", "TX-1002");
        assertThat(store.findUserByName("Carol Admin")).get().extracting(User::getPassword).isEqualTo("123456");
        assertThat(store.listReservations()).hasSize(1);
    }

    @Test
    @DisplayName("the demo data raises no alerts until the loan runs past the threshold")
    void demoAlerts() throws Exception {
        SampleDataLoader.load(store, clock);
        assertThat(session.getNotificationCenter().getNotifications()).isEmpty();

        clock.advance(Duration.ofDays(6));
        assertThat(session.getNotificationCenter().refresh()).extracting(Notification::key).containsExactly("overdue-AST-002");
    }

    @Test
    @DisplayName("loading twice is refused")
    void loadTwice() throws Exception {
        SampleDataLoader.load(store, clock);

        assertThatThrownBy(() -> SampleDataLoader.load(store, clock)).isInstanceOf(DuplicateIdException.class);
    }
}
