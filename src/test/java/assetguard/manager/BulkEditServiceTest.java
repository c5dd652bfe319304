package assetguard.manager;

import assetguard.AssetGuardSession;
import assetguard.data.Asset;
import assetguard.data.AssetPatch;
import assetguard.data.AssetStatus;
import assetguard.store.EntityStore;
import assetguard.store.StoreChangeEvent;
import assetguard.support.TestSessions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BulkEditServiceTest {

    private AssetGuardSession session;
    private EntityStore store;
    private BulkEditService bulkEditService;

    @BeforeEach
    void setUp() throws Exception {
        session = TestSessions.open(TestSessions.clock());
        store = session.getStore();
        bulkEditService = session.getBulkEditService();

        store.insertAsset(TestSessions.asset("AST-001", "MacBook Pro", "Laptop", AssetStatus.AVAILABLE));
        store.insertAsset(TestSessions.borrowedAsset("AST-002", "Sony Alpha a7 IV", "Alice Chen"));
        store.insertAsset(TestSessions.asset("AST-003", "DJI Mavic 3 Pro", "Drone", AssetStatus.MAINTENANCE));
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    @Test
    @DisplayName("a status patch updates the found assets and reports the missing id")
    void statusPatchWithMissingId() throws Exception {
        BulkUpdateResult result = bulkEditService.applyPatch(List.of("AST-001", "AST-404", "AST-003"), AssetPatch.status(AssetStatus.MAINTENANCE));

        assertThat(result.updatedCount()).isEqualTo(2);
        assertThat(result.updated()).extracting(Asset::getId).containsExactly("AST-001", "AST-003");
        assertThat(result.notFound()).containsExactly("AST-404");
        assertThat(store.findAsset("AST-001").orElseThrow().getStatus()).isEqualTo(AssetStatus.MAINTENANCE);
    }

    @Test
    @DisplayName("moving a borrowed asset out of Borrowed clears its holder")
    void leavingBorrowedClearsHolder() throws Exception {
        bulkEditService.applyPatch(List.of("AST-002"), AssetPatch.status(AssetStatus.AVAILABLE));

        Asset asset = store.findAsset("AST-002").orElseThrow();
        assertThat(asset.getStatus()).isEqualTo(AssetStatus.AVAILABLE);
        assertThat(asset.getCurrentHolder()).isNull();
    }

    @Test
    @DisplayName("a bulk patch cannot set Borrowed")
    void borrowedRejected() throws Exception {
        assertThatThrownBy(() -> bulkEditService.applyPatch(List.of("AST-001"), AssetPatch.status(AssetStatus.BORROWED)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.findAsset("AST-001").orElseThrow().getStatus()).isEqualTo(AssetStatus.AVAILABLE);
    }

    @Test
    @DisplayName("a category patch keeps status and holder")
    void categoryPatch() throws Exception {
        BulkUpdateResult result = bulkEditService.applyPatch(List.of("AST-001", "AST-002"), AssetPatch.category("  Field Kit "));

        assertThat(result.notFound()).isEmpty();
        Asset borrowed = store.findAsset("AST-002").orElseThrow();
        assertThat(borrowed.getCategory()).isEqualTo("Field Kit");
        assertThat(borrowed.getStatus()).isEqualTo(AssetStatus.BORROWED);
        assertThat(borrowed.getCurrentHolder()).isEqualTo("Alice Chen");
        assertThat(store.findAsset("AST-001").orElseThrow().getCategory()).isEqualTo("Field Kit");
    }

    @Test
    @DisplayName("a whole selection raises a single change event and duplicates are applied once")
    void singleEventForSelection() throws Exception {
        List<StoreChangeEvent> events = new ArrayList<>();
        store.addListener(events::add);

        BulkUpdateResult result = bulkEditService.applyPatch(List.of("AST-001", "AST-003", "AST-001"), AssetPatch.status(AssetStatus.LOST));

        assertThat(result.updatedCount()).isEqualTo(2);
        assertThat(events).hasSize(1);
        assertThat(session.getNotificationCenter().getNotifications()).hasSize(2);
    }

    @Test
    @DisplayName("an empty patch changes nothing but still reports missing ids")
    void emptyPatch() throws Exception {
        BulkUpdateResult result = bulkEditService.applyPatch(List.of("AST-001", "AST-404"), new AssetPatch(null, " "));

        assertThat(result.updated()).isEmpty();
        assertThat(result.notFound()).containsExactly("AST-404");
    }
}
