package assetguard.manager;

import assetguard.AssetGuardSession;
import assetguard.data.Asset;
import assetguard.data.AssetFilter;
import assetguard.data.AssetStatus;
import assetguard.exception.DuplicateIdException;
import assetguard.exception.NotFoundException;
import assetguard.support.TestSessions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AssetCatalogServiceTest {

    private AssetGuardSession session;
    private AssetCatalogService catalog;

    @BeforeEach
    void setUp() throws Exception {
        session = TestSessions.open(TestSessions.clock());
        catalog = session.getCatalogService();
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    @Test
    @DisplayName("a bare draft is completed with defaults, a generated id and a QR reference")
    void addWithDefaults() throws Exception {
        Asset draft = new Asset();
        draft.setName("  Portable SSD ");

        Asset stored = catalog.addAsset(draft);

        assertThat(stored.getId()).matches("AST-[0-9A-F]{8}");
        assertThat(stored.getName()).isEqualTo("Portable SSD");
        assertThat(stored.getCategory()).isEqualTo("General");
        assertThat(stored.getModel()).isEqualTo("Standard");
        assertThat(stored.getSerialNumber()).isEqualTo("N/A");
        assertThat(stored.getPurchaseDate()).isEqualTo("2026-03-10");
        assertThat(stored.getImageUrl()).startsWith("https://picsum.photos/400/300?random=");
        assertThat(stored.getQrCode()).isEqualTo("qr-" + stored.getId());
        assertThat(stored.getStatus()).isEqualTo(AssetStatus.AVAILABLE);
        assertThat(draft.getId()).isNull();
    }

    @Test
    @DisplayName("blank feature names are dropped when saving")
    void cleansFeatureKeys() throws Exception {
        Asset draft = new Asset();
        draft.setName("MacBook Pro");
        Map<String, String> features = new HashMap<>();
        features.put(" RAM ", "64GB");
        features.put("  ", "ignored");
        draft.setCustomFeatures(features);

        Asset stored = catalog.addAsset(draft);

        assertThat(stored.getCustomFeatures()).containsExactly(Map.entry("RAM", "64GB"));
    }

    @Test
    @DisplayName("a name is required")
    void nameRequired() {
        assertThatThrownBy(() -> catalog.addAsset(new Asset())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("an explicit id that already exists is rejected")
    void explicitDuplicateId() throws Exception {
        catalog.addAsset(TestSessions.asset("AST-001", "MacBook Pro", "Laptop", AssetStatus.AVAILABLE));

        assertThatThrownBy(() -> catalog.addAsset(TestSessions.asset("AST-001", "Other", "Laptop", AssetStatus.AVAILABLE)))
                .isInstanceOf(DuplicateIdException.class);
    }

    @Test
    @DisplayName("editing may set Lost directly and leaves the ledger alone")
    void editToLost() throws Exception {
        Asset stored = catalog.addAsset(TestSessions.asset("AST-001", "MacBook Pro", "Laptop", AssetStatus.AVAILABLE));
        stored.setStatus(AssetStatus.LOST);
        stored.setDescription("Left on a train");

        Asset edited = catalog.editAsset(stored);

        assertThat(edited.getStatus()).isEqualTo(AssetStatus.LOST);
        assertThat(edited.getDescription()).isEqualTo("Left on a train");
        assertThat(session.getStore().listTransactions()).isEmpty();
    }

    @Test
    @DisplayName("editing an asset that does not exist fails")
    void editUnknown() {
        assertThatThrownBy(() -> catalog.editAsset(TestSessions.asset("AST-404", "Ghost", "X", AssetStatus.AVAILABLE)))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("search and categories read through to the store")
    void searchAndCategories() throws Exception {
        catalog.addAsset(TestSessions.asset("AST-001", "MacBook Pro", "Laptop", AssetStatus.AVAILABLE));
        catalog.addAsset(TestSessions.asset("AST-002", "Sony Alpha a7 IV", "Camera", AssetStatus.AVAILABLE));
        catalog.addAsset(TestSessions.asset("AST-003", "ThinkPad", "Laptop", AssetStatus.AVAILABLE));

        assertThat(catalog.categories()).containsExactly("Camera", "Laptop");
        assertThat(catalog.search(AssetFilter.all().withSearchTerm("sony"))).extracting(Asset::getId).containsExactly("AST-002");
    }

    @Test
    @DisplayName("feature keys across assets are collected once and sorted")
    void featureKeys() {
        Asset a = new Asset();
        a.setCustomFeatures(Map.of("RAM", "16GB", "Color", "Silver"));
        Asset b = new Asset();
        b.setCustomFeatures(Map.of("Battery", "90%", "RAM", "8GB"));

        assertThat(AssetCatalogService.customFeatureKeys(List.of(a, b))).containsExactly("Battery", "Color", "RAM");
    }
}
