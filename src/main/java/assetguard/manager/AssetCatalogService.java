package assetguard.manager;

import assetguard.data.Asset;
import assetguard.data.AssetFilter;
import assetguard.exception.DuplicateIdException;
import assetguard.exception.NotFoundException;
import assetguard.store.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.*;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Single-asset registration and editing, plus the queries behind the asset list.
 * <p>
 * {@link #editAsset(Asset)} is the direct edit path: it may set any status, Lost included, and
 * writes no ledger entry.
 */
public class AssetCatalogService {

    private static final Logger logger = LoggerFactory.getLogger(AssetCatalogService.class);

    public static final String DEFAULT_CATEGORY = "General";
    public static final String DEFAULT_MODEL = "Standard";
    public static final String DEFAULT_SERIAL = "N/A";

    private final EntityStore store;
    private final Clock clock;

    public AssetCatalogService(EntityStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Registers a new asset built from {@code draft}. Missing fields get defaults and a missing id
     * is generated. The draft itself is not modified.
     *
     * @return the asset as stored
     */
    public Asset addAsset(Asset draft) throws DuplicateIdException, SQLException {
        if (isBlank(draft.getName())) {
            throw new IllegalArgumentException("Asset name is required.");
        }
        Asset asset = new Asset(draft);
        asset.setId(isBlank(draft.getId()) ? IdGenerator.assetId() : draft.getId().trim());
        asset.setName(draft.getName().trim());
        asset.setCategory(orDefault(draft.getCategory(), DEFAULT_CATEGORY));
        asset.setModel(orDefault(draft.getModel(), DEFAULT_MODEL));
        asset.setSerialNumber(orDefault(draft.getSerialNumber(), DEFAULT_SERIAL));
        asset.setPurchaseDate(orDefault(draft.getPurchaseDate(), LocalDate.now(clock).toString()));
        asset.setImageUrl(orDefault(draft.getImageUrl(), placeholderImageUrl()));
        asset.setQrCode(Asset.qrCodeFor(asset.getId()));
        asset.setCustomFeatures(cleanFeatures(draft.getCustomFeatures()));

        store.insertAsset(asset);
        logger.info("Asset {} registered: {}", asset.getId(), asset.getName());
        return store.findAsset(asset.getId()).orElse(asset);
    }

    public Asset editAsset(Asset asset) throws NotFoundException, SQLException {
        if (isBlank(asset.getName())) {
            throw new IllegalArgumentException("Asset name is required.");
        }
        Asset edited = new Asset(asset);
        if (isBlank(edited.getQrCode())) {
            edited.setQrCode(Asset.qrCodeFor(edited.getId()));
        }
        edited.setCustomFeatures(cleanFeatures(asset.getCustomFeatures()));

        store.updateAsset(edited);
        logger.info("Asset {} edited (status {})", edited.getId(), edited.getStatus());
        return store.findAsset(edited.getId()).orElseThrow(() -> new NotFoundException("Asset", edited.getId()));
    }

    public Optional<Asset> findAsset(String id) throws SQLException {
        return store.findAsset(id);
    }

    public List<Asset> listAssets() throws SQLException {
        return store.listAssets();
    }

    public List<Asset> search(AssetFilter filter) throws SQLException {
        return store.findAssets(filter);
    }

    public List<String> categories() throws SQLException {
        return store.assetCategories();
    }

    /**
     * Distinct custom-feature names across {@code assets}, sorted.
     */
    public static List<String> customFeatureKeys(Collection<Asset> assets) {
        SortedSet<String> keys = new TreeSet<>();
        for (Asset asset : assets) {
            keys.addAll(asset.getCustomFeatures().keySet());
        }
        return new ArrayList<>(keys);
    }

    static String placeholderImageUrl() {
        return "https://picsum.photos/400/300?random=" + ThreadLocalRandom.current().nextInt(1000);
    }

    private static Map<String, String> cleanFeatures(Map<String, String> features) {
        Map<String, String> cleaned = new LinkedHashMap<>();
        features.forEach((key, value) -> {
            if (!isBlank(key)) {
                cleaned.put(key.trim(), value == null ? "" : value);
            }
        });
        return cleaned;
    }

    private static String orDefault(String value, String fallback) {
        return isBlank(value) ? fallback : value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
