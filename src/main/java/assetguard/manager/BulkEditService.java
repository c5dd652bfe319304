package assetguard.manager;

import assetguard.data.Asset;
import assetguard.data.AssetPatch;
import assetguard.data.AssetStatus;
import assetguard.store.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.*;

public class BulkEditService {

    private static final Logger logger = LoggerFactory.getLogger(BulkEditService.class);

    private final EntityStore store;

    public BulkEditService(EntityStore store) {
        this.store = store;
    }

    /**
     * Applies the present fields of {@code patch} to every listed asset. Ids that match nothing are
     * skipped and reported. Each asset is written on its own, so a failure part way leaves the
     * earlier assets updated.
     *
     * @throws IllegalArgumentException if the patch would set Borrowed, which needs a holder
     */
    public BulkUpdateResult applyPatch(Collection<String> assetIds, AssetPatch patch) throws SQLException {
        if (patch.status() == AssetStatus.BORROWED) {
            throw new IllegalArgumentException("Bulk edits cannot set Borrowed; use the borrow flow instead.");
        }

        Set<String> requested = new LinkedHashSet<>(assetIds);
        List<String> notFound = new ArrayList<>();
        List<Asset> changed = new ArrayList<>();
        for (String id : requested) {
            Optional<Asset> existing = store.findAsset(id);
            if (existing.isEmpty()) {
                notFound.add(id);
                continue;
            }
            if (patch.isEmpty()) {
                continue;
            }
            Asset asset = new Asset(existing.get());
            if (patch.hasStatus()) {
                asset.setStatus(patch.status());
                if (patch.status() != AssetStatus.BORROWED) {
                    asset.setCurrentHolder(null);
                }
            }
            if (patch.hasCategory()) {
                asset.setCategory(patch.category().trim());
            }
            changed.add(asset);
        }

        List<String> vanished = store.updateAssets(changed);
        List<Asset> updated = new ArrayList<>();
        for (Asset asset : changed) {
            if (!vanished.contains(asset.getId())) {
                updated.add(asset);
            }
        }
        notFound.addAll(vanished);

        logger.info("Bulk edit applied to {} of {} assets ({} not found)", updated.size(), requested.size(), notFound.size());
        return new BulkUpdateResult(updated, notFound);
    }
}
