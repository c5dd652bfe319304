package assetguard.manager;

import assetguard.data.Asset;
import assetguard.data.AssetStatus;
import assetguard.data.Transaction;
import assetguard.data.TransactionType;
import assetguard.data.User;
import assetguard.exception.DuplicateIdException;
import assetguard.exception.InvalidTransitionException;
import assetguard.exception.NotFoundException;
import assetguard.store.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Clock;

/**
 * Borrow, return and maintenance logging. Each call writes the asset change and its ledger entry
 * together; direct status edits go through {@link AssetCatalogService} and leave no ledger entry.
 */
public class LifecycleService {

    private static final Logger logger = LoggerFactory.getLogger(LifecycleService.class);

    /** Recorded as the user id when the signer is not a registered user. */
    public static final String GUEST_USER_ID = "U-GUEST";

    private final EntityStore store;
    private final Clock clock;

    public LifecycleService(EntityStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public Transaction borrow(String assetId, String userName, String signature, String notes)
            throws NotFoundException, InvalidTransitionException, SQLException {
        String holder = requireUserName(userName);
        Asset asset = loadAsset(assetId);
        if (asset.getStatus() != AssetStatus.AVAILABLE) {
            throw new InvalidTransitionException(assetId, TransactionType.BORROW, AssetStatus.AVAILABLE, asset.getStatus());
        }

        Asset updated = new Asset(asset);
        updated.setStatus(AssetStatus.BORROWED);
        updated.setCurrentHolder(holder);
        Transaction tx = newTransaction(asset, holder, TransactionType.BORROW, signature, notes);
        commit(AssetStatus.AVAILABLE, updated, tx);

        logger.info("Asset {} borrowed by {} ({})", assetId, holder, tx.getId());
        return tx;
    }

    public Transaction returnAsset(String assetId, String userName, String signature, String notes)
            throws NotFoundException, InvalidTransitionException, SQLException {
        String signer = requireUserName(userName);
        Asset asset = loadAsset(assetId);
        if (asset.getStatus() != AssetStatus.BORROWED) {
            throw new InvalidTransitionException(assetId, TransactionType.RETURN, AssetStatus.BORROWED, asset.getStatus());
        }

        Asset updated = new Asset(asset);
        updated.setStatus(AssetStatus.AVAILABLE);
        updated.setCurrentHolder(null);
        Transaction tx = newTransaction(asset, signer, TransactionType.RETURN, signature, notes);
        commit(AssetStatus.BORROWED, updated, tx);

        logger.info("Asset {} returned by {} ({})", assetId, signer, tx.getId());
        return tx;
    }

    /**
     * Appends a maintenance entry. The asset's status and holder are left alone.
     */
    public Transaction logMaintenance(String assetId, String userName, String notes) throws NotFoundException, SQLException {
        String signer = requireUserName(userName);
        Asset asset = loadAsset(assetId);
        Transaction tx = newTransaction(asset, signer, TransactionType.MAINTENANCE_LOG, "", notes);
        try {
            store.appendTransaction(tx);
        } catch (DuplicateIdException e) {
            throw new IllegalStateException("Generated transaction id collided: " + tx.getId(), e);
        }
        logger.info("Maintenance logged for asset {} by {}", assetId, signer);
        return tx;
    }

    private void commit(AssetStatus expected, Asset updated, Transaction tx)
            throws NotFoundException, InvalidTransitionException, SQLException {
        try {
            store.recordTransition(expected, updated, tx);
        } catch (DuplicateIdException e) {
            throw new IllegalStateException("Generated transaction id collided: " + tx.getId(), e);
        }
    }

    private Asset loadAsset(String assetId) throws NotFoundException, SQLException {
        return store.findAsset(assetId).orElseThrow(() -> new NotFoundException("Asset", assetId));
    }

    private Transaction newTransaction(Asset asset, String userName, TransactionType type, String signature, String notes) throws SQLException {
        String userId = store.findUserByName(userName).map(User::getId).orElse(GUEST_USER_ID);
        return new Transaction(IdGenerator.transactionId(), asset.getId(), asset.getName(), userId, userName, type, nextTimestamp(), signature, notes);
    }

    // ledger timestamps never go backwards, even if the wall clock does
    private long nextTimestamp() throws SQLException {
        long now = clock.millis();
        long latest = store.latestTransactionTimestamp().orElse(now);
        return Math.max(now, latest);
    }

    private static String requireUserName(String userName) {
        if (userName == null || userName.isBlank()) {
            throw new IllegalArgumentException("A user name is required.");
        }
        return userName.trim();
    }
}
