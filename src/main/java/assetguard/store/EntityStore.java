package assetguard.store;

import assetguard.dao.AssetDAO;
import assetguard.dao.ReservationDAO;
import assetguard.dao.TransactionDAO;
import assetguard.dao.UserDAO;
import assetguard.data.*;
import assetguard.db.DatabaseConnection;
import assetguard.exception.DuplicateIdException;
import assetguard.exception.InvalidTransitionException;
import assetguard.exception.NotFoundException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The canonical collections of assets, users, ledger transactions and reservations.
 * <p>
 * Every successful write notifies the registered {@link StoreChangeListener}s after it has been
 * committed. Ids are unique per kind and never reassigned; a colliding insert fails with
 * {@link DuplicateIdException}. Assets always satisfy the holder rule: a holder is present exactly
 * when the status is Borrowed.
 */
public class EntityStore {

    private static final Logger logger = LoggerFactory.getLogger(EntityStore.class);
    private static final String UNIQUE_VIOLATION = "23505";

    private final DatabaseConnection database;
    private final AssetDAO assetDAO;
    private final TransactionDAO transactionDAO;
    private final UserDAO userDAO;
    private final ReservationDAO reservationDAO;
    private final List<StoreChangeListener> listeners = new CopyOnWriteArrayList<>();

    public EntityStore(DatabaseConnection database, ObjectMapper objectMapper) {
        this.database = database;
        this.assetDAO = new AssetDAO(database, objectMapper);
        this.transactionDAO = new TransactionDAO(database);
        this.userDAO = new UserDAO(database);
        this.reservationDAO = new ReservationDAO(database);
    }

    public void addListener(StoreChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    public void removeListener(StoreChangeListener listener) {
        listeners.remove(listener);
    }

    // --- Assets ---

    public Optional<Asset> findAsset(String id) throws SQLException {
        return assetDAO.findById(id);
    }

    public List<Asset> listAssets() throws SQLException {
        return assetDAO.findAll();
    }

    public List<Asset> findAssets(AssetFilter filter) throws SQLException {
        return assetDAO.findByFilter(filter);
    }

    public List<String> assetCategories() throws SQLException {
        return assetDAO.findDistinctCategories();
    }

    public Map<AssetStatus, Integer> countAssetsByStatus() throws SQLException {
        return assetDAO.countByStatus();
    }

    public Map<String, Integer> countAssetsByCategory() throws SQLException {
        return assetDAO.countByCategory();
    }

    public void insertAsset(Asset asset) throws DuplicateIdException, SQLException {
        Asset normalized = withHolderRule(asset);
        try (Connection conn = database.getInventoryConnection()) {
            if (assetDAO.exists(conn, normalized.getId())) {
                throw new DuplicateIdException("Asset", normalized.getId());
            }
            assetDAO.insert(conn, normalized);
        } catch (SQLException e) {
            throw uniqueViolationOr(e, "Asset", normalized.getId());
        }
        fireChange(StoreChangeEvent.of(EntityKind.ASSET, normalized.getId()));
    }

    /**
     * Replaces the stored asset with the same id. Nothing changes when the id is unknown.
     */
    public void updateAsset(Asset asset) throws NotFoundException, SQLException {
        Asset normalized = withHolderRule(asset);
        int rows;
        try (Connection conn = database.getInventoryConnection()) {
            rows = assetDAO.update(conn, normalized);
        }
        if (rows == 0) {
            throw new NotFoundException("Asset", normalized.getId());
        }
        fireChange(StoreChangeEvent.of(EntityKind.ASSET, normalized.getId()));
    }

    /**
     * Replaces each asset by id, one row at a time. Unknown ids are skipped. A single change event
     * covers every row that was written.
     *
     * @return the ids that did not match a stored asset, in input order
     */
    public List<String> updateAssets(Collection<Asset> assets) throws SQLException {
        List<Asset> normalized = new ArrayList<>();
        for (Asset asset : assets) {
            normalized.add(withHolderRule(asset));
        }
        List<String> written = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        try (Connection conn = database.getInventoryConnection()) {
            for (Asset asset : normalized) {
                if (assetDAO.update(conn, asset) > 0) {
                    written.add(asset.getId());
                } else {
                    missing.add(asset.getId());
                }
            }
        } finally {
            if (!written.isEmpty()) {
                fireChange(StoreChangeEvent.of(EntityKind.ASSET, written));
            }
        }
        return missing;
    }

    /**
     * Moves an asset to a new lifecycle status and appends the matching ledger entry in one database
     * transaction. The asset row is only written if its status is still {@code expectedStatus}; only
     * its status and holder change.
     *
     * @throws NotFoundException          if the asset does not exist
     * @throws InvalidTransitionException if the asset is no longer in {@code expectedStatus}
     * @throws DuplicateIdException       if the transaction id is already in the ledger
     */
    public void recordTransition(AssetStatus expectedStatus, Asset updatedAsset, Transaction transaction)
            throws NotFoundException, InvalidTransitionException, DuplicateIdException, SQLException {
        Asset normalized = withHolderRule(updatedAsset);
        String assetId = normalized.getId();

        Connection conn = null;
        try {
            conn = database.getInventoryConnection();
            conn.setAutoCommit(false);

            if (transactionDAO.exists(conn, transaction.getId())) {
                throw new DuplicateIdException("Transaction", transaction.getId());
            }
            int rows = assetDAO.updateLifecycle(conn, assetId, expectedStatus, normalized.getStatus(), normalized.getCurrentHolder());
            if (rows == 0) {
                Optional<AssetStatus> actual = assetDAO.findStatus(conn, assetId);
                if (actual.isEmpty()) {
                    throw new NotFoundException("Asset", assetId);
                }
                throw new InvalidTransitionException(assetId, transaction.getType(), expectedStatus, actual.get());
            }
            transactionDAO.insert(conn, transaction);
            conn.commit();
        } catch (SQLException e) {
            if (conn != null) conn.rollback();
            throw e;
        } finally {
            if (conn != null) {
                conn.setAutoCommit(true);
                conn.close();
            }
        }
        logger.debug("Recorded {} {} for asset {}", transaction.getType(), transaction.getId(), assetId);
        fireChange(StoreChangeEvent.of(EnumSet.of(EntityKind.ASSET, EntityKind.TRANSACTION), List.of(assetId, transaction.getId())));
    }

    // --- Ledger ---

    public Optional<Transaction> findTransaction(String id) throws SQLException {
        return transactionDAO.findById(id);
    }

    /**
     * The whole ledger, newest first.
     */
    public List<Transaction> listTransactions() throws SQLException {
        return transactionDAO.findAll();
    }

    public List<Transaction> transactionsForAsset(String assetId) throws SQLException {
        return transactionDAO.findByAssetId(assetId);
    }

    public List<Transaction> searchTransactions(String term) throws SQLException {
        return transactionDAO.search(term);
    }

    public List<Transaction> recentTransactions(int limit) throws SQLException {
        return transactionDAO.findRecent(limit);
    }

    public OptionalLong latestTransactionTimestamp() throws SQLException {
        return transactionDAO.findLatestTimestamp();
    }

    /**
     * Appends a ledger entry without touching the asset. Used for maintenance logs.
     */
    public void appendTransaction(Transaction transaction) throws DuplicateIdException, SQLException {
        try (Connection conn = database.getInventoryConnection()) {
            if (transactionDAO.exists(conn, transaction.getId())) {
                throw new DuplicateIdException("Transaction", transaction.getId());
            }
            transactionDAO.insert(conn, transaction);
        } catch (SQLException e) {
            throw uniqueViolationOr(e, "Transaction", transaction.getId());
        }
        fireChange(StoreChangeEvent.of(EntityKind.TRANSACTION, transaction.getId()));
    }

    // --- Users ---

    public Optional<User> findUser(String id) throws SQLException {
        return userDAO.findById(id);
    }

    public Optional<User> findUserByName(String name) throws SQLException {
        return userDAO.findByName(name);
    }

    public List<User> listUsers() throws SQLException {
        return userDAO.findAll();
    }

    public List<User> searchUsers(String term) throws SQLException {
        return userDAO.search(term);
    }

    public void insertUser(User user) throws DuplicateIdException, SQLException {
        try (Connection conn = database.getInventoryConnection()) {
            if (userDAO.exists(conn, user.getId())) {
                throw new DuplicateIdException("User", user.getId());
            }
            userDAO.insert(conn, user);
        } catch (SQLException e) {
            throw uniqueViolationOr(e, "User", user.getId());
        }
        fireChange(StoreChangeEvent.of(EntityKind.USER, user.getId()));
    }

    public void updateUser(User user) throws NotFoundException, SQLException {
        int rows;
        try (Connection conn = database.getInventoryConnection()) {
            rows = userDAO.update(conn, user);
        }
        if (rows == 0) {
            throw new NotFoundException("User", user.getId());
        }
        fireChange(StoreChangeEvent.of(EntityKind.USER, user.getId()));
    }

    // --- Reservations ---

    public Optional<Reservation> findReservation(String id) throws SQLException {
        return reservationDAO.findById(id);
    }

    public List<Reservation> listReservations() throws SQLException {
        return reservationDAO.findAll();
    }

    public List<Reservation> reservationsForAsset(String assetId) throws SQLException {
        return reservationDAO.findByAssetId(assetId);
    }

    public void insertReservation(Reservation reservation) throws DuplicateIdException, SQLException {
        try (Connection conn = database.getInventoryConnection()) {
            if (reservationDAO.exists(conn, reservation.getId())) {
                throw new DuplicateIdException("Reservation", reservation.getId());
            }
            reservationDAO.insert(conn, reservation);
        } catch (SQLException e) {
            throw uniqueViolationOr(e, "Reservation", reservation.getId());
        }
        fireChange(StoreChangeEvent.of(EntityKind.RESERVATION, reservation.getId()));
    }

    public void updateReservation(Reservation reservation) throws NotFoundException, SQLException {
        int rows;
        try (Connection conn = database.getInventoryConnection()) {
            rows = reservationDAO.update(conn, reservation);
        }
        if (rows == 0) {
            throw new NotFoundException("Reservation", reservation.getId());
        }
        fireChange(StoreChangeEvent.of(EntityKind.RESERVATION, reservation.getId()));
    }

    // --- Internals ---

    /**
     * Returns a copy that satisfies the holder rule: any status other than Borrowed drops the holder,
     * and Borrowed without a holder is refused.
     */
    static Asset withHolderRule(Asset asset) {
        Objects.requireNonNull(asset.getId(), "asset id");
        Objects.requireNonNull(asset.getStatus(), "asset status");
        Asset copy = new Asset(asset);
        if (copy.getStatus() == AssetStatus.BORROWED) {
            if (!copy.hasHolder()) {
                throw new IllegalArgumentException("Asset " + copy.getId() + " cannot be Borrowed without a holder.");
            }
        } else {
            copy.setCurrentHolder(null);
        }
        return copy;
    }

    private static SQLException uniqueViolationOr(SQLException e, String entityType, String id) throws DuplicateIdException {
        // two writers raced past the existence check
        if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
            throw new DuplicateIdException(entityType, id);
        }
        return e;
    }

    private void fireChange(StoreChangeEvent event) {
        for (StoreChangeListener listener : listeners) {
            try {
                listener.onStoreChanged(event);
            } catch (RuntimeException e) {
                logger.error("Store change listener {} failed for {}", listener, event, e);
            }
        }
    }
}
