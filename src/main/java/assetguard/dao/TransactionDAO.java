package assetguard.dao;

import assetguard.data.Transaction;
import assetguard.data.TransactionType;
import assetguard.db.DatabaseConnection;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Append-only access to the ledger: there is no update or delete.
 * Every list comes back newest first, with later inserts ahead on equal timestamps.
 */
public class TransactionDAO {

    private static final String SELECT_COLUMNS = "SELECT id, asset_id, asset_name, user_id, user_name, tx_type, tx_timestamp, signature, notes FROM ledger_transactions";
    private static final String LEDGER_ORDER = " ORDER BY tx_timestamp DESC, seq DESC";

    private final DatabaseConnection database;

    public TransactionDAO(DatabaseConnection database) {
        this.database = database;
    }

    public void insert(Connection conn, Transaction tx) throws SQLException {
        String sql = "INSERT INTO ledger_transactions (id, asset_id, asset_name, user_id, user_name, tx_type, tx_timestamp, signature, notes) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, tx.getId());
            stmt.setString(2, tx.getAssetId());
            stmt.setString(3, tx.getAssetName());
            stmt.setString(4, tx.getUserId());
            stmt.setString(5, tx.getUserName());
            stmt.setString(6, tx.getType().getLabel());
            stmt.setLong(7, tx.getTimestamp());
            stmt.setString(8, tx.getSignature());
            stmt.setString(9, tx.getNotes());
            stmt.executeUpdate();
        }
    }

    public boolean exists(Connection conn, String id) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("SELECT 1 FROM ledger_transactions WHERE id = ?")) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    public Optional<Transaction> findById(String id) throws SQLException {
        List<Transaction> found = query(SELECT_COLUMNS + " WHERE id = ?", id);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    public List<Transaction> findAll() throws SQLException {
        return query(SELECT_COLUMNS + LEDGER_ORDER);
    }

    public List<Transaction> findByAssetId(String assetId) throws SQLException {
        return query(SELECT_COLUMNS + " WHERE asset_id = ?" + LEDGER_ORDER, assetId);
    }

    public List<Transaction> findRecent(int limit) throws SQLException {
        return query(SELECT_COLUMNS + LEDGER_ORDER + " LIMIT " + Math.max(0, limit));
    }

    public List<Transaction> search(String term) throws SQLException {
        String trimmed = term == null ? "" : term.trim();
        if (trimmed.isEmpty()) {
            return findAll();
        }
        String pattern = "%" + trimmed.toLowerCase(Locale.ROOT).replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_") + "%";
        return query(SELECT_COLUMNS + " WHERE LOWER(asset_name) LIKE ? ESCAPE '\\' OR LOWER(user_name) LIKE ? ESCAPE '\\'" + LEDGER_ORDER, pattern, pattern);
    }

    public OptionalLong findLatestTimestamp() throws SQLException {
        String sql = "SELECT MAX(tx_timestamp) FROM ledger_transactions";
        try (Connection conn = database.getInventoryConnection(); PreparedStatement stmt = conn.prepareStatement(sql); ResultSet rs = stmt.executeQuery()) {
            if (rs.next()) {
                long latest = rs.getLong(1);
                if (!rs.wasNull()) {
                    return OptionalLong.of(latest);
                }
            }
        }
        return OptionalLong.empty();
    }

    private List<Transaction> query(String sql, String... params) throws SQLException {
        List<Transaction> transactions = new ArrayList<>();
        try (Connection conn = database.getInventoryConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setString(i + 1, params[i]);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    transactions.add(mapRowToTransaction(rs));
                }
            }
        }
        return transactions;
    }

    private Transaction mapRowToTransaction(ResultSet rs) throws SQLException {
        return new Transaction(
                rs.getString("id"),
                rs.getString("asset_id"),
                rs.getString("asset_name"),
                rs.getString("user_id"),
                rs.getString("user_name"),
                TransactionType.fromLabel(rs.getString("tx_type")),
                rs.getLong("tx_timestamp"),
                rs.getString("signature"),
                rs.getString("notes"));
    }
}
