package assetguard.manager;

import assetguard.data.Transaction;
import assetguard.store.EntityStore;

import java.sql.SQLException;
import java.util.List;

/**
 * Read-only views of the ledger, newest entry first.
 */
public class LedgerService {

    private final EntityStore store;

    public LedgerService(EntityStore store) {
        this.store = store;
    }

    public List<Transaction> historyFor(String assetId) throws SQLException {
        return store.transactionsForAsset(assetId);
    }

    /**
     * Matches the asset name or user name, ignoring case. A blank term returns the whole ledger.
     */
    public List<Transaction> searchLedger(String term) throws SQLException {
        return store.searchTransactions(term);
    }

    public List<Transaction> allTransactions() throws SQLException {
        return store.listTransactions();
    }
}
