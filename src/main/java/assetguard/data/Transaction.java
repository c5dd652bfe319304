package assetguard.data;

import java.util.Objects;

/**
 * One ledger entry. Asset and user names are copied in when the entry is written and are
 * never refreshed afterwards, so a later rename leaves history untouched.
 */
public class Transaction {
    private final String id;
    private final String assetId;
    private final String assetName;
    private final String userId;
    private final String userName;
    private final TransactionType type;
    private final long timestamp;
    private final String signature;
    private final String notes;

    public Transaction(String id, String assetId, String assetName, String userId, String userName, TransactionType type, long timestamp, String signature, String notes) {
        this.id = Objects.requireNonNull(id, "id");
        this.assetId = Objects.requireNonNull(assetId, "assetId");
        this.assetName = assetName;
        this.userId = userId;
        this.userName = userName;
        this.type = Objects.requireNonNull(type, "type");
        this.timestamp = timestamp;
        this.signature = signature == null ? "" : signature;
        this.notes = notes;
    }

    public String getId() {
        return id;
    }

    public String getAssetId() {
        return assetId;
    }

    public String getAssetName() {
        return assetName;
    }

    public String getUserId() {
        return userId;
    }

    public String getUserName() {
        return userName;
    }

    public TransactionType getType() {
        return type;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public String getSignature() {
        return signature;
    }

    public String getNotes() {
        return notes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Transaction other = (Transaction) o;
        return timestamp == other.timestamp && id.equals(other.id) && assetId.equals(other.assetId)
                && Objects.equals(assetName, other.assetName) && Objects.equals(userId, other.userId)
                && Objects.equals(userName, other.userName) && type == other.type
                && signature.equals(other.signature) && Objects.equals(notes, other.notes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, assetId, assetName, userId, userName, type, timestamp, signature, notes);
    }

    @Override
    public String toString() {
        return "Transaction{id='" + id + "', assetId='" + assetId + "', type=" + type + ", userName='" + userName + "', timestamp=" + timestamp + "}";
    }
}
