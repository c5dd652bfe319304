package assetguard.store;

public enum EntityKind {
    ASSET,
    TRANSACTION,
    USER,
    RESERVATION
}
