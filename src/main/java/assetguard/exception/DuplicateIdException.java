package assetguard.exception;

public class DuplicateIdException extends AssetGuardException {
    private final String entityId;

    public DuplicateIdException(String entityType, String entityId) {
        super(entityType + " id already exists: " + entityId);
        this.entityId = entityId;
    }

    public String getEntityId() {
        return entityId;
    }
}
