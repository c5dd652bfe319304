package assetguard.exception;

/**
 * A referenced id does not exist. Lookups return an empty Optional instead; this is raised by
 * operations that must act on an existing record.
 */
public class NotFoundException extends AssetGuardException {
    private final String entityId;

    public NotFoundException(String entityType, String entityId) {
        super(entityType + " not found: " + entityId);
        this.entityId = entityId;
    }

    public String getEntityId() {
        return entityId;
    }
}
