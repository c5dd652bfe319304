package assetguard.exception;

import assetguard.data.AssetStatus;
import assetguard.data.TransactionType;

/**
 * A lifecycle transition was requested for an asset whose status does not allow it.
 */
public class InvalidTransitionException extends AssetGuardException {
    private final String assetId;
    private final AssetStatus actualStatus;

    public InvalidTransitionException(String assetId, TransactionType type, AssetStatus requiredStatus, AssetStatus actualStatus) {
        super(String.format("Cannot %s asset %s: status is %s, expected %s.", type.getLabel().toLowerCase(), assetId, actualStatus, requiredStatus));
        this.assetId = assetId;
        this.actualStatus = actualStatus;
    }

    public String getAssetId() {
        return assetId;
    }

    public AssetStatus getActualStatus() {
        return actualStatus;
    }
}
