package assetguard.exception;

/**
 * Base type for the recoverable, caller-facing failures of the inventory core.
 */
public class AssetGuardException extends Exception {
    public AssetGuardException(String message) {
        super(message);
    }

    public AssetGuardException(String message, Throwable cause) {
        super(message, cause);
    }
}
