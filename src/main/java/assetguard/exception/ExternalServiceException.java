package assetguard.exception;

/**
 * The AI insight collaborator could not be reached or returned an error.
 */
public class ExternalServiceException extends AssetGuardException {
    public ExternalServiceException(String message) {
        super(message);
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
