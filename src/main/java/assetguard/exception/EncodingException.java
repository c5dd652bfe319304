package assetguard.exception;

/**
 * Generating a single image payload (QR code, signature) failed.
 */
public class EncodingException extends AssetGuardException {
    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
