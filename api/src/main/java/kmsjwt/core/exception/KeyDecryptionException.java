package kmsjwt.core.exception;

/**
 * Thrown when the key-management service refuses or fails to decrypt the data key
 * ciphertext carried by a token.
 *
 * <p>This is a key-resolution failure and is never reported as an invalid signature.
 */
public class KeyDecryptionException extends EnvelopeTokenException {

    public KeyDecryptionException(String message) {
        super(message);
    }

    public KeyDecryptionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureType failureType() {
        return FailureType.KEY_DECRYPTION;
    }
}
