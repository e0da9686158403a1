package kmsjwt.core.exception;

/**
 * Thrown when the key-management service refuses or fails to produce a data key.
 *
 * <p>Fatal for the issuance attempt. Not retried here.
 */
public class KeyGenerationException extends EnvelopeTokenException {

    public KeyGenerationException(String message) {
        super(message);
    }

    public KeyGenerationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureType failureType() {
        return FailureType.KEY_GENERATION;
    }
}
