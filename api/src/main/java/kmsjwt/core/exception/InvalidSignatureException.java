package kmsjwt.core.exception;

/**
 * Thrown when the signature does not verify with a successfully resolved data key.
 */
public class InvalidSignatureException extends EnvelopeTokenException {

    public InvalidSignatureException(String message) {
        super(message);
    }

    public InvalidSignatureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureType failureType() {
        return FailureType.INVALID_SIGNATURE;
    }
}
