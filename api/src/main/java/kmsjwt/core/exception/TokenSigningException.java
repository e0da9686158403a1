package kmsjwt.core.exception;

/**
 * Thrown when a token cannot be signed with its data key.
 *
 * <p>Points at an unusable secret or a codec fault, not at the caller's input.
 */
public class TokenSigningException extends EnvelopeTokenException {

    public TokenSigningException(String message) {
        super(message);
    }

    public TokenSigningException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureType failureType() {
        return FailureType.SIGNING;
    }
}
