package kmsjwt.core.exception;

/**
 * Thrown when a custom claim uses the name of a standard claim.
 */
public class ClaimConflictException extends EnvelopeTokenException {

    public ClaimConflictException(String message) {
        super(message);
    }

    public ClaimConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureType failureType() {
        return FailureType.CLAIM_CONFLICT;
    }
}
