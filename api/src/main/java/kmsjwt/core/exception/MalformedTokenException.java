package kmsjwt.core.exception;

/**
 * Thrown when a serialized token cannot be parsed at all.
 */
public class MalformedTokenException extends EnvelopeTokenException {

    public MalformedTokenException(String message) {
        super(message);
    }

    public MalformedTokenException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureType failureType() {
        return FailureType.MALFORMED_TOKEN;
    }
}
