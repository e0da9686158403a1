package kmsjwt.core.exception;

/**
 * Base type for every failure raised while issuing or verifying an
 * envelope-protected token.
 *
 * <p>Callers must treat any subclass as "token rejected". The {@link #failureType()}
 * lets operators tell infrastructure outages apart from security events and
 * client bugs.
 */
public abstract class EnvelopeTokenException extends RuntimeException {

    protected EnvelopeTokenException(String message) {
        super(message);
    }

    protected EnvelopeTokenException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract FailureType failureType();
}
