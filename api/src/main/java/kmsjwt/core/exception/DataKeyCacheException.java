package kmsjwt.core.exception;

/**
 * Thrown when the data key cache backend fails on lookup or store.
 */
public class DataKeyCacheException extends EnvelopeTokenException {

    public DataKeyCacheException(String message) {
        super(message);
    }

    public DataKeyCacheException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureType failureType() {
        return FailureType.CACHE_FAILURE;
    }
}
