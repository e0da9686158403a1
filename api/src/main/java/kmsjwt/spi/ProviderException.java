package kmsjwt.spi;

/**
 * Exception thrown when a key-management or cache provider cannot be selected
 * or fails to initialize.
 */
public class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
