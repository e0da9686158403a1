package kmsjwt.core.port.in;

import kmsjwt.core.port.out.DataKeyCache;

/**
 * Whether token verification may use a cache for plaintext data keys.
 *
 * <p>{@link None} always decrypts through the key-management service.
 * {@link Using} consults the given cache first.
 */
public sealed interface KeyCacheOption {

    static KeyCacheOption none() {
        return None.INSTANCE;
    }

    static KeyCacheOption using(DataKeyCache cache) {
        return new Using(cache);
    }

    /**
     * No cache: every verification decrypts the data key.
     */
    final class None implements KeyCacheOption {
        private static final None INSTANCE = new None();

        private None() {}

        @Override
        public String toString() {
            return "KeyCacheOption.none";
        }
    }

    /**
     * Cache plaintext data keys until their token expires.
     *
     * @param cache the cache backend
     */
    record Using(DataKeyCache cache) implements KeyCacheOption {
        public Using {
            if (cache == null) {
                throw new IllegalArgumentException("Cache cannot be null");
            }
        }
    }
}
