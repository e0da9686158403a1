package kmsjwt.spi;

import kmsjwt.core.config.EnvelopeTokenConfig.CacheConfig;
import kmsjwt.core.port.out.DataKeyCache;

/**
 * Service Provider Interface for plaintext data key caches.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}.
 * Caching is optional; without it every verification decrypts through the
 * key-management service.
 *
 * <h2>Configuration</h2>
 * <pre>
 * kmsjwt.cache.enabled=true
 * kmsjwt.cache.provider=redis
 * </pre>
 */
public interface DataKeyCacheProvider {

    /**
     * Unique name identifying this provider.
     *
     * <p>Used in configuration: kmsjwt.cache.provider={name}
     */
    String name();

    default String description() {
        return name() + " data key cache provider";
    }

    /**
     * Priority for auto-selection when no explicit provider is configured.
     * Higher values win.
     */
    default int priority() {
        return 0;
    }

    default boolean isAvailable() {
        return true;
    }

    /**
     * Create the cache. Called once at startup; the cache must be thread-safe.
     *
     * @param config the {@code kmsjwt.cache} settings
     * @return the cache implementation
     * @throws ProviderException if initialization fails
     */
    DataKeyCache createCache(CacheConfig config);
}
