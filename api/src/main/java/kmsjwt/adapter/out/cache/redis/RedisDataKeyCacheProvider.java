package kmsjwt.adapter.out.cache.redis;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;

import kmsjwt.core.config.EnvelopeTokenConfig.CacheConfig;
import kmsjwt.core.port.out.DataKeyCache;
import kmsjwt.spi.DataKeyCacheProvider;
import kmsjwt.spi.ProviderException;

/**
 * Redis data key cache provider, for sharing decrypted data keys across
 * instances.
 *
 * <p>Redis connection is configured via Quarkus Redis extension:
 * <ul>
 *   <li>quarkus.redis.hosts - Redis server URL</li>
 *   <li>quarkus.redis.password - Redis password (optional)</li>
 * </ul>
 */
public class RedisDataKeyCacheProvider implements DataKeyCacheProvider {

    private ReactiveRedisDataSource dataSource;

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public String description() {
        return "Redis distributed data key cache";
    }

    @Override
    public int priority() {
        return 5;
    }

    @Override
    public boolean isAvailable() {
        try {
            Class.forName("io.quarkus.redis.datasource.ReactiveRedisDataSource");
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }

    /**
     * Set the Redis data source.
     *
     * <p>Called by the DataKeyCacheProviderLoader with the Quarkus-managed
     * Redis data source.
     *
     * @param dataSource the Redis data source
     */
    public void setDataSource(ReactiveRedisDataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public DataKeyCache createCache(CacheConfig config) {
        if (dataSource == null) {
            throw new ProviderException(
                    "Redis data source not set. Ensure RedisDataKeyCacheProvider.setDataSource() is called.");
        }
        return new RedisDataKeyCache(dataSource);
    }
}
