package kmsjwt.adapter.out.cache;

import kmsjwt.core.config.EnvelopeTokenConfig.CacheConfig;
import kmsjwt.core.port.out.DataKeyCache;
import kmsjwt.spi.DataKeyCacheProvider;

/**
 * Local Caffeine cache provider.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>kmsjwt.cache.max-entries - maximum cached data keys (default: 10000)</li>
 * </ul>
 */
public class CaffeineDataKeyCacheProvider implements DataKeyCacheProvider {

    @Override
    public String name() {
        return "caffeine";
    }

    @Override
    public String description() {
        return "Caffeine in-process data key cache";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public DataKeyCache createCache(CacheConfig config) {
        return new CaffeineDataKeyCache(config.maxEntries());
    }
}
