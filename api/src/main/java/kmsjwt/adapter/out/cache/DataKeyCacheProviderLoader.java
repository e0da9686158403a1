package kmsjwt.adapter.out.cache;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import kmsjwt.adapter.out.cache.redis.RedisDataKeyCacheProvider;
import kmsjwt.core.config.EnvelopeTokenConfig;
import kmsjwt.core.config.EnvelopeTokenConfig.CacheConfig;
import kmsjwt.core.port.in.KeyCacheOption;
import kmsjwt.spi.DataKeyCacheProvider;
import kmsjwt.spi.ProviderException;

/**
 * Discovers data key cache providers via ServiceLoader and produces the
 * {@link KeyCacheOption} used for verification.
 *
 * <p>Provider selection:
 * <ol>
 *   <li>If kmsjwt.cache.enabled is false, no cache is used</li>
 *   <li>If kmsjwt.cache.provider is set, use that provider</li>
 *   <li>Otherwise, select the highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class DataKeyCacheProviderLoader {

    private static final Logger LOG = Logger.getLogger(DataKeyCacheProviderLoader.class);

    private final CacheConfig config;
    private final Instance<ReactiveRedisDataSource> redisDataSource;

    @Inject
    public DataKeyCacheProviderLoader(
            EnvelopeTokenConfig tokenConfig, Instance<ReactiveRedisDataSource> redisDataSource) {
        this(tokenConfig.cache(), redisDataSource);
    }

    DataKeyCacheProviderLoader(CacheConfig config, Instance<ReactiveRedisDataSource> redisDataSource) {
        this.config = config;
        this.redisDataSource = redisDataSource;
    }

    /**
     * Produces the cache option for verification.
     *
     * <p>Singleton rather than application scoped: a sealed type cannot be
     * proxied.
     *
     * @return the cache option (never null)
     */
    @Produces
    @Singleton
    public KeyCacheOption keyCacheOption() {
        if (!config.enabled()) {
            LOG.info("Data key caching disabled (kmsjwt.cache.enabled=false)");
            return KeyCacheOption.none();
        }

        return selectProvider()
                .map(provider -> {
                    if (provider instanceof RedisDataKeyCacheProvider redisProvider) {
                        if (!redisDataSource.isResolvable()) {
                            throw new ProviderException("Redis cache selected but no Redis data source is configured");
                        }
                        redisProvider.setDataSource(redisDataSource.get());
                    }
                    LOG.infov(
                            "Creating data key cache from provider: {0} ({1})",
                            provider.name(),
                            provider.description());
                    return KeyCacheOption.using(provider.createCache(config));
                })
                .orElseGet(() -> {
                    LOG.info("No data key cache provider available, verifying without a cache");
                    return KeyCacheOption.none();
                });
    }

    Optional<DataKeyCacheProvider> selectProvider() {
        final List<DataKeyCacheProvider> providers = new ArrayList<>();
        ServiceLoader.load(DataKeyCacheProvider.class).forEach(providers::add);

        if (providers.isEmpty()) {
            LOG.info("No data key cache providers found on classpath");
            return Optional.empty();
        }

        LOG.infov(
                "Found {0} data key cache provider(s): {1}",
                providers.size(),
                providers.stream().map(DataKeyCacheProvider::name).toList());

        final String configured = config.provider().orElse(null);
        if (configured != null && !configured.isBlank()) {
            return Optional.of(providers.stream()
                    .filter(p -> p.name().equals(configured))
                    .findFirst()
                    .orElseThrow(() -> new ProviderException("Configured cache provider not found: "
                            + configured + ". Available: "
                            + providers.stream().map(DataKeyCacheProvider::name).toList())));
        }

        return providers.stream()
                .filter(DataKeyCacheProvider::isAvailable)
                .max(Comparator.comparingInt(DataKeyCacheProvider::priority));
    }
}
