package kmsjwt.core.service.envelope;

import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import kmsjwt.core.exception.DataKeyCacheException;
import kmsjwt.core.model.token.CachedDataKey;
import kmsjwt.core.model.token.EnvelopeContext;
import kmsjwt.core.model.token.EnvelopeProtocol;
import kmsjwt.core.port.out.DataKeyCache;
import kmsjwt.core.port.out.EnvelopeMetrics;

/**
 * Resolves data keys from a cache, falling back to a decrypting resolver on a
 * miss and caching the result until the token expires.
 *
 * <p>Two verifications of the same token may both miss and both decrypt. They
 * store the same plaintext under the same key, so no locking is done.
 */
final class CachingKeyResolver implements PlaintextKeyResolver {

    private static final Logger LOG = Logger.getLogger(CachingKeyResolver.class);

    private final PlaintextKeyResolver delegate;
    private final DataKeyCache cache;
    private final EnvelopeProtocol protocol;
    private final EnvelopeMetrics metrics;

    CachingKeyResolver(
            PlaintextKeyResolver delegate, DataKeyCache cache, EnvelopeProtocol protocol, EnvelopeMetrics metrics) {
        this.delegate = delegate;
        this.cache = cache;
        this.protocol = protocol;
        this.metrics = metrics;
    }

    @Override
    public Uni<byte[]> resolve(EnvelopeContext context) {
        final String cacheKey = context.cacheKey(protocol);

        return lookup(cacheKey).flatMap(cached -> {
            if (cached.isPresent()) {
                metrics.recordCacheHit();
                LOG.debugv("Data key cache hit for {0}", cacheKey);
                return Uni.createFrom().item(cached.get().plaintext());
            }

            metrics.recordCacheMiss();
            LOG.debugv("Data key cache miss for {0}", cacheKey);
            return delegate.resolve(context)
                    .call(plaintext -> store(cacheKey, plaintext, context.expiresAt()));
        });
    }

    private Uni<Optional<CachedDataKey>> lookup(String cacheKey) {
        return Uni.createFrom()
                .deferred(() -> cache.get(cacheKey))
                .onFailure()
                .transform(e -> new DataKeyCacheException("Data key cache lookup failed for " + cacheKey, e))
                .map(entry -> entry == null ? Optional.<CachedDataKey>empty() : entry);
    }

    private Uni<Void> store(String cacheKey, byte[] plaintext, Instant expiresAt) {
        return Uni.createFrom()
                .deferred(() -> cache.put(cacheKey, new CachedDataKey(plaintext, expiresAt)))
                .onFailure()
                .transform(e -> new DataKeyCacheException("Data key cache store failed for " + cacheKey, e));
    }
}
