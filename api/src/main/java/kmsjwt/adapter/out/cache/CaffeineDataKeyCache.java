package kmsjwt.adapter.out.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import io.smallrye.mutiny.Uni;

import kmsjwt.core.model.token.CachedDataKey;
import kmsjwt.core.port.out.DataKeyCache;

/**
 * Caffeine-backed data key cache local to one process.
 *
 * <p>Each entry expires at its own absolute expiry rather than after a fixed
 * TTL. Reads also check the expiry against the clock, so an entry is never
 * returned strictly after it expires even if Caffeine has not yet evicted it.
 */
public class CaffeineDataKeyCache implements DataKeyCache {

    private final Cache<String, CachedDataKey> cache;
    private final Clock clock;

    public CaffeineDataKeyCache(long maxEntries) {
        this(maxEntries, Clock.systemUTC());
    }

    public CaffeineDataKeyCache(long maxEntries, Clock clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new AbsoluteExpiry(clock))
                .build();
    }

    @Override
    public Uni<Optional<CachedDataKey>> get(String key) {
        return Uni.createFrom().item(() -> {
            final CachedDataKey entry = cache.getIfPresent(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry.isExpiredAt(clock.instant())) {
                cache.invalidate(key);
                return Optional.empty();
            }
            return Optional.of(entry);
        });
    }

    @Override
    public Uni<Void> put(String key, CachedDataKey entry) {
        return Uni.createFrom().item(() -> {
            if (entry.expiresAt().isAfter(clock.instant())) {
                cache.put(key, entry);
            }
            return null;
        });
    }

    /**
     * Number of entries, including any not yet evicted.
     */
    long estimatedSize() {
        return cache.estimatedSize();
    }

    private static final class AbsoluteExpiry implements Expiry<String, CachedDataKey> {

        private final Clock clock;

        AbsoluteExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(String key, CachedDataKey value, long currentTime) {
            return remainingNanos(value.expiresAt());
        }

        @Override
        public long expireAfterUpdate(String key, CachedDataKey value, long currentTime, long currentDuration) {
            return remainingNanos(value.expiresAt());
        }

        @Override
        public long expireAfterRead(String key, CachedDataKey value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(Instant expiresAt) {
            final Duration remaining = Duration.between(clock.instant(), expiresAt);
            if (remaining.isNegative()) {
                return 0;
            }
            try {
                return remaining.toNanos();
            } catch (ArithmeticException e) {
                return Long.MAX_VALUE;
            }
        }
    }
}
