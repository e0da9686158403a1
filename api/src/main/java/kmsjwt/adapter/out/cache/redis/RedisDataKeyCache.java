package kmsjwt.adapter.out.cache.redis;

import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.quarkus.redis.datasource.value.SetArgs;
import io.smallrye.mutiny.Uni;

import kmsjwt.core.model.token.CachedDataKey;
import kmsjwt.core.port.out.DataKeyCache;

/**
 * Redis implementation of DataKeyCache, shared by every instance pointing at
 * the same Redis.
 *
 * <h2>Cache Format</h2>
 * <p>Keys are used verbatim; they already carry the envelope cache prefix.
 * Values are {@code <expiry epoch seconds>|<base64 plaintext>} and are written
 * with {@code SET ... EXAT <expiry>}, so Redis drops them when the token
 * expires. Reads apply the expiry from the value as well.
 */
public class RedisDataKeyCache implements DataKeyCache {

    private static final String FIELD_SEPARATOR = "|";

    /** Redis rejects EXAT values whose millisecond form overflows a signed 64-bit integer. */
    static final Instant MAX_EXPIRE_AT = Instant.ofEpochSecond(Long.MAX_VALUE / 1000);

    private final ReactiveValueCommands<String, String> valueCommands;
    private final Clock clock;

    public RedisDataKeyCache(ReactiveRedisDataSource ds) {
        this(ds, Clock.systemUTC());
    }

    public RedisDataKeyCache(ReactiveRedisDataSource ds, Clock clock) {
        this.valueCommands = ds.value(String.class, String.class);
        this.clock = clock;
    }

    @Override
    public Uni<Optional<CachedDataKey>> get(String key) {
        return valueCommands.get(key).map(cached -> {
            if (cached == null) {
                return Optional.<CachedDataKey>empty();
            }
            final CachedDataKey entry = deserialize(cached);
            if (entry.isExpiredAt(clock.instant())) {
                return Optional.<CachedDataKey>empty();
            }
            return Optional.of(entry);
        });
    }

    @Override
    public Uni<Void> put(String key, CachedDataKey entry) {
        // EXAT with a past time is rejected by Redis
        if (!entry.expiresAt().isAfter(clock.instant())) {
            return Uni.createFrom().voidItem();
        }
        return valueCommands
                .set(key, serialize(entry), new SetArgs().exAt(expireAt(entry.expiresAt())))
                .replaceWithVoid();
    }

    static Instant expireAt(Instant expiresAt) {
        return expiresAt.isAfter(MAX_EXPIRE_AT) ? MAX_EXPIRE_AT : expiresAt;
    }

    /**
     * Serialize an entry as {@code <expiry epoch seconds>|<base64 plaintext>}.
     */
    static String serialize(CachedDataKey entry) {
        return entry.expiresAt().getEpochSecond()
                + FIELD_SEPARATOR
                + Base64.getEncoder().encodeToString(entry.plaintext());
    }

    static CachedDataKey deserialize(String cached) {
        final int separator = cached.indexOf(FIELD_SEPARATOR);
        if (separator <= 0) {
            throw new IllegalArgumentException("Invalid cached data key format");
        }
        final long expiresAt = Long.parseLong(cached.substring(0, separator));
        final byte[] plaintext = Base64.getDecoder().decode(cached.substring(separator + 1));
        return new CachedDataKey(plaintext, Instant.ofEpochSecond(expiresAt));
    }
}
