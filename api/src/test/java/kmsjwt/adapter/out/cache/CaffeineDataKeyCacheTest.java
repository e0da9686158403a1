package kmsjwt.adapter.out.cache;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import kmsjwt.core.model.token.CachedDataKey;
import kmsjwt.mock.MutableClock;
import kmsjwt.mock.TestEnvelopeTokenConfig;

@DisplayName("CaffeineDataKeyCache")
class CaffeineDataKeyCacheTest {

    private static final byte[] PLAINTEXT = {1, 2, 3, 4};

    private MutableClock clock;
    private CaffeineDataKeyCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.now());
        cache = new CaffeineDataKeyCache(100, clock);
    }

    private CachedDataKey entryExpiringIn(Duration duration) {
        return new CachedDataKey(PLAINTEXT, clock.instant().plus(duration));
    }

    @Nested
    @DisplayName("Basic Operations")
    class BasicOperations {

        @Test
        @DisplayName("should put and get an entry")
        void shouldPutAndGet() {
            var entry = entryExpiringIn(Duration.ofMinutes(5));
            cache.put("Jwt-Kms-app-k1", entry).await().indefinitely();

            var result = cache.get("Jwt-Kms-app-k1").await().indefinitely();

            assertTrue(result.isPresent());
            assertArrayEquals(PLAINTEXT, result.get().plaintext());
            assertEquals(entry.expiresAt(), result.get().expiresAt());
        }

        @Test
        @DisplayName("should return empty for a missing key")
        void shouldReturnEmptyForMissingKey() {
            assertFalse(cache.get("missing").await().indefinitely().isPresent());
        }

        @Test
        @DisplayName("should tolerate overwriting an entry")
        void shouldTolerateOverwrite() {
            cache.put("k", entryExpiringIn(Duration.ofMinutes(5))).await().indefinitely();
            cache.put("k", entryExpiringIn(Duration.ofMinutes(5))).await().indefinitely();

            assertTrue(cache.get("k").await().indefinitely().isPresent());
            assertEquals(1, cache.estimatedSize());
        }

        @Test
        @DisplayName("should reject a non-positive size")
        void shouldRejectNonPositiveSize() {
            assertThrows(IllegalArgumentException.class, () -> new CaffeineDataKeyCache(0, clock));
        }
    }

    @Nested
    @DisplayName("Expiration")
    class Expiration {

        @Test
        @DisplayName("should return the entry at exactly its expiry")
        void shouldReturnEntryAtExpiry() {
            var entry = entryExpiringIn(Duration.ofSeconds(60));
            cache.put("k", entry).await().indefinitely();

            clock.set(entry.expiresAt());

            assertTrue(cache.get("k").await().indefinitely().isPresent());
        }

        @Test
        @DisplayName("should miss strictly after expiry")
        void shouldMissAfterExpiry() {
            var entry = entryExpiringIn(Duration.ofSeconds(60));
            cache.put("k", entry).await().indefinitely();

            clock.set(entry.expiresAt().plusMillis(1));

            assertFalse(cache.get("k").await().indefinitely().isPresent());
        }

        @Test
        @DisplayName("should not store an entry that has already expired")
        void shouldNotStoreExpiredEntry() {
            cache.put("k", entryExpiringIn(Duration.ofSeconds(-1))).await().indefinitely();
            cache.put("now", entryExpiringIn(Duration.ZERO)).await().indefinitely();

            assertFalse(cache.get("k").await().indefinitely().isPresent());
            assertFalse(cache.get("now").await().indefinitely().isPresent());
        }

        @Test
        @DisplayName("should expire each entry independently")
        void shouldExpireIndependently() {
            cache.put("short", entryExpiringIn(Duration.ofSeconds(10))).await().indefinitely();
            cache.put("long", entryExpiringIn(Duration.ofHours(1))).await().indefinitely();

            clock.advance(Duration.ofSeconds(11));

            assertFalse(cache.get("short").await().indefinitely().isPresent());
            assertTrue(cache.get("long").await().indefinitely().isPresent());
        }
    }

    @Nested
    @DisplayName("CaffeineDataKeyCacheProvider")
    class Provider {

        @Test
        @DisplayName("should create a cache bounded by the configured entry count")
        void shouldCreateCache() {
            var provider = new CaffeineDataKeyCacheProvider();

            var created = provider.createCache(new TestEnvelopeTokenConfig.Cache(true, Optional.of("caffeine"), 500));

            assertTrue(created instanceof CaffeineDataKeyCache);
            assertEquals("caffeine", provider.name());
        }
    }
}
