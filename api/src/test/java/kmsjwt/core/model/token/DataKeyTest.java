package kmsjwt.core.model.token;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Data key holders")
class DataKeyTest {

    @Nested
    @DisplayName("DataKey")
    class DataKeyTests {

        @Test
        @DisplayName("should not expose its internal arrays")
        void shouldNotExposeInternalArrays() {
            var plaintext = new byte[] {1, 2, 3};
            var key = new DataKey(plaintext, new byte[] {9});

            plaintext[0] = 7;
            key.plaintext()[1] = 7;

            assertArrayEquals(new byte[] {1, 2, 3}, key.plaintext());
        }

        @Test
        @DisplayName("should refuse plaintext access after destroy")
        void shouldRefusePlaintextAfterDestroy() {
            var key = new DataKey(new byte[] {1, 2, 3}, new byte[] {9});

            key.destroy();

            assertTrue(key.isDestroyed());
            assertThrows(IllegalStateException.class, key::plaintext);
            assertArrayEquals(new byte[] {9}, key.ciphertext());
        }

        @Test
        @DisplayName("should not print key material")
        void shouldNotPrintKeyMaterial() {
            var key = new DataKey(new byte[] {1, 2, 3}, new byte[] {9});

            assertEquals("DataKey[length=3, ciphertextLength=1]", key.toString());
        }
    }

    @Nested
    @DisplayName("CachedDataKey")
    class CachedDataKeyTests {

        private final Instant expiry = Instant.ofEpochSecond(1_700_000_000L);

        @Test
        @DisplayName("should be valid up to and including its expiry")
        void shouldBeValidUntilExpiry() {
            var entry = new CachedDataKey(new byte[] {1}, expiry);

            assertFalse(entry.isExpiredAt(expiry.minusSeconds(1)));
            assertFalse(entry.isExpiredAt(expiry));
            assertTrue(entry.isExpiredAt(expiry.plusMillis(1)));
        }

        @Test
        @DisplayName("should compare by content")
        void shouldCompareByContent() {
            assertEquals(new CachedDataKey(new byte[] {1, 2}, expiry), new CachedDataKey(new byte[] {1, 2}, expiry));
            assertEquals(
                    new CachedDataKey(new byte[] {1, 2}, expiry).hashCode(),
                    new CachedDataKey(new byte[] {1, 2}, expiry).hashCode());
        }

        @Test
        @DisplayName("should reject empty plaintext")
        void shouldRejectEmptyPlaintext() {
            assertThrows(IllegalArgumentException.class, () -> new CachedDataKey(new byte[0], expiry));
        }
    }
}
