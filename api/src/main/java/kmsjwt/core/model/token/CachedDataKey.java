package kmsjwt.core.model.token;

import java.time.Instant;
import java.util.Arrays;

/**
 * A plaintext data key held in a cache together with its absolute expiry.
 *
 * <p>The expiry is the {@code exp} claim of the token the key belongs to, so
 * an entry never outlives the token.
 *
 * @param plaintext the plaintext data key
 * @param expiresAt the instant after which the entry must not be used
 */
public record CachedDataKey(byte[] plaintext, Instant expiresAt) {

    public CachedDataKey {
        if (plaintext == null || plaintext.length == 0) {
            throw new IllegalArgumentException("Plaintext cannot be null or empty");
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("Expiry cannot be null");
        }
        plaintext = plaintext.clone();
    }

    @Override
    public byte[] plaintext() {
        return plaintext.clone();
    }

    /**
     * True strictly after {@link #expiresAt()}.
     */
    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CachedDataKey other)) {
            return false;
        }
        return Arrays.equals(plaintext, other.plaintext) && expiresAt.equals(other.expiresAt);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(plaintext) + expiresAt.hashCode();
    }

    @Override
    public String toString() {
        return "CachedDataKey[length=" + plaintext.length + ", expiresAt=" + expiresAt + "]";
    }
}
