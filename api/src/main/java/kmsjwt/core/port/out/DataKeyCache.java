package kmsjwt.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import kmsjwt.core.model.token.CachedDataKey;

/**
 * Cache for plaintext data keys, keyed by opaque strings.
 *
 * <p>Entries carry an absolute expiry. Implementations must not return an entry
 * strictly after its expiry. Entries are never removed explicitly; they
 * disappear when they expire or when the backend evicts them.
 *
 * <p>Keys are unique per token issuance, so concurrent writers only ever store
 * the same value under the same key. Implementations need to tolerate such
 * overwrites but need no further coordination.
 */
public interface DataKeyCache {

    /**
     * Look up a cached data key.
     *
     * @param key the cache key
     * @return Uni with the entry if present and not expired
     */
    Uni<Optional<CachedDataKey>> get(String key);

    /**
     * Store a data key until its absolute expiry.
     *
     * @param key   the cache key
     * @param entry the plaintext key and its expiry
     * @return Uni completing when the entry is stored
     */
    Uni<Void> put(String key, CachedDataKey entry);
}
