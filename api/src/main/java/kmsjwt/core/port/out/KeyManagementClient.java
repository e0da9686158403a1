package kmsjwt.core.port.out;

import io.smallrye.mutiny.Uni;

import kmsjwt.core.model.token.DataKey;
import kmsjwt.core.model.token.KeySpec;

/**
 * Port to the key-management service that owns the master keys.
 *
 * <p>Implementations report service failures as failed {@link Uni}s carrying
 * the service's own exception. Wrapping into the token failure taxonomy happens
 * in the core. Implementations must be thread-safe and keep no per-call state.
 */
public interface KeyManagementClient {

    /**
     * Name of the backing service, used in logs and metrics.
     */
    String name();

    /**
     * Generate a fresh data key under the given master key.
     *
     * @param masterKeyId master key id known to the service
     * @param keySpec     spec of the data key to generate
     * @return Uni with the plaintext and ciphertext of the new data key
     */
    Uni<DataKey> generateDataKey(String masterKeyId, KeySpec keySpec);

    /**
     * Decrypt a data key ciphertext previously returned by {@link #generateDataKey}.
     *
     * @param ciphertext the ciphertext blob
     * @return Uni with the plaintext data key
     */
    Uni<byte[]> decrypt(byte[] ciphertext);
}
