package kmsjwt.core.model.token;

/**
 * Wire-format constants shared by token issuance and verification.
 *
 * <p>Header names and the data key spec are part of the token contract. Both
 * issuance and verification read them from one instance so that the two paths
 * cannot drift apart.
 *
 * @param appIdHeader         header carrying the client application id
 * @param keyIdHeader         header carrying the per-issuance unique id used in cache keys
 * @param keyCiphertextHeader header carrying the base64 data key ciphertext
 * @param signingKeyIdHeader  header carrying the signing key id
 * @param keySpec             spec of the data keys requested from the key-management service
 * @param cacheKeyPrefix      prefix of cache keys for plaintext data keys
 */
public record EnvelopeProtocol(
        String appIdHeader,
        String keyIdHeader,
        String keyCiphertextHeader,
        String signingKeyIdHeader,
        KeySpec keySpec,
        String cacheKeyPrefix) {

    public static final EnvelopeProtocol DEFAULT =
            new EnvelopeProtocol("aid", "kid", "kct", "skid", KeySpec.AES_128, "Jwt-Kms-");

    public EnvelopeProtocol {
        requireText(appIdHeader, "appIdHeader");
        requireText(keyIdHeader, "keyIdHeader");
        requireText(keyCiphertextHeader, "keyCiphertextHeader");
        requireText(signingKeyIdHeader, "signingKeyIdHeader");
        requireText(cacheKeyPrefix, "cacheKeyPrefix");
        if (keySpec == null) {
            throw new IllegalArgumentException("keySpec cannot be null");
        }
    }

    /**
     * Cache key for the plaintext data key of the token identified by
     * {@code appId} and {@code keyId}.
     */
    public String cacheKey(String appId, String keyId) {
        return cacheKeyPrefix + appId + "-" + keyId;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }
}
