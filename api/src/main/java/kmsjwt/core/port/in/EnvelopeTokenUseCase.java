package kmsjwt.core.port.in;

import io.smallrye.mutiny.Uni;

import kmsjwt.core.model.token.Token;
import kmsjwt.core.model.token.TokenRequest;

/**
 * Issuance and verification of tokens signed with KMS envelope-encrypted data keys.
 *
 * <p>Every failure surfaces as a subclass of
 * {@link kmsjwt.core.exception.EnvelopeTokenException} in the returned Uni.
 */
public interface EnvelopeTokenUseCase {

    /**
     * Issue a token signed with a freshly generated data key.
     *
     * @param request issuance parameters
     * @return Uni with the compact token
     */
    Uni<String> issueToken(TokenRequest request);

    /**
     * Parse and verify a token, decrypting its data key through the
     * key-management service.
     *
     * @param serialized   the compact token
     * @param signingKeyId the expected signing key name
     * @return Uni with the verified token
     */
    default Uni<Token> parseAndVerify(String serialized, String signingKeyId) {
        return parseAndVerify(serialized, signingKeyId, KeyCacheOption.none());
    }

    /**
     * Parse and verify a token, resolving its data key according to {@code cacheOption}.
     *
     * @param serialized   the compact token
     * @param signingKeyId the expected signing key name
     * @param cacheOption  whether a plaintext data key cache may be used
     * @return Uni with the verified token
     */
    Uni<Token> parseAndVerify(String serialized, String signingKeyId, KeyCacheOption cacheOption);
}
