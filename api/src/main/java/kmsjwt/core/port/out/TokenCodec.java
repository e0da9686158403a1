package kmsjwt.core.port.out;

import java.util.Map;

import kmsjwt.core.exception.MalformedTokenException;
import kmsjwt.core.exception.TokenSigningException;
import kmsjwt.core.model.token.Token;

/**
 * Serialization and signature handling for compact tokens, given a symmetric
 * secret.
 *
 * <p>The codec knows nothing about envelopes or key management. It is shared by
 * any token variant that signs with a symmetric secret.
 */
public interface TokenCodec {

    /**
     * Parse a compact token without verifying it.
     *
     * @param compact the compact serialization
     * @return the parsed token
     * @throws MalformedTokenException if the input is not a structurally valid token
     */
    Token parse(String compact);

    /**
     * Sign headers and claims with a symmetric secret.
     *
     * @param headers      protected headers to add
     * @param claims       payload claims
     * @param secret       the signing secret
     * @param signingKeyId name of the signing key
     * @return the compact serialization
     * @throws TokenSigningException if the secret cannot be used to sign
     */
    String sign(Map<String, String> headers, Map<String, Object> claims, byte[] secret, String signingKeyId);

    /**
     * Verify a parsed token's signature.
     *
     * @param token        a token returned by {@link #parse}
     * @param signingKeyId the expected signing key name
     * @param secret       the secret the token should be signed with
     * @return true if the token was signed with {@code secret} under {@code signingKeyId}
     */
    boolean verifySignature(Token token, String signingKeyId, byte[] secret);
}
