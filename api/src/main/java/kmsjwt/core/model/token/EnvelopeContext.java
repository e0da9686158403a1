package kmsjwt.core.model.token;

import java.time.Instant;

import kmsjwt.core.exception.MalformedEnvelopeException;

/**
 * Everything key resolution needs from a parsed token: its envelope headers
 * and the absolute expiry that bounds any cache entry for its data key.
 *
 * @param headers   the envelope headers
 * @param expiresAt the token's {@code exp} claim
 */
public record EnvelopeContext(EnvelopeHeaders headers, Instant expiresAt) {

    public EnvelopeContext {
        if (headers == null) {
            throw new IllegalArgumentException("Envelope headers cannot be null");
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("Expiry cannot be null");
        }
    }

    /**
     * Extract the envelope context from a parsed token.
     *
     * @throws MalformedEnvelopeException if an envelope header or an integral {@code exp} claim is missing,
     *     the {@code exp} claim lies outside the range of {@link Instant}, or the key ciphertext is not base64
     */
    public static EnvelopeContext from(Token token, EnvelopeProtocol protocol) {
        final EnvelopeHeaders headers = EnvelopeHeaders.from(token.headers(), protocol);
        headers.decodeCiphertext();
        if (token.claim(ClaimNames.EXPIRES_AT).isEmpty()) {
            throw new MalformedEnvelopeException("Token is missing the exp claim");
        }
        final long exp = token.expiresAt()
                .orElseThrow(() -> new MalformedEnvelopeException("Token exp claim is not a numeric date"));
        if (!ClaimNames.isNumericDateInRange(exp)) {
            throw new MalformedEnvelopeException(
                    "Token exp claim %d is outside the supported date range".formatted(exp));
        }
        return new EnvelopeContext(headers, Instant.ofEpochSecond(exp));
    }

    public String cacheKey(EnvelopeProtocol protocol) {
        return headers.cacheKey(protocol);
    }
}
