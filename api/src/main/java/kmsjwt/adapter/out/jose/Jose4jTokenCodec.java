package kmsjwt.adapter.out.jose;

import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;

import org.jose4j.json.JsonUtil;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwa.AlgorithmConstraints.ConstraintType;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;

import kmsjwt.core.exception.MalformedTokenException;
import kmsjwt.core.exception.TokenSigningException;
import kmsjwt.core.model.token.EnvelopeProtocol;
import kmsjwt.core.model.token.Token;
import kmsjwt.core.port.out.TokenCodec;

/**
 * HS256 token codec built on jose4j.
 *
 * <p>The signing key id travels in a protected header (default {@code skid}).
 * Verification only accepts HS256 and rejects tokens whose signing key id does
 * not match the expected one before checking the MAC.
 *
 * <p>Data keys are 128 bits, below the 256 bits jose4j requires for HS256 by
 * default, so key-length validation is off.
 *
 * <p>Only string-valued protected headers are carried into the parsed
 * {@link Token}. A header whose JSON value is null, a number or a structure is
 * left out, so the envelope reads it as missing.
 */
@ApplicationScoped
public class Jose4jTokenCodec implements TokenCodec {

    private static final AlgorithmConstraints HS256_ONLY =
            new AlgorithmConstraints(ConstraintType.PERMIT, AlgorithmIdentifiers.HMAC_SHA256);

    private final String signingKeyIdHeader;

    public Jose4jTokenCodec() {
        this(EnvelopeProtocol.DEFAULT.signingKeyIdHeader());
    }

    public Jose4jTokenCodec(String signingKeyIdHeader) {
        this.signingKeyIdHeader = signingKeyIdHeader;
    }

    @Override
    public Token parse(String compact) {
        if (compact == null || compact.isBlank()) {
            throw new MalformedTokenException("Token is empty");
        }
        try {
            final var jws = new JsonWebSignature();
            jws.setCompactSerialization(compact);

            final Map<String, String> headers = new LinkedHashMap<>();
            JsonUtil.parseJson(jws.getHeaders().getFullHeaderAsJsonString()).forEach((name, value) -> {
                if (value instanceof String text) {
                    headers.put(name, text);
                }
            });

            final Map<String, Object> claims = JsonUtil.parseJson(jws.getUnverifiedPayload());
            final String signature = compact.substring(compact.lastIndexOf('.') + 1);
            return new Token(headers, claims, signature, compact);
        } catch (JoseException | IllegalArgumentException | ClassCastException e) {
            throw new MalformedTokenException("Token is not a valid compact JWS: " + e.getMessage(), e);
        }
    }

    @Override
    public String sign(Map<String, String> headers, Map<String, Object> claims, byte[] secret, String signingKeyId) {
        requireSigningKeyId(signingKeyId);
        final var jws = new JsonWebSignature();
        jws.setPayload(JsonUtil.toJson(claims));
        headers.forEach(jws::setHeader);
        jws.setHeader(signingKeyIdHeader, signingKeyId);
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.HMAC_SHA256);
        jws.setDoKeyValidation(false);
        try {
            jws.setKey(new HmacKey(secret));
            return jws.getCompactSerialization();
        } catch (JoseException | IllegalArgumentException e) {
            // An empty or missing secret fails in the key constructor
            throw new TokenSigningException("Failed to sign token: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean verifySignature(Token token, String signingKeyId, byte[] secret) {
        requireSigningKeyId(signingKeyId);
        if (!signingKeyId.equals(token.headers().get(signingKeyIdHeader))) {
            return false;
        }
        try {
            final var jws = new JsonWebSignature();
            jws.setAlgorithmConstraints(HS256_ONLY);
            jws.setCompactSerialization(token.compact());
            jws.setKey(new HmacKey(secret));
            jws.setDoKeyValidation(false);
            return jws.verifySignature();
        } catch (JoseException e) {
            // Disallowed algorithm or unusable key
            return false;
        }
    }

    private static void requireSigningKeyId(String signingKeyId) {
        if (signingKeyId == null || signingKeyId.isBlank()) {
            throw new IllegalArgumentException("Signing key id cannot be null or blank");
        }
    }
}
