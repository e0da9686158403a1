package kmsjwt.core.service.envelope;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import kmsjwt.core.exception.ClaimConflictException;
import kmsjwt.core.exception.EnvelopeTokenException;
import kmsjwt.core.exception.InvalidSignatureException;
import kmsjwt.core.model.token.ClaimNames;
import kmsjwt.core.model.token.DataKey;
import kmsjwt.core.model.token.EnvelopeHeaders;
import kmsjwt.core.model.token.EnvelopeProtocol;
import kmsjwt.core.model.token.Token;
import kmsjwt.core.model.token.TokenRequest;
import kmsjwt.core.port.in.EnvelopeTokenUseCase;
import kmsjwt.core.port.in.KeyCacheOption;
import kmsjwt.core.port.out.EnvelopeMetrics;
import kmsjwt.core.port.out.TokenCodec;

/**
 * Issues and verifies tokens whose signing secret is a KMS data key carried,
 * encrypted, in the token's own protected headers.
 *
 * <p>Composes a {@link TokenCodec}, which only knows how to sign and verify
 * with a symmetric secret, with the {@link EnvelopeKeyManager}, which knows
 * where that secret comes from.
 *
 * <p>Custom claims may not reuse the standard claim names ({@code aud},
 * {@code sub}, {@code iat}, {@code exp}); such requests fail with
 * {@link ClaimConflictException} before the key-management service is called.
 */
@ApplicationScoped
public class EnvelopeTokenService implements EnvelopeTokenUseCase {

    private static final Logger LOG = Logger.getLogger(EnvelopeTokenService.class);

    private final TokenCodec codec;
    private final EnvelopeKeyManager keyManager;
    private final EnvelopeMetrics metrics;
    private final EnvelopeProtocol protocol;

    @Inject
    public EnvelopeTokenService(TokenCodec codec, EnvelopeKeyManager keyManager, EnvelopeMetrics metrics) {
        this.codec = codec;
        this.keyManager = keyManager;
        this.metrics = metrics;
        this.protocol = keyManager.protocol();
    }

    @Override
    public Uni<String> issueToken(TokenRequest request) {
        final Map<String, Object> claims;
        try {
            claims = buildClaims(request);
        } catch (ClaimConflictException e) {
            recordFailure(e);
            return Uni.createFrom().failure(e);
        }

        return keyManager
                .generateEnvelopeKey(request.masterKeyId())
                .map(dataKey -> signAndDestroy(request, claims, dataKey))
                .onFailure(EnvelopeTokenException.class)
                .invoke(e -> recordFailure((EnvelopeTokenException) e));
    }

    @Override
    public Uni<Token> parseAndVerify(String serialized, String signingKeyId, KeyCacheOption cacheOption) {
        return Uni.createFrom()
                .item(() -> codec.parse(serialized))
                .flatMap(token -> keyManager
                        .resolvePlaintextKey(token, cacheOption)
                        .map(secret -> verify(token, signingKeyId, secret)))
                .onItem()
                .invoke(token -> {
                    final String appId = token.header(protocol.appIdHeader()).orElse("");
                    metrics.recordVerified(appId);
                    LOG.debugv("Verified token for app {0}, key {1}", appId, token.header(protocol.keyIdHeader())
                            .orElse(""));
                })
                .onFailure(EnvelopeTokenException.class)
                .invoke(e -> recordFailure((EnvelopeTokenException) e));
    }

    private Map<String, Object> buildClaims(TokenRequest request) {
        for (String name : request.customClaims().keySet()) {
            if (ClaimNames.isStandard(name)) {
                throw new ClaimConflictException("Custom claim '%s' conflicts with a standard claim".formatted(name));
            }
        }

        final Map<String, Object> claims = new LinkedHashMap<>();
        claims.put(ClaimNames.AUDIENCE, request.audience());
        claims.put(ClaimNames.SUBJECT, request.subject());
        claims.put(ClaimNames.ISSUED_AT, request.issuedAt());
        claims.put(ClaimNames.EXPIRES_AT, request.expiresAt());
        claims.putAll(request.customClaims());
        return claims;
    }

    private String signAndDestroy(TokenRequest request, Map<String, Object> claims, DataKey dataKey) {
        try {
            final EnvelopeHeaders envelope = EnvelopeHeaders.forIssuance(request.clientAppId(), dataKey.ciphertext());
            final byte[] secret = dataKey.plaintext();
            try {
                final String token =
                        codec.sign(envelope.toHeaderMap(protocol), claims, secret, request.signingKeyId());
                metrics.recordIssued(request.clientAppId());
                LOG.debugv("Issued token for app {0}, key {1}", request.clientAppId(), envelope.keyId());
                return token;
            } finally {
                Arrays.fill(secret, (byte) 0);
            }
        } finally {
            dataKey.destroy();
        }
    }

    private Token verify(Token token, String signingKeyId, byte[] secret) {
        try {
            if (!codec.verifySignature(token, signingKeyId, secret)) {
                throw new InvalidSignatureException("Signature verification failed for app %s, key %s"
                        .formatted(
                                token.header(protocol.appIdHeader()).orElse(""),
                                token.header(protocol.keyIdHeader()).orElse("")));
            }
            return token;
        } finally {
            Arrays.fill(secret, (byte) 0);
        }
    }

    private void recordFailure(EnvelopeTokenException e) {
        metrics.recordFailure(e.failureType());
        switch (e.failureType()) {
            case INVALID_SIGNATURE, KEY_DECRYPTION, KEY_GENERATION, SIGNING, CACHE_FAILURE -> LOG.warnv(
                    "Token {0} failure: {1}", e.failureType().tagValue(), e.getMessage());
            default -> LOG.debugv("Token {0} failure: {1}", e.failureType().tagValue(), e.getMessage());
        }
    }
}
