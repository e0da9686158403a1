package kmsjwt.core.service.envelope;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import kmsjwt.core.exception.KeyGenerationException;
import kmsjwt.core.exception.MalformedEnvelopeException;
import kmsjwt.core.model.token.DataKey;
import kmsjwt.core.model.token.EnvelopeContext;
import kmsjwt.core.model.token.EnvelopeProtocol;
import kmsjwt.core.model.token.Token;
import kmsjwt.core.port.in.KeyCacheOption;
import kmsjwt.core.port.out.EnvelopeMetrics;
import kmsjwt.core.port.out.KeyManagementClient;

/**
 * Mediates between the token lifecycle and the key-management service.
 *
 * <p>At issuance it generates one data key per token. At verification it
 * recovers the plaintext data key from the token's envelope headers, either
 * straight from the key-management service or through a cache when the caller
 * supplies one. The two paths live in separate resolvers so that the uncached
 * path can be reviewed on its own.
 */
@ApplicationScoped
public class EnvelopeKeyManager {

    private static final Logger LOG = Logger.getLogger(EnvelopeKeyManager.class);

    private final KeyManagementClient kms;
    private final EnvelopeMetrics metrics;
    private final EnvelopeProtocol protocol;
    private final DirectKeyResolver directResolver;

    @Inject
    public EnvelopeKeyManager(KeyManagementClient kms, EnvelopeMetrics metrics) {
        this(kms, metrics, EnvelopeProtocol.DEFAULT);
    }

    public EnvelopeKeyManager(KeyManagementClient kms, EnvelopeMetrics metrics, EnvelopeProtocol protocol) {
        this.kms = kms;
        this.metrics = metrics;
        this.protocol = protocol;
        this.directResolver = new DirectKeyResolver(kms, metrics);
    }

    public EnvelopeProtocol protocol() {
        return protocol;
    }

    /**
     * Generate a fresh data key under the client's master key.
     *
     * <p>The caller owns the returned key and should destroy it once the token
     * is signed.
     *
     * @param masterKeyId the client's master key id
     * @return Uni with the new data key, or failing with {@link KeyGenerationException}
     */
    public Uni<DataKey> generateEnvelopeKey(String masterKeyId) {
        return Uni.createFrom()
                .deferred(() -> {
                    final long start = System.nanoTime();
                    return kms.generateDataKey(masterKeyId, protocol.keySpec())
                            .onItemOrFailure()
                            .invoke((key, failure) -> metrics.recordKmsCall(
                                    "generate", failure == null, DirectKeyResolver.elapsedMillis(start)));
                })
                .onFailure()
                .transform(e -> new KeyGenerationException(
                        "Failed to generate data key under master key %s via %s: %s"
                                .formatted(masterKeyId, kms.name(), e.getMessage()),
                        e))
                .map(this::requireSpecLength);
    }

    /**
     * Recover the plaintext data key of a parsed token.
     *
     * @param token       the parsed (not yet verified) token
     * @param cacheOption whether a cache may be consulted and filled
     * @return Uni with the plaintext data key; the caller owns the array
     */
    public Uni<byte[]> resolvePlaintextKey(Token token, KeyCacheOption cacheOption) {
        if (cacheOption == null) {
            return Uni.createFrom().failure(new IllegalArgumentException("Cache option cannot be null"));
        }

        final EnvelopeContext context;
        try {
            context = EnvelopeContext.from(token, protocol);
        } catch (MalformedEnvelopeException e) {
            return Uni.createFrom().failure(e);
        }

        return resolverFor(cacheOption).resolve(context);
    }

    private PlaintextKeyResolver resolverFor(KeyCacheOption cacheOption) {
        if (cacheOption instanceof KeyCacheOption.Using using) {
            return new CachingKeyResolver(directResolver, using.cache(), protocol, metrics);
        }
        return directResolver;
    }

    private DataKey requireSpecLength(DataKey key) {
        if (key == null) {
            throw new KeyGenerationException("Key-management service returned no data key");
        }
        if (key.length() != protocol.keySpec().lengthBytes()) {
            final int length = key.length();
            key.destroy();
            throw new KeyGenerationException("Data key has %d bytes, %s requires %d"
                    .formatted(length, protocol.keySpec(), protocol.keySpec().lengthBytes()));
        }
        LOG.debugv("Generated {0} data key via {1}", protocol.keySpec(), kms.name());
        return key;
    }
}
