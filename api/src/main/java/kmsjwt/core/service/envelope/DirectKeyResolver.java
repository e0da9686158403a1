package kmsjwt.core.service.envelope;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import kmsjwt.core.exception.KeyDecryptionException;
import kmsjwt.core.model.token.EnvelopeContext;
import kmsjwt.core.model.token.EnvelopeHeaders;
import kmsjwt.core.port.out.EnvelopeMetrics;
import kmsjwt.core.port.out.KeyManagementClient;

/**
 * Resolves data keys by asking the key-management service to decrypt the
 * {@code kct} header. Has no side effects beyond the service call.
 */
final class DirectKeyResolver implements PlaintextKeyResolver {

    private static final Logger LOG = Logger.getLogger(DirectKeyResolver.class);

    private final KeyManagementClient kms;
    private final EnvelopeMetrics metrics;

    DirectKeyResolver(KeyManagementClient kms, EnvelopeMetrics metrics) {
        this.kms = kms;
        this.metrics = metrics;
    }

    @Override
    public Uni<byte[]> resolve(EnvelopeContext context) {
        final EnvelopeHeaders headers = context.headers();
        final byte[] ciphertext = headers.decodeCiphertext();

        return Uni.createFrom()
                .deferred(() -> {
                    final long start = System.nanoTime();
                    return kms.decrypt(ciphertext)
                            .onItemOrFailure()
                            .invoke((plaintext, failure) ->
                                    metrics.recordKmsCall("decrypt", failure == null, elapsedMillis(start)));
                })
                .onFailure()
                .transform(e -> new KeyDecryptionException(
                        "Failed to decrypt data key for app %s, key %s via %s: %s"
                                .formatted(headers.appId(), headers.keyId(), kms.name(), e.getMessage()),
                        e))
                .map(plaintext -> {
                    if (plaintext == null || plaintext.length == 0) {
                        throw new KeyDecryptionException(
                                "Key-management service returned an empty plaintext for app %s, key %s"
                                        .formatted(headers.appId(), headers.keyId()));
                    }
                    LOG.debugv("Decrypted data key for app {0}, key {1}", headers.appId(), headers.keyId());
                    return plaintext;
                });
    }

    static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
