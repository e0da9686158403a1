package kmsjwt.core.service.envelope;

import io.smallrye.mutiny.Uni;

import kmsjwt.core.model.token.EnvelopeContext;

/**
 * Strategy for recovering the plaintext data key of a parsed token.
 */
interface PlaintextKeyResolver {

    /**
     * Resolve the plaintext data key for the token described by {@code context}.
     *
     * @param context envelope headers and expiry of the token
     * @return Uni with the plaintext data key; the caller owns the returned array
     */
    Uni<byte[]> resolve(EnvelopeContext context);
}
