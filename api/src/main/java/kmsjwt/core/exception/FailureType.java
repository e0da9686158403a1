package kmsjwt.core.exception;

/**
 * Classifies envelope token failures by the remediation they call for.
 *
 * <p>Key generation, key decryption, signing and cache failures point at infrastructure.
 * An invalid signature is a security event. Malformed tokens and envelopes,
 * and claim conflicts, are client bugs.
 */
public enum FailureType {
    KEY_GENERATION,
    KEY_DECRYPTION,
    MALFORMED_ENVELOPE,
    MALFORMED_TOKEN,
    INVALID_SIGNATURE,
    CLAIM_CONFLICT,
    SIGNING,
    CACHE_FAILURE;

    /**
     * Lower-case name used as a metric tag value.
     */
    public String tagValue() {
        return name().toLowerCase();
    }
}
