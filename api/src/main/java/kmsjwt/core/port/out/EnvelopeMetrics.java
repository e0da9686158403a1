package kmsjwt.core.port.out;

import kmsjwt.core.exception.FailureType;

/**
 * Port for recording envelope token metrics.
 *
 * <p>Keeps the core independent of the metrics library in use.
 */
public interface EnvelopeMetrics {

    void recordIssued(String appId);

    void recordVerified(String appId);

    void recordFailure(FailureType failureType);

    void recordCacheHit();

    void recordCacheMiss();

    /**
     * Record a call to the key-management service.
     *
     * @param operation  "generate" or "decrypt"
     * @param success    whether the call succeeded
     * @param durationMs duration in milliseconds
     */
    void recordKmsCall(String operation, boolean success, long durationMs);

    /**
     * Metrics that record nothing.
     */
    EnvelopeMetrics NOOP = new EnvelopeMetrics() {
        @Override
        public void recordIssued(String appId) {}

        @Override
        public void recordVerified(String appId) {}

        @Override
        public void recordFailure(FailureType failureType) {}

        @Override
        public void recordCacheHit() {}

        @Override
        public void recordCacheMiss() {}

        @Override
        public void recordKmsCall(String operation, boolean success, long durationMs) {}
    };
}
