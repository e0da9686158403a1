package kmsjwt.adapter.out.telemetry;

import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import kmsjwt.core.config.EnvelopeTokenConfig;
import kmsjwt.core.exception.FailureType;
import kmsjwt.core.port.out.EnvelopeMetrics;

/**
 * Micrometer metrics for envelope token operations.
 *
 * <p>Records metrics for:
 * <ul>
 *   <li>{@code kmsjwt.tokens.issued} - Tokens issued, by app</li>
 *   <li>{@code kmsjwt.tokens.verified} - Tokens verified, by app</li>
 *   <li>{@code kmsjwt.tokens.failures} - Issuance and verification failures by type</li>
 *   <li>{@code kmsjwt.datakey.cache.hits} - Data key cache hits</li>
 *   <li>{@code kmsjwt.datakey.cache.misses} - Data key cache misses</li>
 *   <li>{@code kmsjwt.kms.calls} - Key-management call latency by operation and outcome</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerEnvelopeMetrics implements EnvelopeMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerEnvelopeMetrics(MeterRegistry registry, EnvelopeTokenConfig config) {
        this(registry, config != null && config.metrics().enabled());
    }

    MicrometerEnvelopeMetrics(MeterRegistry registry, boolean enabled) {
        this.registry = registry;
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordIssued(String appId) {
        if (!enabled) {
            return;
        }

        Counter.builder("kmsjwt.tokens.issued")
                .description("Envelope tokens issued")
                .tag("app", nullSafe(appId))
                .register(registry)
                .increment();
    }

    @Override
    public void recordVerified(String appId) {
        if (!enabled) {
            return;
        }

        Counter.builder("kmsjwt.tokens.verified")
                .description("Envelope tokens verified")
                .tag("app", nullSafe(appId))
                .register(registry)
                .increment();
    }

    @Override
    public void recordFailure(FailureType failureType) {
        if (!enabled) {
            return;
        }

        Counter.builder("kmsjwt.tokens.failures")
                .description("Envelope token failures")
                .tag("type", failureType.tagValue())
                .register(registry)
                .increment();
    }

    @Override
    public void recordCacheHit() {
        if (!enabled) {
            return;
        }

        Counter.builder("kmsjwt.datakey.cache.hits")
                .description("Data key cache hits")
                .register(registry)
                .increment();
    }

    @Override
    public void recordCacheMiss() {
        if (!enabled) {
            return;
        }

        Counter.builder("kmsjwt.datakey.cache.misses")
                .description("Data key cache misses")
                .register(registry)
                .increment();
    }

    @Override
    public void recordKmsCall(String operation, boolean success, long durationMs) {
        if (!enabled) {
            return;
        }

        Timer.builder("kmsjwt.kms.calls")
                .description("Key-management service call latency")
                .tag("operation", nullSafe(operation))
                .tag("outcome", success ? "success" : "failure")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    private String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
