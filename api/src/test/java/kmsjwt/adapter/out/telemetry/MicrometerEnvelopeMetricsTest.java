package kmsjwt.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.concurrent.TimeUnit;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import kmsjwt.core.config.EnvelopeTokenConfig;
import kmsjwt.core.exception.FailureType;

@DisplayName("MicrometerEnvelopeMetrics")
class MicrometerEnvelopeMetricsTest {

    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
    }

    @Nested
    @DisplayName("When enabled")
    class Enabled {

        private MicrometerEnvelopeMetrics metrics;

        @BeforeEach
        void setUp() {
            metrics = new MicrometerEnvelopeMetrics(registry, true);
        }

        @Test
        @DisplayName("should count issued and verified tokens per app")
        void shouldCountTokensPerApp() {
            metrics.recordIssued("app-42");
            metrics.recordIssued("app-42");
            metrics.recordVerified("app-42");

            assertEquals(2.0, registry.get("kmsjwt.tokens.issued").tag("app", "app-42").counter().count());
            assertEquals(1.0, registry.get("kmsjwt.tokens.verified").tag("app", "app-42").counter().count());
        }

        @Test
        @DisplayName("should count failures by type")
        void shouldCountFailuresByType() {
            metrics.recordFailure(FailureType.INVALID_SIGNATURE);
            metrics.recordFailure(FailureType.KEY_DECRYPTION);
            metrics.recordFailure(FailureType.INVALID_SIGNATURE);

            assertEquals(
                    2.0,
                    registry.get("kmsjwt.tokens.failures")
                            .tag("type", "invalid_signature")
                            .counter()
                            .count());
            assertEquals(
                    1.0,
                    registry.get("kmsjwt.tokens.failures")
                            .tag("type", "key_decryption")
                            .counter()
                            .count());
        }

        @Test
        @DisplayName("should count cache hits and misses")
        void shouldCountCacheHitsAndMisses() {
            metrics.recordCacheHit();
            metrics.recordCacheMiss();
            metrics.recordCacheMiss();

            assertEquals(1.0, registry.get("kmsjwt.datakey.cache.hits").counter().count());
            assertEquals(2.0, registry.get("kmsjwt.datakey.cache.misses").counter().count());
        }

        @Test
        @DisplayName("should time key-management calls by operation and outcome")
        void shouldTimeKmsCalls() {
            metrics.recordKmsCall("decrypt", true, 12);
            metrics.recordKmsCall("decrypt", false, 30);

            var success = registry.get("kmsjwt.kms.calls")
                    .tag("operation", "decrypt")
                    .tag("outcome", "success")
                    .timer();
            assertEquals(1, success.count());
            assertEquals(12.0, success.totalTime(TimeUnit.MILLISECONDS));
            assertEquals(
                    1,
                    registry.get("kmsjwt.kms.calls")
                            .tag("outcome", "failure")
                            .timer()
                            .count());
        }
    }

    @Test
    @DisplayName("should record nothing when disabled")
    void shouldRecordNothingWhenDisabled() {
        var metrics = new MicrometerEnvelopeMetrics(registry, false);

        metrics.recordIssued("app-42");
        metrics.recordFailure(FailureType.MALFORMED_TOKEN);
        metrics.recordKmsCall("generate", true, 5);

        assertFalse(metrics.isEnabled());
        assertTrue(registry.getMeters().isEmpty());
    }

    @Test
    @DisplayName("should read the enabled flag from configuration")
    void shouldReadEnabledFlagFromConfig() {
        var config = mock(EnvelopeTokenConfig.class);
        var metricsConfig = mock(EnvelopeTokenConfig.MetricsConfig.class);
        when(config.metrics()).thenReturn(metricsConfig);
        when(metricsConfig.enabled()).thenReturn(false);

        var metrics = new MicrometerEnvelopeMetrics(registry, config);
        metrics.recordCacheHit();

        assertNull(registry.find("kmsjwt.datakey.cache.hits").counter());
    }
}
