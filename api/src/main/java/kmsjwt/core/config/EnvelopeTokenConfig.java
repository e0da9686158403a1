package kmsjwt.core.config;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for envelope token issuance and verification.
 *
 * <p>Example configuration:
 * <pre>{@code
 * kmsjwt.kms.provider=aws
 * kmsjwt.kms.aws.region=us-east-1
 * kmsjwt.kms.aws.api-call-timeout=PT5S
 * kmsjwt.kms.in-memory.master-keys.master-1=<base64 AES key>
 * kmsjwt.cache.enabled=true
 * kmsjwt.cache.provider=caffeine
 * kmsjwt.cache.max-entries=10000
 * kmsjwt.metrics.enabled=true
 * kmsjwt.verify.default-signing-key-id=sign-1
 * }</pre>
 *
 * <p>Each provider receives the group for its concern: key-management
 * providers get {@link KmsConfig}, cache providers get {@link CacheConfig}.
 */
@ConfigMapping(prefix = "kmsjwt")
public interface EnvelopeTokenConfig {

    KmsConfig kms();

    CacheConfig cache();

    MetricsConfig metrics();

    VerifyConfig verify();

    interface KmsConfig {

        /**
         * Key-management provider name. When absent the highest priority
         * available provider is used.
         */
        Optional<String> provider();

        AwsConfig aws();

        @WithName("in-memory")
        InMemoryConfig inMemory();
    }

    /**
     * AWS KMS client settings. Credentials come from the SDK default provider chain.
     */
    interface AwsConfig {

        /**
         * AWS region. When absent the SDK region provider chain decides.
         */
        Optional<String> region();

        /**
         * Endpoint override, e.g. for LocalStack.
         */
        Optional<URI> endpoint();

        /**
         * Total timeout per KMS call.
         */
        @WithName("api-call-timeout")
        Optional<Duration> apiCallTimeout();
    }

    interface InMemoryConfig {

        /**
         * Master keys by id, each a base64 AES key of 16, 24 or 32 bytes.
         */
        @WithName("master-keys")
        @WithDefault("")
        Map<String, String> masterKeys();
    }

    interface CacheConfig {

        /**
         * Whether verification caches plaintext data keys.
         *
         * <p>When disabled every verification decrypts through the
         * key-management service.
         */
        @WithDefault("false")
        boolean enabled();

        /**
         * Cache provider name ({@code caffeine} or {@code redis}).
         */
        Optional<String> provider();

        /**
         * Maximum entries held by the local cache.
         */
        @WithName("max-entries")
        @WithDefault("10000")
        long maxEntries();
    }

    interface MetricsConfig {

        @WithDefault("true")
        boolean enabled();
    }

    interface VerifyConfig {

        /**
         * Signing key id used by the REST surface when a verify request names none.
         */
        @WithName("default-signing-key-id")
        Optional<String> defaultSigningKeyId();
    }
}
