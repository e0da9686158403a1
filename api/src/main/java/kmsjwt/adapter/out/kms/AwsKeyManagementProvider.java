package kmsjwt.adapter.out.kms;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;

import org.jboss.logging.Logger;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.kms.KmsAsyncClient;
import software.amazon.awssdk.services.kms.KmsAsyncClientBuilder;

import kmsjwt.core.config.EnvelopeTokenConfig.AwsConfig;
import kmsjwt.core.config.EnvelopeTokenConfig.KmsConfig;
import kmsjwt.core.port.out.KeyManagementClient;
import kmsjwt.spi.KeyManagementProvider;
import kmsjwt.spi.ProviderException;

/**
 * AWS KMS provider.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>kmsjwt.kms.aws.region - AWS region (default: SDK region provider chain)</li>
 *   <li>kmsjwt.kms.aws.endpoint - endpoint override, e.g. for LocalStack</li>
 *   <li>kmsjwt.kms.aws.api-call-timeout - total timeout per KMS call, e.g. PT5S</li>
 * </ul>
 *
 * <p>Credentials come from the SDK default credentials provider chain.
 */
public class AwsKeyManagementProvider implements KeyManagementProvider {

    private static final Logger LOG = Logger.getLogger(AwsKeyManagementProvider.class);

    @Override
    public String name() {
        return "aws";
    }

    @Override
    public String description() {
        return "AWS Key Management Service";
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public boolean isAvailable() {
        try {
            Class.forName("software.amazon.awssdk.services.kms.KmsAsyncClient");
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }

    @Override
    public KeyManagementClient createClient(KmsConfig config) {
        final AwsConfig aws = config.aws();
        final KmsAsyncClientBuilder builder = KmsAsyncClient.builder();

        final Optional<String> region = aws.region();
        region.map(Region::of).ifPresent(builder::region);

        final Optional<URI> endpoint = aws.endpoint();
        endpoint.ifPresent(builder::endpointOverride);

        final Optional<Duration> timeout = aws.apiCallTimeout();
        timeout.ifPresent(t -> builder.overrideConfiguration(
                ClientOverrideConfiguration.builder().apiCallTimeout(t).build()));

        try {
            final KmsAsyncClient client = builder.build();
            LOG.infov(
                    "AWS KMS client created (region: {0}, endpoint: {1}, api call timeout: {2})",
                    region.orElse("(default)"),
                    endpoint.map(URI::toString).orElse("(default)"),
                    timeout.map(Duration::toString).orElse("(sdk default)"));
            return new AwsKeyManagementClient(client);
        } catch (RuntimeException e) {
            throw new ProviderException("Failed to create AWS KMS client: " + e.getMessage(), e);
        }
    }
}
