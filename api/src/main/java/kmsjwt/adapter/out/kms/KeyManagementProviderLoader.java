package kmsjwt.adapter.out.kms;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import kmsjwt.core.config.EnvelopeTokenConfig;
import kmsjwt.core.config.EnvelopeTokenConfig.KmsConfig;
import kmsjwt.core.port.out.KeyManagementClient;
import kmsjwt.spi.KeyManagementProvider;
import kmsjwt.spi.ProviderException;

/**
 * Discovers key-management providers via ServiceLoader and produces the
 * {@link KeyManagementClient}.
 *
 * <p>Provider selection:
 * <ol>
 *   <li>If kmsjwt.kms.provider is set, use that provider</li>
 *   <li>Otherwise, select the highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class KeyManagementProviderLoader {

    private static final Logger LOG = Logger.getLogger(KeyManagementProviderLoader.class);

    private final KmsConfig config;

    @Inject
    public KeyManagementProviderLoader(EnvelopeTokenConfig tokenConfig) {
        this(tokenConfig.kms());
    }

    KeyManagementProviderLoader(KmsConfig config) {
        this.config = config;
    }

    @Produces
    @ApplicationScoped
    public KeyManagementClient keyManagementClient() {
        final KeyManagementProvider provider = selectProvider();
        LOG.infov("Creating key-management client from provider: {0} ({1})", provider.name(), provider.description());
        return provider.createClient(config);
    }

    KeyManagementProvider selectProvider() {
        final List<KeyManagementProvider> providers = new ArrayList<>();
        ServiceLoader.load(KeyManagementProvider.class).forEach(providers::add);

        if (providers.isEmpty()) {
            throw new ProviderException(
                    "No key-management providers found. Ensure a provider JAR is on the classpath.");
        }

        LOG.infov(
                "Found {0} key-management provider(s): {1}",
                providers.size(),
                providers.stream().map(KeyManagementProvider::name).toList());

        final String configured = config.provider().orElse(null);
        if (configured != null && !configured.isBlank()) {
            return providers.stream()
                    .filter(p -> p.name().equals(configured))
                    .findFirst()
                    .orElseThrow(() -> new ProviderException("Configured key-management provider not found: "
                            + configured + ". Available: "
                            + providers.stream().map(KeyManagementProvider::name).toList()));
        }

        return providers.stream()
                .filter(KeyManagementProvider::isAvailable)
                .max(Comparator.comparingInt(KeyManagementProvider::priority))
                .orElseThrow(() -> new ProviderException("No available key-management providers"));
    }
}
