package kmsjwt.spi;

import kmsjwt.core.config.EnvelopeTokenConfig.KmsConfig;
import kmsjwt.core.port.out.KeyManagementClient;

/**
 * Service Provider Interface for key-management service clients.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}. The
 * provider named by {@code kmsjwt.kms.provider} is used; without that setting
 * the highest priority available provider wins.
 *
 * <h2>Built-in Providers</h2>
 * <ul>
 *   <li><b>aws</b>: AWS KMS (priority: 100)</li>
 *   <li><b>in-memory</b>: local AES-GCM master keys for development and tests (priority: 0)</li>
 * </ul>
 */
public interface KeyManagementProvider {

    /**
     * Unique name identifying this provider.
     *
     * <p>Used in configuration: kmsjwt.kms.provider={name}
     */
    String name();

    /**
     * Human-readable description for logging and diagnostics.
     */
    default String description() {
        return name() + " key-management provider";
    }

    /**
     * Priority for auto-selection when no explicit provider is configured.
     * Higher values win.
     */
    default int priority() {
        return 0;
    }

    /**
     * Check if this provider can be used (dependencies present, configuration complete).
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Create the client. Called once at startup; the client must be thread-safe.
     *
     * @param config the {@code kmsjwt.kms} settings; each provider reads its own group
     * @return the key-management client
     * @throws ProviderException if initialization fails
     */
    KeyManagementClient createClient(KmsConfig config);
}
