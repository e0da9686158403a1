package kmsjwt.adapter.out.kms;

import java.util.Base64;
import java.util.Map;

import org.jboss.logging.Logger;

import kmsjwt.core.config.EnvelopeTokenConfig.KmsConfig;
import kmsjwt.core.port.out.KeyManagementClient;
import kmsjwt.spi.KeyManagementProvider;
import kmsjwt.spi.ProviderException;

/**
 * In-memory key-management provider for development and tests.
 *
 * <p>Master keys are configured as base64 AES keys:
 * <pre>
 * kmsjwt.kms.in-memory.master-keys.master-1=${MASTER_1_KEY}
 * </pre>
 *
 * <p>Key material lives only in process memory. Tokens issued by one process
 * verify in another only if both are configured with the same master keys.
 */
public class InMemoryKeyManagementProvider implements KeyManagementProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryKeyManagementProvider.class);

    @Override
    public String name() {
        return "in-memory";
    }

    @Override
    public String description() {
        return "In-memory key management (development only)";
    }

    @Override
    public KeyManagementClient createClient(KmsConfig config) {
        final InMemoryKeyManagementClient client = new InMemoryKeyManagementClient();
        final Map<String, String> masterKeys = config.inMemory().masterKeys();

        for (Map.Entry<String, String> entry : masterKeys.entrySet()) {
            final String masterKeyId = entry.getKey();
            try {
                client.registerMasterKey(masterKeyId, Base64.getDecoder().decode(entry.getValue()));
            } catch (IllegalArgumentException e) {
                throw new ProviderException("Invalid in-memory master key '" + masterKeyId + "': " + e.getMessage(), e);
            }
        }

        LOG.warnv(
                "Using in-memory key management with {0} master key(s). Not for production use.", masterKeys.size());
        return client;
    }
}
