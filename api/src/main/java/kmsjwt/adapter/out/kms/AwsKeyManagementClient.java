package kmsjwt.adapter.out.kms;

import java.util.concurrent.CompletionException;

import io.smallrye.mutiny.Uni;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.kms.KmsAsyncClient;
import software.amazon.awssdk.services.kms.model.DataKeySpec;
import software.amazon.awssdk.services.kms.model.DecryptRequest;
import software.amazon.awssdk.services.kms.model.GenerateDataKeyRequest;

import kmsjwt.core.model.token.DataKey;
import kmsjwt.core.model.token.KeySpec;
import kmsjwt.core.port.out.KeyManagementClient;

/**
 * AWS KMS client backed by the SDK's asynchronous client.
 *
 * <p>SDK futures are bridged to {@link Uni}. Retries and timeouts are whatever
 * the SDK client was built with; failures surface with the SDK exception
 * (e.g. {@code NotFoundException}, {@code InvalidCiphertextException}) unwrapped.
 */
public class AwsKeyManagementClient implements KeyManagementClient {

    private final KmsAsyncClient client;

    public AwsKeyManagementClient(KmsAsyncClient client) {
        this.client = client;
    }

    @Override
    public String name() {
        return "aws";
    }

    @Override
    public Uni<DataKey> generateDataKey(String masterKeyId, KeySpec keySpec) {
        final GenerateDataKeyRequest request = GenerateDataKeyRequest.builder()
                .keyId(masterKeyId)
                .keySpec(toDataKeySpec(keySpec))
                .build();

        return Uni.createFrom()
                .completionStage(() -> client.generateDataKey(request))
                .onFailure(CompletionException.class)
                .transform(AwsKeyManagementClient::unwrap)
                .map(response -> new DataKey(
                        response.plaintext().asByteArray(),
                        response.ciphertextBlob().asByteArray()));
    }

    @Override
    public Uni<byte[]> decrypt(byte[] ciphertext) {
        final DecryptRequest request = DecryptRequest.builder()
                .ciphertextBlob(SdkBytes.fromByteArray(ciphertext))
                .build();

        return Uni.createFrom()
                .completionStage(() -> client.decrypt(request))
                .onFailure(CompletionException.class)
                .transform(AwsKeyManagementClient::unwrap)
                .map(response -> response.plaintext().asByteArray());
    }

    static DataKeySpec toDataKeySpec(KeySpec keySpec) {
        return switch (keySpec) {
            case AES_128 -> DataKeySpec.AES_128;
            case AES_256 -> DataKeySpec.AES_256;
        };
    }

    private static Throwable unwrap(Throwable failure) {
        return failure.getCause() != null ? failure.getCause() : failure;
    }
}
