package kmsjwt.adapter.out.kms;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import io.smallrye.mutiny.Uni;

import kmsjwt.core.model.token.DataKey;
import kmsjwt.core.model.token.KeySpec;
import kmsjwt.core.port.out.KeyManagementClient;

/**
 * In-process key-management service for development and tests.
 *
 * <p>Master keys are AES keys held in memory. Data keys are wrapped with
 * AES-GCM under the master key, using the master key id as associated data.
 * The ciphertext blob names its master key, so decryption needs no key id:
 * <pre>
 * [1 byte id length][master key id, UTF-8][12 byte IV][ciphertext + 16 byte tag]
 * </pre>
 */
public class InMemoryKeyManagementClient implements KeyManagementClient {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;

    private final Map<String, SecretKey> masterKeys = new ConcurrentHashMap<>();
    private final SecureRandom secureRandom = new SecureRandom();

    @Override
    public String name() {
        return "in-memory";
    }

    /**
     * Register a master key.
     *
     * @param masterKeyId id used in generate requests, at most 255 UTF-8 bytes
     * @param keyBytes    a 128, 192 or 256 bit AES key
     */
    public void registerMasterKey(String masterKeyId, byte[] keyBytes) {
        if (masterKeyId == null || masterKeyId.isBlank()) {
            throw new IllegalArgumentException("Master key id cannot be null or blank");
        }
        if (masterKeyId.getBytes(StandardCharsets.UTF_8).length > 255) {
            throw new IllegalArgumentException("Master key id is longer than 255 bytes");
        }
        if (keyBytes == null || (keyBytes.length != 16 && keyBytes.length != 24 && keyBytes.length != 32)) {
            throw new IllegalArgumentException("Master key must be 128, 192 or 256 bits");
        }
        masterKeys.put(masterKeyId, new SecretKeySpec(keyBytes, "AES"));
    }

    /**
     * Register a master key with random key material.
     */
    public void createMasterKey(String masterKeyId) {
        final byte[] keyBytes = new byte[32];
        secureRandom.nextBytes(keyBytes);
        registerMasterKey(masterKeyId, keyBytes);
    }

    @Override
    public Uni<DataKey> generateDataKey(String masterKeyId, KeySpec keySpec) {
        return Uni.createFrom().item(() -> {
            final SecretKey masterKey = requireMasterKey(masterKeyId);
            final byte[] plaintext = new byte[keySpec.lengthBytes()];
            secureRandom.nextBytes(plaintext);
            return new DataKey(plaintext, wrap(masterKeyId, masterKey, plaintext));
        });
    }

    @Override
    public Uni<byte[]> decrypt(byte[] ciphertext) {
        return Uni.createFrom().item(() -> unwrap(ciphertext));
    }

    private SecretKey requireMasterKey(String masterKeyId) {
        final SecretKey masterKey = masterKeyId == null ? null : masterKeys.get(masterKeyId);
        if (masterKey == null) {
            throw new MasterKeyNotFoundException("Master key not found: " + masterKeyId);
        }
        return masterKey;
    }

    private byte[] wrap(String masterKeyId, SecretKey masterKey, byte[] plaintext) {
        try {
            final byte[] iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);
            final byte[] keyIdBytes = masterKeyId.getBytes(StandardCharsets.UTF_8);

            final Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, masterKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            cipher.updateAAD(keyIdBytes);
            final byte[] sealed = cipher.doFinal(plaintext);

            final ByteBuffer buffer = ByteBuffer.allocate(1 + keyIdBytes.length + IV_LENGTH + sealed.length);
            buffer.put((byte) keyIdBytes.length);
            buffer.put(keyIdBytes);
            buffer.put(iv);
            buffer.put(sealed);
            return buffer.array();
        } catch (GeneralSecurityException e) {
            throw new KeyManagementException("Failed to wrap data key", e);
        }
    }

    private byte[] unwrap(byte[] blob) {
        if (blob == null || blob.length < 1) {
            throw new InvalidCiphertextException("Ciphertext is empty");
        }
        final ByteBuffer buffer = ByteBuffer.wrap(blob);
        final int keyIdLength = Byte.toUnsignedInt(buffer.get());
        if (keyIdLength == 0 || buffer.remaining() < keyIdLength + IV_LENGTH + TAG_LENGTH_BITS / 8) {
            throw new InvalidCiphertextException("Ciphertext is truncated");
        }

        final byte[] keyIdBytes = new byte[keyIdLength];
        buffer.get(keyIdBytes);
        final byte[] iv = new byte[IV_LENGTH];
        buffer.get(iv);
        final byte[] sealed = new byte[buffer.remaining()];
        buffer.get(sealed);

        final String masterKeyId = new String(keyIdBytes, StandardCharsets.UTF_8);
        final SecretKey masterKey = masterKeys.get(masterKeyId);
        if (masterKey == null) {
            throw new InvalidCiphertextException("Ciphertext references unknown master key: " + masterKeyId);
        }

        try {
            final Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, masterKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            cipher.updateAAD(keyIdBytes);
            return cipher.doFinal(sealed);
        } catch (GeneralSecurityException e) {
            throw new InvalidCiphertextException("Ciphertext failed authentication", e);
        }
    }

    /**
     * Base exception for in-memory key-management failures.
     */
    public static class KeyManagementException extends RuntimeException {
        public KeyManagementException(String message) {
            super(message);
        }

        public KeyManagementException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Thrown when a generate request names an unregistered master key.
     */
    public static class MasterKeyNotFoundException extends KeyManagementException {
        public MasterKeyNotFoundException(String message) {
            super(message);
        }
    }

    /**
     * Thrown when a ciphertext blob is malformed, tampered with, or wrapped by an unknown key.
     */
    public static class InvalidCiphertextException extends KeyManagementException {
        public InvalidCiphertextException(String message) {
            super(message);
        }

        public InvalidCiphertextException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
