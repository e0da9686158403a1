package kmsjwt.core.model.token;

import java.util.Arrays;
import javax.security.auth.Destroyable;

/**
 * A data key as returned by the key-management service: the plaintext secret
 * and its ciphertext under the master key.
 *
 * <p>The plaintext is owned by whoever consumes it and should be destroyed once
 * the token has been signed. The ciphertext is the only form that leaves the
 * process.
 */
public final class DataKey implements Destroyable {

    private final byte[] plaintext;
    private final byte[] ciphertext;
    private volatile boolean destroyed;

    public DataKey(byte[] plaintext, byte[] ciphertext) {
        if (plaintext == null || plaintext.length == 0) {
            throw new IllegalArgumentException("Plaintext cannot be null or empty");
        }
        if (ciphertext == null || ciphertext.length == 0) {
            throw new IllegalArgumentException("Ciphertext cannot be null or empty");
        }
        this.plaintext = plaintext.clone();
        this.ciphertext = ciphertext.clone();
    }

    /**
     * Copy of the plaintext key material.
     *
     * @throws IllegalStateException if the key was destroyed
     */
    public byte[] plaintext() {
        if (destroyed) {
            throw new IllegalStateException("Data key has been destroyed");
        }
        return plaintext.clone();
    }

    public byte[] ciphertext() {
        return ciphertext.clone();
    }

    public int length() {
        return plaintext.length;
    }

    @Override
    public void destroy() {
        Arrays.fill(plaintext, (byte) 0);
        destroyed = true;
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public String toString() {
        return "DataKey[length=" + plaintext.length + ", ciphertextLength=" + ciphertext.length + "]";
    }
}
