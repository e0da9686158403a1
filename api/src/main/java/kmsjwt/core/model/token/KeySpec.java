package kmsjwt.core.model.token;

/**
 * Data key specifications understood by the key-management service.
 */
public enum KeySpec {
    AES_128(16),
    AES_256(32);

    private final int lengthBytes;

    KeySpec(int lengthBytes) {
        this.lengthBytes = lengthBytes;
    }

    /**
     * Length of a plaintext data key of this spec.
     */
    public int lengthBytes() {
        return lengthBytes;
    }
}
