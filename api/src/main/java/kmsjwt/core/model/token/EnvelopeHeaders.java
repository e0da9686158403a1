package kmsjwt.core.model.token;

import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import kmsjwt.core.exception.MalformedEnvelopeException;

/**
 * The three protected headers that route a token to its data key.
 *
 * @param appId         client application id ({@code aid})
 * @param keyId         unique id of this issuance, used only in cache keys ({@code kid})
 * @param keyCiphertext standard base64 of the data key ciphertext ({@code kct})
 */
public record EnvelopeHeaders(String appId, String keyId, String keyCiphertext) {

    public EnvelopeHeaders {
        if (appId == null || appId.isBlank()) {
            throw new IllegalArgumentException("App id cannot be null or blank");
        }
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("Key id cannot be null or blank");
        }
        if (keyCiphertext == null || keyCiphertext.isBlank()) {
            throw new IllegalArgumentException("Key ciphertext cannot be null or blank");
        }
    }

    /**
     * Headers for a fresh issuance. The key id is a new random UUID.
     */
    public static EnvelopeHeaders forIssuance(String appId, byte[] ciphertext) {
        return new EnvelopeHeaders(
                appId, UUID.randomUUID().toString(), Base64.getEncoder().encodeToString(ciphertext));
    }

    /**
     * Read the envelope headers from a token's protected headers.
     *
     * @throws MalformedEnvelopeException if any of the three headers is missing or blank
     */
    public static EnvelopeHeaders from(Map<String, String> headers, EnvelopeProtocol protocol) {
        final String appId = headers.get(protocol.appIdHeader());
        final String keyId = headers.get(protocol.keyIdHeader());
        final String ciphertext = headers.get(protocol.keyCiphertextHeader());

        final List<String> missing = new ArrayList<>();
        if (appId == null || appId.isBlank()) {
            missing.add(protocol.appIdHeader());
        }
        if (keyId == null || keyId.isBlank()) {
            missing.add(protocol.keyIdHeader());
        }
        if (ciphertext == null || ciphertext.isBlank()) {
            missing.add(protocol.keyCiphertextHeader());
        }
        if (!missing.isEmpty()) {
            throw MalformedEnvelopeException.missingHeaders(missing);
        }
        return new EnvelopeHeaders(appId, keyId, ciphertext);
    }

    /**
     * Decoded data key ciphertext.
     *
     * @throws MalformedEnvelopeException if the header is not standard base64
     */
    public byte[] decodeCiphertext() {
        try {
            return Base64.getDecoder().decode(keyCiphertext);
        } catch (IllegalArgumentException e) {
            throw new MalformedEnvelopeException("Key ciphertext header is not valid base64", e);
        }
    }

    public String cacheKey(EnvelopeProtocol protocol) {
        return protocol.cacheKey(appId, keyId);
    }

    public Map<String, String> toHeaderMap(EnvelopeProtocol protocol) {
        final Map<String, String> headers = new LinkedHashMap<>();
        headers.put(protocol.appIdHeader(), appId);
        headers.put(protocol.keyIdHeader(), keyId);
        headers.put(protocol.keyCiphertextHeader(), keyCiphertext);
        return headers;
    }
}
