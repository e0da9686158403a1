package kmsjwt.core.model.token;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Input to token issuance.
 *
 * @param masterKeyId   the client's master key id at the key-management service
 * @param clientAppId   the client application id, written to the {@code aid} header
 * @param audience      the {@code aud} claim, at least one entry
 * @param subject       the {@code sub} claim
 * @param issuedAt      the {@code iat} claim, Unix seconds
 * @param expiresAt     the {@code exp} claim, Unix seconds, after {@code issuedAt}; both must lie
 *                      within the range of {@link java.time.Instant}
 * @param customClaims  additional claims; may not use standard claim names
 * @param signingKeyId  name of the signing key
 */
public record TokenRequest(
        String masterKeyId,
        String clientAppId,
        List<String> audience,
        String subject,
        long issuedAt,
        long expiresAt,
        Map<String, Object> customClaims,
        String signingKeyId) {

    public TokenRequest {
        if (masterKeyId == null || masterKeyId.isBlank()) {
            throw new IllegalArgumentException("Master key id cannot be null or blank");
        }
        if (clientAppId == null || clientAppId.isBlank()) {
            throw new IllegalArgumentException("Client app id cannot be null or blank");
        }
        if (audience == null || audience.isEmpty()) {
            throw new IllegalArgumentException("Audience cannot be null or empty");
        }
        if (subject == null) {
            throw new IllegalArgumentException("Subject cannot be null");
        }
        if (!ClaimNames.isNumericDateInRange(issuedAt)) {
            throw new IllegalArgumentException(
                    "Issued-at (%d) is outside the supported date range".formatted(issuedAt));
        }
        if (!ClaimNames.isNumericDateInRange(expiresAt)) {
            throw new IllegalArgumentException(
                    "Expiry (%d) is outside the supported date range".formatted(expiresAt));
        }
        if (expiresAt <= issuedAt) {
            throw new IllegalArgumentException(
                    "Expiry (%d) must be after issued-at (%d)".formatted(expiresAt, issuedAt));
        }
        if (signingKeyId == null || signingKeyId.isBlank()) {
            throw new IllegalArgumentException("Signing key id cannot be null or blank");
        }
        audience = List.copyOf(audience);
        customClaims = customClaims == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(customClaims));
    }
}
