package kmsjwt.adapter.in.dto;

import java.util.List;
import java.util.Map;

import kmsjwt.core.model.token.TokenRequest;

/**
 * DTO for token issuance requests.
 *
 * @param masterKeyId  master key that wraps the token's data key
 * @param clientAppId  application the token is issued to, carried in the {@code aid} header
 * @param audience     audiences of the token
 * @param subject      subject of the token
 * @param issuedAt     issue time in epoch seconds
 * @param expiresAt    expiry in epoch seconds
 * @param customClaims additional claims (optional)
 * @param signingKeyId name of the signing key
 */
public record IssueTokenRequest(
        String masterKeyId,
        String clientAppId,
        List<String> audience,
        String subject,
        Long issuedAt,
        Long expiresAt,
        Map<String, Object> customClaims,
        String signingKeyId) {

    public TokenRequest toTokenRequest() {
        if (issuedAt == null || expiresAt == null) {
            throw new IllegalArgumentException("issuedAt and expiresAt are required");
        }
        return new TokenRequest(
                masterKeyId,
                clientAppId,
                audience,
                subject,
                issuedAt,
                expiresAt,
                customClaims != null ? customClaims : Map.of(),
                signingKeyId);
    }
}
