package kmsjwt.adapter.in.dto;

import java.util.Map;

import kmsjwt.core.model.token.Token;

/**
 * DTO for a verified token's protected headers and claims.
 */
public record VerifiedTokenResponse(Map<String, String> headers, Map<String, Object> claims) {

    public static VerifiedTokenResponse from(Token token) {
        return new VerifiedTokenResponse(token.headers(), token.claims());
    }
}
