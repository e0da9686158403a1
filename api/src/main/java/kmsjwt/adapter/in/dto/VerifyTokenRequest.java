package kmsjwt.adapter.in.dto;

/**
 * DTO for token verification requests.
 *
 * @param token        compact serialized token
 * @param signingKeyId expected signing key (optional when a default is configured)
 */
public record VerifyTokenRequest(String token, String signingKeyId) {}
