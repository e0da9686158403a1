package kmsjwt.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for token errors.
 *
 * <p>Details never echo key material or the token itself.
 */
public final class TokenProblem {

    private TokenProblem() {
        // Utility class - prevent instantiation
    }

    // ========== Bad Request Errors ==========

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem validationError(String detail) {
        return HttpProblem.builder()
                .withTitle("Validation Error")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem malformedToken(String detail) {
        return HttpProblem.builder()
                .withTitle("Malformed Token")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem malformedEnvelope(String detail) {
        return HttpProblem.builder()
                .withTitle("Malformed Token Envelope")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem claimConflict(String detail) {
        return HttpProblem.builder()
                .withTitle("Claim Conflict")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    // ========== Authentication Errors ==========

    public static HttpProblem invalidSignature() {
        return HttpProblem.builder()
                .withTitle("Invalid Token Signature")
                .withStatus(Status.UNAUTHORIZED)
                .withDetail("Token signature does not match its envelope key")
                .build();
    }

    public static HttpProblem keyDecryptionFailed() {
        return HttpProblem.builder()
                .withTitle("Token Key Decryption Failed")
                .withStatus(Status.UNAUTHORIZED)
                .withDetail("The token's data key could not be decrypted")
                .build();
    }

    // ========== Server Errors ==========

    public static HttpProblem signingFailed() {
        return HttpProblem.builder()
                .withTitle("Token Signing Failed")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail("The token could not be signed with its data key")
                .build();
    }

    // ========== Upstream Errors ==========

    public static HttpProblem keyGenerationFailed() {
        return HttpProblem.builder()
                .withTitle("Key Generation Failed")
                .withStatus(Status.BAD_GATEWAY)
                .withDetail("Key-management service could not generate a data key")
                .build();
    }

    public static HttpProblem cacheUnavailable() {
        return HttpProblem.builder()
                .withTitle("Data Key Cache Unavailable")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail("Data key cache could not be reached")
                .build();
    }
}
