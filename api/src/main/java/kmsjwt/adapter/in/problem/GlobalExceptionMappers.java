package kmsjwt.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import kmsjwt.core.exception.ClaimConflictException;
import kmsjwt.core.exception.DataKeyCacheException;
import kmsjwt.core.exception.InvalidSignatureException;
import kmsjwt.core.exception.KeyDecryptionException;
import kmsjwt.core.exception.KeyGenerationException;
import kmsjwt.core.exception.MalformedEnvelopeException;
import kmsjwt.core.exception.MalformedTokenException;
import kmsjwt.core.exception.TokenSigningException;

/**
 * Global exception mappers for converting token failures to RFC 7807 Problem Details.
 *
 * <p>The token service already logs each failure once, so these mappers log at
 * debug only.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapMalformedTokenException(MalformedTokenException e) {
        LOG.debugv("Malformed token: {0}", e.getMessage());
        return toResponse(TokenProblem.malformedToken(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapMalformedEnvelopeException(MalformedEnvelopeException e) {
        LOG.debugv("Malformed envelope: {0}", e.getMessage());
        return toResponse(TokenProblem.malformedEnvelope(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapClaimConflictException(ClaimConflictException e) {
        LOG.debugv("Claim conflict: {0}", e.getMessage());
        return toResponse(TokenProblem.claimConflict(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapInvalidSignatureException(InvalidSignatureException e) {
        LOG.debugv("Invalid signature: {0}", e.getMessage());
        return toResponse(TokenProblem.invalidSignature());
    }

    @ServerExceptionMapper
    public Response mapKeyDecryptionException(KeyDecryptionException e) {
        LOG.debugv("Key decryption failed: {0}", e.getMessage());
        return toResponse(TokenProblem.keyDecryptionFailed());
    }

    @ServerExceptionMapper
    public Response mapKeyGenerationException(KeyGenerationException e) {
        LOG.debugv("Key generation failed: {0}", e.getMessage());
        return toResponse(TokenProblem.keyGenerationFailed());
    }

    @ServerExceptionMapper
    public Response mapTokenSigningException(TokenSigningException e) {
        LOG.debugv("Token signing failed: {0}", e.getMessage());
        return toResponse(TokenProblem.signingFailed());
    }

    @ServerExceptionMapper
    public Response mapDataKeyCacheException(DataKeyCacheException e) {
        LOG.debugv("Data key cache failure: {0}", e.getMessage());
        return toResponse(TokenProblem.cacheUnavailable());
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(TokenProblem.validationError(e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
