package kmsjwt.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import kmsjwt.adapter.in.dto.IssueTokenRequest;
import kmsjwt.adapter.in.dto.IssueTokenResponse;
import kmsjwt.adapter.in.dto.VerifiedTokenResponse;
import kmsjwt.adapter.in.dto.VerifyTokenRequest;
import kmsjwt.adapter.in.problem.TokenProblem;
import kmsjwt.core.config.EnvelopeTokenConfig;
import kmsjwt.core.port.in.EnvelopeTokenUseCase;
import kmsjwt.core.port.in.KeyCacheOption;

/**
 * REST resource for issuing and verifying envelope tokens.
 *
 * <p>Verification uses the configured {@link KeyCacheOption}.
 */
@Path("/tokens")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class EnvelopeTokenResource {

    private final EnvelopeTokenUseCase tokens;
    private final KeyCacheOption cacheOption;
    private final EnvelopeTokenConfig config;

    @Inject
    public EnvelopeTokenResource(EnvelopeTokenUseCase tokens, KeyCacheOption cacheOption, EnvelopeTokenConfig config) {
        this.tokens = tokens;
        this.cacheOption = cacheOption;
        this.config = config;
    }

    /**
     * Issue a token signed with a fresh data key.
     *
     * @param request the token contents
     * @return 201 with the compact token
     */
    @POST
    public Uni<Response> issue(IssueTokenRequest request) {
        if (request == null) {
            return Uni.createFrom().failure(TokenProblem.badRequest("Request body is required"));
        }
        return Uni.createFrom()
                .item(request::toTokenRequest)
                .flatMap(tokens::issueToken)
                .map(token -> Response.status(Response.Status.CREATED)
                        .entity(new IssueTokenResponse(token))
                        .build());
    }

    /**
     * Verify a token and return its headers and claims.
     *
     * @param request the token and expected signing key
     * @return the verified headers and claims
     */
    @POST
    @Path("/verify")
    public Uni<VerifiedTokenResponse> verify(VerifyTokenRequest request) {
        if (request == null || request.token() == null || request.token().isBlank()) {
            return Uni.createFrom().failure(TokenProblem.badRequest("token is required"));
        }
        final String signingKeyId = request.signingKeyId() != null
                ? request.signingKeyId()
                : config.verify().defaultSigningKeyId().orElse(null);
        if (signingKeyId == null || signingKeyId.isBlank()) {
            return Uni.createFrom().failure(TokenProblem.badRequest("signingKeyId is required"));
        }

        return tokens.parseAndVerify(request.token(), signingKeyId, cacheOption)
                .map(VerifiedTokenResponse::from);
    }
}
