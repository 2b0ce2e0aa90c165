package tech.identitycore.server.authorize;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.identitycore.server.account.AuthenticatedSubject;
import tech.identitycore.server.authorize.AuthorizationOutcome.Authenticated;
import tech.identitycore.server.authorize.AuthorizationOutcome.CodeIssued;
import tech.identitycore.server.authorize.AuthorizationOutcome.Rejected;
import tech.identitycore.server.authorize.AuthorizationOutcome.Validated;
import tech.identitycore.server.config.IdentityConfig;
import tech.identitycore.server.error.OAuthError;
import tech.identitycore.server.grant.AuthorizationCode;
import tech.identitycore.server.grant.AuthorizationCodeRepository;
import tech.identitycore.server.grant.OpaqueTokens;
import tech.identitycore.server.registry.ClientRegistry;
import tech.identitycore.server.registry.GrantType;
import tech.identitycore.server.registry.RegisteredClient;
import tech.identitycore.server.registry.ResourceRegistry;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Authorization endpoint state machine.
 *
 * Validation runs in a fixed order. Until the client and its redirect URI are trusted,
 * errors are returned directly; after that they are delivered to the redirect URI
 * together with the caller's state.
 */
@ApplicationScoped
public class AuthorizationEndpoint {

    private static final Logger LOG = Logger.getLogger(AuthorizationEndpoint.class);

    static final String RESPONSE_TYPE_CODE = "code";

    @Inject
    ClientRegistry clientRegistry;

    @Inject
    ResourceRegistry resourceRegistry;

    @Inject
    AuthorizationCodeRepository codeRepository;

    @Inject
    PkceService pkceService;

    @Inject
    IdentityConfig config;

    /**
     * Run a request through the state machine.
     *
     * @param subject the logged-in resource owner, if any
     * @return {@link Rejected}, {@link Validated} when a login is still needed, or {@link CodeIssued}
     */
    public AuthorizationOutcome process(AuthorizationRequest request, Optional<AuthenticatedSubject> subject,
            Instant now) {
        AuthorizationOutcome outcome = validate(request);
        if (!(outcome instanceof Validated validated) || subject.isEmpty()) {
            return outcome;
        }
        return issueCode(authenticate(validated, subject.get()), now);
    }

    /**
     * RECEIVED to VALIDATED or REJECTED.
     */
    public AuthorizationOutcome validate(AuthorizationRequest request) {
        return transition(AuthorizationState.RECEIVED, checkRequest(request), request.clientId());
    }

    /**
     * VALIDATED to AUTHENTICATED once the resource owner has logged in.
     */
    public Authenticated authenticate(Validated validated, AuthenticatedSubject subject) {
        return transition(validated.status(), new Authenticated(validated, subject), validated.client().clientId());
    }

    private AuthorizationOutcome checkRequest(AuthorizationRequest request) {
        String clientId = request.clientId();
        if (clientId == null || clientId.isBlank()) {
            return direct(OAuthError.INVALID_REQUEST, "client_id is required");
        }

        Optional<RegisteredClient> clientOpt = clientRegistry.lookupClient(clientId);
        if (clientOpt.isEmpty()) {
            LOG.warnf("Authorization request with unknown client_id: %s", clientId);
            return direct(OAuthError.INVALID_CLIENT, "Unknown client_id");
        }
        RegisteredClient client = clientOpt.get();

        String redirectUri = request.redirectUri();
        if (redirectUri == null || redirectUri.isBlank()) {
            return direct(OAuthError.INVALID_REQUEST, "redirect_uri is required");
        }
        if (!client.isRedirectUriAllowed(redirectUri)) {
            // Never redirect to an unregistered URI
            LOG.warnf("Authorization request with invalid redirect_uri: %s for client %s", redirectUri, clientId);
            return direct(OAuthError.INVALID_REQUEST, "redirect_uri not allowed for this client");
        }

        // From here on the redirect URI is trusted
        String state = request.state();

        if (!RESPONSE_TYPE_CODE.equals(request.responseType())) {
            return redirect(OAuthError.UNSUPPORTED_RESPONSE_TYPE, "Only 'code' response type is supported",
                redirectUri, state);
        }
        if (!client.isGrantTypeAllowed(GrantType.AUTHORIZATION_CODE)) {
            LOG.warnf("authorization_code grant not allowed for client %s", clientId);
            return redirect(OAuthError.UNAUTHORIZED_CLIENT, "authorization_code grant not allowed for this client",
                redirectUri, state);
        }

        Set<String> scopes = request.requestedScopes();
        if (scopes.isEmpty()) {
            return redirect(OAuthError.INVALID_REQUEST, "scope is required", redirectUri, state);
        }
        for (String scope : scopes) {
            if (!resourceRegistry.isKnownScope(scope) || !clientRegistry.isScopeAllowed(client, scope)) {
                LOG.warnf("Client %s requested scope %s which is unknown or not allowed", clientId, scope);
                return redirect(OAuthError.INVALID_SCOPE, "Scope not allowed: " + scope, redirectUri, state);
            }
        }

        String challenge = request.codeChallenge();
        boolean challengePresent = challenge != null && !challenge.isEmpty();
        if (client.requirePkce() && !challengePresent) {
            return redirect(OAuthError.INVALID_REQUEST, "code_challenge required for this client", redirectUri, state);
        }
        if (challengePresent) {
            if (!pkceService.isSupportedMethod(request.codeChallengeMethod())) {
                return redirect(OAuthError.INVALID_REQUEST, "code_challenge_method must be S256", redirectUri, state);
            }
            if (!pkceService.isValidCodeChallenge(challenge)) {
                return redirect(OAuthError.INVALID_REQUEST, "Invalid code_challenge format", redirectUri, state);
            }
        }

        return new Validated(client, request, scopes);
    }

    /**
     * AUTHENTICATED to CODE_ISSUED: mint a code bound to client, subject, redirect URI,
     * scopes and PKCE challenge.
     */
    public CodeIssued issueCode(Authenticated authenticated, Instant now) {
        Validated validated = authenticated.validated();
        AuthenticatedSubject subject = authenticated.subject();
        AuthorizationRequest request = validated.request();
        String challenge = request.codeChallenge();
        boolean challengePresent = challenge != null && !challenge.isEmpty();

        AuthorizationCode code = new AuthorizationCode(
            OpaqueTokens.generate(),
            validated.client().clientId(),
            subject.subjectId(),
            subject.claims(),
            request.redirectUri(),
            validated.scopes(),
            challengePresent ? challenge : null,
            challengePresent ? request.codeChallengeMethod() : null,
            request.nonce(),
            subject.authTime(),
            now,
            now.plus(config.tokens().authorizationCodeTtl()));
        codeRepository.persist(code);

        LOG.infof("Authorization code issued for client %s, subject %s", code.clientId, code.subjectId);
        return transition(authenticated.status(), new CodeIssued(request.redirectUri(), code.code, request.state()),
            code.clientId);
    }

    private static <T extends AuthorizationOutcome> T transition(AuthorizationState from, T outcome, String clientId) {
        if (!from.canTransitionTo(outcome.status())) {
            throw new IllegalStateException("Illegal authorization transition " + from + " -> " + outcome.status());
        }
        LOG.debugf("Authorization request for client %s: %s -> %s", clientId, from, outcome.status());
        return outcome;
    }

    private static Rejected direct(OAuthError error, String description) {
        return new Rejected(error, description, null, null);
    }

    private static Rejected redirect(OAuthError error, String description, String redirectUri, String state) {
        return new Rejected(error, description, redirectUri, state);
    }
}
