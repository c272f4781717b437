package warden.core.service.token;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.TokenConfig;
import warden.core.exception.AuthenticationException;
import warden.core.exception.EmptyMethodsException;
import warden.core.model.token.AuthenticationRequest;
import warden.core.model.token.EndpointRecord;
import warden.core.model.token.IssueRequest;
import warden.core.model.token.IssuedToken;
import warden.core.model.token.Principal;
import warden.core.model.token.TokenPayload;
import warden.core.model.token.TokenScope;
import warden.core.port.out.AssignmentBackend;
import warden.core.port.out.CatalogBackend;
import warden.core.port.out.IdentityBackend;
import warden.core.port.out.TokenMetrics;

/**
 * Mints tokens.
 *
 * <p>{@link #issue} encodes a payload for an already authenticated principal in the
 * configured format. {@link #authenticate} first verifies every presented method,
 * resolves roles and the catalog for the requested scope, and then issues.
 */
@ApplicationScoped
public class TokenIssuanceService {

    private static final Logger LOG = Logger.getLogger(TokenIssuanceService.class);

    /** Some clients persist tokens in 255 character columns. */
    static final int LONG_TOKEN_THRESHOLD = 255;

    private final PayloadBuilder payloadBuilder;
    private final TokenFormatRegistry formats;
    private final TokenValidationService validationService;
    private final IdentityBackend identityBackend;
    private final AssignmentBackend assignmentBackend;
    private final CatalogBackend catalogBackend;
    private final TokenConfig config;
    private final TokenMetrics metrics;

    @Inject
    public TokenIssuanceService(
            PayloadBuilder payloadBuilder,
            TokenFormatRegistry formats,
            TokenValidationService validationService,
            IdentityBackend identityBackend,
            AssignmentBackend assignmentBackend,
            CatalogBackend catalogBackend,
            TokenConfig config,
            TokenMetrics metrics) {
        this.payloadBuilder = payloadBuilder;
        this.formats = formats;
        this.validationService = validationService;
        this.identityBackend = identityBackend;
        this.assignmentBackend = assignmentBackend;
        this.catalogBackend = catalogBackend;
        this.config = config;
        this.metrics = metrics;
    }

    /**
     * Issue a token.
     *
     * @param request the issuance inputs
     * @return the token and its payload
     */
    public Uni<IssuedToken> issue(IssueRequest request) {
        return Uni.createFrom().item(() -> payloadBuilder.build(request)).flatMap(this::encode);
    }

    /**
     * Authenticate and issue a token.
     *
     * <p>All methods must resolve to the same principal. The {@code token} method
     * validates the presented token (credential key {@code id}) and rescopes it: the
     * new token joins its audit chain and inherits its methods and federation
     * attributes.
     *
     * @param request the authentication request
     * @return the issued token
     */
    public Uni<IssuedToken> authenticate(AuthenticationRequest request) {
        if (request.methods().isEmpty()) {
            return Uni.createFrom().failure(new EmptyMethodsException("At least one authentication method is required"));
        }

        final TokenScope scope;
        try {
            scope = PayloadBuilder.resolveScope(request.scope());
        } catch (RuntimeException e) {
            return Uni.createFrom().failure(e);
        }

        final Uni<TokenPayload> ancestorUni = request.isRescope()
                ? validateAncestor(request)
                : Uni.createFrom().<TokenPayload>nullItem();

        return ancestorUni.flatMap(ancestor -> verifyMethods(request, ancestor)
                .flatMap(principal -> assignmentBackend
                        .rolesFor(principal.subjectId(), scope)
                        .flatMap(roles -> catalogFor(scope).map(catalog -> {
                            final var methods = new LinkedHashSet<>(request.methods());
                            final var builder = IssueRequest.builder(principal)
                                    .scope(request.scope())
                                    .roles(roles)
                                    .catalog(catalog)
                                    .bind(request.bind());
                            if (ancestor != null) {
                                methods.addAll(ancestor.methods());
                                builder.ancestor(ancestor).federation(ancestor.federation());
                            }
                            return builder.methods(methods).build();
                        })))
                .flatMap(this::issue));
    }

    private Uni<TokenPayload> validateAncestor(AuthenticationRequest request) {
        final var token = request.credentialsFor(AuthenticationRequest.TOKEN_METHOD).get("id");
        if (token == null || token.isBlank()) {
            return Uni.createFrom().failure(new AuthenticationException("Token method requires a token id"));
        }
        return validationService.validate(token, request.bind()).map(ancestor -> {
            if (ancestor.isDelegated()) {
                throw new AuthenticationException("Delegated tokens cannot be rescoped");
            }
            if (ancestor.scope().isScoped() && !config.allowRescopeScopedToken()) {
                throw new AuthenticationException("Rescoping a scoped token is not allowed");
            }
            return ancestor;
        });
    }

    private Uni<Principal> verifyMethods(AuthenticationRequest request, TokenPayload ancestor) {
        final var verifications = new ArrayList<Uni<Principal>>();
        if (ancestor != null) {
            verifications.add(Uni.createFrom().item(new Principal(ancestor.subjectId(), ancestor.domainId())));
        }
        for (var method : request.methods()) {
            if (!AuthenticationRequest.TOKEN_METHOD.equals(method)) {
                verifications.add(identityBackend.verifyCredentials(method, request.credentialsFor(method)));
            }
        }
        return Uni.join().all(verifications).andFailFast().map(TokenIssuanceService::singlePrincipal);
    }

    private static Principal singlePrincipal(List<Principal> principals) {
        final var first = principals.get(0);
        for (var principal : principals) {
            if (!principal.equals(first)) {
                throw new AuthenticationException("Authentication methods resolved to different principals");
            }
        }
        return first;
    }

    private Uni<List<EndpointRecord>> catalogFor(TokenScope scope) {
        if (!config.includeCatalog() || !scope.isScoped()) {
            return Uni.createFrom().item(List.<EndpointRecord>of());
        }
        return catalogBackend.endpointsFor(scope);
    }

    private Uni<IssuedToken> encode(TokenPayload payload) {
        final var provider = formats.issuingProvider();
        return provider.encode(payload).map(token -> {
            if (token.length() > LONG_TOKEN_THRESHOLD) {
                LOG.infof(
                        "Issued %s token %s is %d characters long, longer than %d",
                        provider.format().configName(),
                        payload.auditId(),
                        token.length(),
                        LONG_TOKEN_THRESHOLD);
            }
            metrics.recordIssued(provider.format());
            LOG.debugf("Issued %s token %s for subject %s", provider.format().configName(), payload.auditId(), payload.subjectId());
            return new IssuedToken(token, provider.format(), payload);
        });
    }
}
