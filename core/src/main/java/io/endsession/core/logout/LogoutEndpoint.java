package io.endsession.core.logout;

import io.endsession.core.model.InboundRequest;
import io.endsession.core.model.OAuthConstants;
import io.endsession.core.model.Parameter;
import io.endsession.core.model.ProtocolRequest;
import io.endsession.core.model.ProtocolResponse;
import io.endsession.core.pipeline.EndpointBinding;
import io.endsession.core.pipeline.FormUrlEncoding;
import io.endsession.core.pipeline.Stage;
import io.endsession.core.pipeline.StageContext;
import io.endsession.core.pipeline.Transaction;
import io.endsession.core.spi.Application;
import io.endsession.core.spi.ApplicationResolver;
import io.endsession.core.spi.ConfirmationContributor;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The OpenID Connect end-session (logout) endpoint.
 *
 * <p>
 * Built-in logic per stage:
 * <ul>
 * <li>Extract: accepts GET (query string) and POST (form body, or the query string when the
 * body is empty). Any other method is rejected.</li>
 * <li>Validate: a {@code post_logout_redirect_uri} must be absolute and fragment-free and, outside
 * degraded mode, registered by an application allowed to use the endpoint.</li>
 * <li>Handle: none; the host application handles the request through handlers.</li>
 * <li>Apply-Response: redirects to the validated URI, carrying {@code state}, or produces an
 * inline confirmation filled by the {@link ConfirmationContributor}.</li>
 * </ul>
 *
 * <p>
 * Thread-safe: the binding holds only immutable configuration and thread-safe collaborators.
 */
public final class LogoutEndpoint implements EndpointBinding {

    private static final Logger LOG = LoggerFactory.getLogger(LogoutEndpoint.class);

    public static final String NAME = "logout";

    static final String REDIRECT_URI_PROPERTY = ".post_logout_redirect_uri";
    static final String APPLICATION_ID_PROPERTY = ".application_id";

    static final String INVALID_METHOD = "The specified HTTP method is not valid.";
    static final String INVALID_CONTENT_TYPE = "The specified 'Content-Type' header is not valid.";
    static final String UNDECODABLE_PARAMETERS = "The request parameters could not be decoded.";
    static final String RELATIVE_REDIRECT_URI =
            "The 'post_logout_redirect_uri' parameter must be a valid absolute URL.";
    static final String REDIRECT_URI_FRAGMENT =
            "The 'post_logout_redirect_uri' parameter must not include a fragment.";
    static final String UNKNOWN_REDIRECT_URI = "The specified 'post_logout_redirect_uri' parameter is not valid.";

    private final LogoutEndpointOptions options;
    private final ApplicationResolver resolver;
    private final ConfirmationContributor confirmation;

    /**
     * @param options      endpoint options
     * @param resolver     application store, may be {@code null} only in degraded mode
     * @param confirmation fills inline confirmations, {@code null} for none
     * @throws IllegalArgumentException if no resolver is given outside degraded mode
     */
    public LogoutEndpoint(
            LogoutEndpointOptions options, ApplicationResolver resolver, ConfirmationContributor confirmation) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        if (resolver == null && !options.degradedMode()) {
            throw new IllegalArgumentException("An application resolver is required unless degraded mode is enabled");
        }
        this.resolver = resolver;
        this.confirmation = confirmation != null ? confirmation : ConfirmationContributor.NONE;
    }

    public LogoutEndpointOptions options() {
        return options;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StageContext createContext(Stage stage, Transaction transaction) {
        return switch (stage) {
            case EXTRACT -> new ExtractLogoutRequestContext(transaction);
            case VALIDATE -> {
                // Extraction was skipped and no handler bound a request.
                if (!transaction.hasRequest()) {
                    transaction.setRequest(new ProtocolRequest());
                }
                yield new ValidateLogoutRequestContext(transaction);
            }
            case HANDLE -> new HandleLogoutRequestContext(transaction);
            case APPLY_RESPONSE -> new ApplyLogoutResponseContext(transaction);
        };
    }

    @Override
    public void applyDefaults(StageContext context) {
        if (context instanceof ExtractLogoutRequestContext extract) {
            extract(extract);
        } else if (context instanceof ValidateLogoutRequestContext validate) {
            validate(validate);
        } else if (context instanceof ApplyLogoutResponseContext apply) {
            apply(apply);
        }
    }

    private void extract(ExtractLogoutRequestContext context) {
        InboundRequest http = context.httpRequest();
        String method = http.method().toUpperCase(Locale.ROOT);
        if (!method.equals("GET") && !method.equals("POST")) {
            context.reject(OAuthConstants.Errors.INVALID_REQUEST, INVALID_METHOD);
            return;
        }
        if (context.request() != null) {
            LOG.debug("Logout request already bound by a handler, skipping extraction");
            return;
        }

        String encoded;
        if (method.equals("POST") && http.hasBody()) {
            if (!http.isFormEncoded()) {
                context.reject(OAuthConstants.Errors.INVALID_REQUEST, INVALID_CONTENT_TYPE);
                return;
            }
            encoded = http.body();
        } else {
            encoded = http.queryString();
        }

        Map<String, List<String>> values;
        try {
            values = FormUrlEncoding.parse(encoded);
        } catch (IllegalArgumentException e) {
            LOG.debug("Undecodable logout request parameters: {}", e.getMessage());
            context.reject(OAuthConstants.Errors.INVALID_REQUEST, UNDECODABLE_PARAMETERS);
            return;
        }
        context.setRequest(ProtocolRequest.fromMultiValueMap(values));
        LOG.debug("Logout request extracted: parameters={}", values.keySet());
    }

    private void validate(ValidateLogoutRequestContext context) {
        String uri = context.request().postLogoutRedirectUri();
        if (uri == null || uri.isEmpty()) {
            return;
        }

        URI parsed;
        try {
            parsed = new URI(uri);
        } catch (URISyntaxException e) {
            context.reject(OAuthConstants.Errors.INVALID_REQUEST, RELATIVE_REDIRECT_URI);
            return;
        }
        if (!parsed.isAbsolute()) {
            context.reject(OAuthConstants.Errors.INVALID_REQUEST, RELATIVE_REDIRECT_URI);
            return;
        }
        if (parsed.getRawFragment() != null) {
            context.reject(OAuthConstants.Errors.INVALID_REQUEST, REDIRECT_URI_FRAGMENT);
            return;
        }

        if (!options.degradedMode()) {
            Optional<Application> application = findApplication(uri);
            if (application.isEmpty()) {
                LOG.info("No application allowed to use the logout endpoint registered '{}'", uri);
                context.reject(OAuthConstants.Errors.INVALID_REQUEST, UNKNOWN_REDIRECT_URI);
                return;
            }
            context.setApplicationId(application.get().id());
        }
        context.setPostLogoutRedirectUri(uri);
    }

    private Optional<Application> findApplication(String uri) {
        try (Stream<Application> candidates = resolver.findByPostLogoutRedirectUri(uri)) {
            if (options.ignoreEndpointPermissions()) {
                return candidates.findFirst();
            }
            return candidates
                    .filter(app -> resolver.hasPermission(app, OAuthConstants.Permissions.ENDPOINT_LOGOUT))
                    .findFirst();
        }
    }

    private void apply(ApplyLogoutResponseContext context) {
        Transaction transaction = context.transaction();
        ProtocolResponse response = context.response();
        String uri = context.postLogoutRedirectUri();
        if (uri != null) {
            transaction.setRedirectTarget(uri);
            String state = context.request().state();
            if (response.state() == null && state != null) {
                response.setState(state);
            }
            return;
        }
        confirmation.contribute(context.request(), response);
    }

    static String validatedRedirectUri(Transaction transaction) {
        Parameter value = transaction.getProperty(REDIRECT_URI_PROPERTY);
        return value != null ? value.asString() : null;
    }

    static String matchedApplicationId(Transaction transaction) {
        Parameter value = transaction.getProperty(APPLICATION_ID_PROPERTY);
        return value != null ? value.asString() : null;
    }
}
