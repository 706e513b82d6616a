package io.endsession.core.logout;

import io.endsession.core.model.ProtocolRequest;
import io.endsession.core.pipeline.Stage;
import io.endsession.core.pipeline.StageContext;
import io.endsession.core.pipeline.Transaction;

/**
 * Context of the logout Validate stage.
 *
 * <p>
 * The validated redirect URI and the matched application id are produced by this stage's
 * built-in validation. A handler that skips the built-in validation may supply them itself.
 */
public final class ValidateLogoutRequestContext extends StageContext {

    public ValidateLogoutRequestContext(Transaction transaction) {
        super(transaction, Stage.VALIDATE);
    }

    public ProtocolRequest request() {
        return transaction().request();
    }

    /** The validated post-logout redirect URI, or {@code null} if none was validated. */
    public String postLogoutRedirectUri() {
        return LogoutEndpoint.validatedRedirectUri(transaction());
    }

    public void setPostLogoutRedirectUri(String uri) {
        transaction().setProperty(LogoutEndpoint.REDIRECT_URI_PROPERTY, uri);
    }

    /** Id of the application that matched the redirect URI, or {@code null}. */
    public String applicationId() {
        return LogoutEndpoint.matchedApplicationId(transaction());
    }

    public void setApplicationId(String applicationId) {
        transaction().setProperty(LogoutEndpoint.APPLICATION_ID_PROPERTY, applicationId);
    }
}
