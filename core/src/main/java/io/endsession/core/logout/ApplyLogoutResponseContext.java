package io.endsession.core.logout;

import io.endsession.core.model.ProtocolRequest;
import io.endsession.core.model.ProtocolResponse;
import io.endsession.core.pipeline.Stage;
import io.endsession.core.pipeline.StageContext;
import io.endsession.core.pipeline.Transaction;

/**
 * Context of the logout Apply-Response stage. Handlers run for every request, including
 * handled and rejected ones, and may still add response parameters.
 */
public final class ApplyLogoutResponseContext extends StageContext {

    public ApplyLogoutResponseContext(Transaction transaction) {
        super(transaction, Stage.APPLY_RESPONSE);
    }

    public ProtocolResponse response() {
        return transaction().response();
    }

    /**
     * The bound request.
     *
     * @throws io.endsession.core.error.StateNotAvailableException if the request was rejected
     *                                                             before one was bound
     */
    public ProtocolRequest request() {
        return transaction().request();
    }

    /**
     * The validated post-logout redirect URI, or {@code null} if none was validated.
     *
     * @throws io.endsession.core.error.StateNotAvailableException if validation has not run
     */
    public String postLogoutRedirectUri() {
        requireTraversed(Stage.VALIDATE, "post_logout_redirect_uri");
        return LogoutEndpoint.validatedRedirectUri(transaction());
    }
}
