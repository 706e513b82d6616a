package io.endsession.core.logout;

import io.endsession.core.model.ProtocolRequest;
import io.endsession.core.model.ProtocolResponse;
import io.endsession.core.pipeline.Stage;
import io.endsession.core.pipeline.StageContext;
import io.endsession.core.pipeline.Transaction;

/** Context of the logout Handle stage. The endpoint has no built-in handling. */
public final class HandleLogoutRequestContext extends StageContext {

    public HandleLogoutRequestContext(Transaction transaction) {
        super(transaction, Stage.HANDLE);
    }

    public ProtocolRequest request() {
        return transaction().request();
    }

    public ProtocolResponse response() {
        return transaction().response();
    }

    /**
     * The validated post-logout redirect URI.
     *
     * @throws io.endsession.core.error.StateNotAvailableException if validation has not run
     */
    public String postLogoutRedirectUri() {
        requireTraversed(Stage.VALIDATE, "post_logout_redirect_uri");
        return LogoutEndpoint.validatedRedirectUri(transaction());
    }
}
