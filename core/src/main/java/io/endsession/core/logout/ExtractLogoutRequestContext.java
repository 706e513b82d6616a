package io.endsession.core.logout;

import io.endsession.core.model.InboundRequest;
import io.endsession.core.model.ProtocolRequest;
import io.endsession.core.pipeline.Stage;
import io.endsession.core.pipeline.StageContext;
import io.endsession.core.pipeline.Transaction;

/**
 * Context of the logout Extract stage. Handlers may inspect the raw HTTP request and bind a
 * protocol request themselves; the built-in extraction does not overwrite a request bound by a
 * handler.
 */
public final class ExtractLogoutRequestContext extends StageContext {

    public ExtractLogoutRequestContext(Transaction transaction) {
        super(transaction, Stage.EXTRACT);
    }

    public InboundRequest httpRequest() {
        return transaction().httpRequest();
    }

    /** The bound request, or {@code null} while nothing has been extracted yet. */
    public ProtocolRequest request() {
        return transaction().hasRequest() ? transaction().request() : null;
    }

    public void setRequest(ProtocolRequest request) {
        transaction().setRequest(request);
    }
}
