package io.endsession.core.pipeline;

import io.endsession.core.error.StateNotAvailableException;
import io.endsession.core.model.OAuthConstants;
import java.util.Objects;

/**
 * Base type for the per-stage contexts handed to handlers. Wraps the {@link Transaction} and
 * exposes the three control operations.
 *
 * <p>
 * At most one kind of control operation may be signaled on a context: calling {@link #reject},
 * {@link #handleRequest()} and {@link #skipRequest()} in any combination throws {@link
 * IllegalStateException}. Repeating the same operation is allowed; a repeated {@code reject}
 * replaces the error details.
 */
public abstract class StageContext {

    private final Transaction transaction;
    private final Stage stage;

    private Disposition signaled;
    private String error;
    private String errorDescription;
    private String errorUri;

    protected StageContext(Transaction transaction, Stage stage) {
        this.transaction = Objects.requireNonNull(transaction, "transaction must not be null");
        this.stage = Objects.requireNonNull(stage, "stage must not be null");
    }

    public Transaction transaction() {
        return transaction;
    }

    public Stage stage() {
        return stage;
    }

    /** Rejects the request with {@code invalid_request}. */
    public void reject() {
        reject(null, null, null);
    }

    public void reject(String error) {
        reject(error, null, null);
    }

    public void reject(String error, String description) {
        reject(error, description, null);
    }

    /**
     * Rejects the request. An empty or {@code null} error code is replaced by {@code
     * invalid_request}; the description and URI are kept as given.
     */
    public void reject(String error, String description, String uri) {
        signal(Disposition.REJECTED);
        this.error = error == null || error.isEmpty() ? OAuthConstants.Errors.INVALID_REQUEST : error;
        this.errorDescription = description;
        this.errorUri = uri;
    }

    /** Marks the request as fully handled; remaining default logic is bypassed. */
    public void handleRequest() {
        signal(Disposition.HANDLED);
    }

    /** Skips this stage's default logic only. */
    public void skipRequest() {
        signal(Disposition.SKIPPED);
    }

    public boolean isRejected() {
        return signaled == Disposition.REJECTED;
    }

    public boolean isRequestHandled() {
        return signaled == Disposition.HANDLED;
    }

    public boolean isRequestSkipped() {
        return signaled == Disposition.SKIPPED;
    }

    /** The outcome signaled on this context, or {@link Disposition#CONTINUE} if none. */
    public Disposition signaled() {
        return signaled != null ? signaled : Disposition.CONTINUE;
    }

    public String error() {
        return error;
    }

    public String errorDescription() {
        return errorDescription;
    }

    public String errorUri() {
        return errorUri;
    }

    /**
     * Guards a field produced by another stage.
     *
     * @throws StateNotAvailableException if {@code producer} has not run yet
     */
    protected final void requireTraversed(Stage producer, String field) {
        if (!transaction.hasTraversed(producer)) {
            throw new StateNotAvailableException(
                    "'" + field + "' is not available before the " + producer + " stage has run", stage);
        }
    }

    private void signal(Disposition disposition) {
        if (signaled != null && signaled != disposition) {
            throw new IllegalStateException(
                    "Cannot signal " + disposition + " on the " + stage + " stage: " + signaled + " was already signaled");
        }
        signaled = disposition;
        transaction.signal(disposition);
    }
}
