package io.endsession.core.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.endsession.core.error.StateNotAvailableException;
import io.endsession.core.testkit.TestRequests;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StageContext control operations")
class StageContextTest {

    private Transaction transaction;
    private StageContext context;

    @BeforeEach
    void setUp() {
        transaction = new Transaction("logout", null, TestRequests.get());
        context = new StageContext(transaction, Stage.HANDLE) {};
    }

    @Test
    void nothingSignaled_isContinue() {
        assertThat(context.signaled()).isEqualTo(Disposition.CONTINUE);
        assertThat(context.isRejected()).isFalse();
        assertThat(context.isRequestHandled()).isFalse();
        assertThat(context.isRequestSkipped()).isFalse();
    }

    @Test
    void reject_writesThroughToTransaction() {
        context.reject("", "description");

        assertThat(context.isRejected()).isTrue();
        assertThat(context.error()).isEqualTo("invalid_request");
        assertThat(context.errorDescription()).isEqualTo("description");
        assertThat(context.errorUri()).isNull();
        assertThat(transaction.isRejected()).isTrue();
    }

    @Test
    void handleThenReject_isIllegal() {
        context.handleRequest();

        assertThatThrownBy(context::reject).isInstanceOf(IllegalStateException.class);
        assertThat(transaction.isHandled()).isTrue();
    }

    @Test
    void skipThenHandle_isIllegal() {
        context.skipRequest();

        assertThatThrownBy(context::handleRequest).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void repeatingSameOperation_isAllowed() {
        context.skipRequest();
        context.skipRequest();

        assertThat(context.isRequestSkipped()).isTrue();
    }

    @Test
    void transactionRequest_beforeBinding_isNotAvailable() {
        assertThatThrownBy(transaction::request).isInstanceOf(StateNotAvailableException.class);
        assertThat(transaction.hasRequest()).isFalse();
    }
}
