package io.endsession.core.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.endsession.core.model.EndpointResponse;
import io.endsession.core.testkit.TestRequests;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ResponseRenderer")
class ResponseRendererTest {

    private final ResponseRenderer renderer = new ResponseRenderer();
    private Transaction transaction;

    @BeforeEach
    void setUp() {
        transaction = new Transaction("logout", null, TestRequests.get());
    }

    @Test
    void customResponse_isEmittedWhenHandled() {
        transaction.setProperty(
                Transaction.CUSTOM_RESPONSE_PROPERTY, new ObjectMapper().createObjectNode().put("name", "Bob le Bricoleur"));
        transaction.response().setParameter("ignored", "value");
        transaction.signal(Disposition.HANDLED);

        EndpointResponse response = renderer.render(transaction);

        assertThat(response.status()).isEqualTo(200);
        assertThat(response.payload().get("name").asText()).isEqualTo("Bob le Bricoleur");
        assertThat(response.payload().has("ignored")).isFalse();
    }

    @Test
    void customResponse_isIgnoredUnlessHandled() {
        transaction.setProperty(Transaction.CUSTOM_RESPONSE_PROPERTY, "ignored");
        transaction.response().setParameter("name", "Bob");

        EndpointResponse response = renderer.render(transaction);

        assertThat(response.payload().get("name").asText()).isEqualTo("Bob");
    }

    @Test
    void error_isInlineEvenWithRedirectTarget() {
        transaction.setRedirectTarget("http://www.fabrikam.com/path");
        transaction.response().setError("invalid_request");
        transaction.response().setState("af0ifjsldkj");

        EndpointResponse response = renderer.render(transaction);

        assertThat(response.isInline()).isTrue();
        assertThat(response.status()).isEqualTo(400);
        assertThat(response.payload().get("state").asText()).isEqualTo("af0ifjsldkj");
    }

    @Test
    void redirect_carriesResponseParametersInQuery() {
        transaction.setRedirectTarget("http://www.fabrikam.com/path");
        transaction.response().setState("af0ifjsldkj");
        transaction.response().setParameter("custom_parameter", "custom_value");

        EndpointResponse response = renderer.render(transaction);

        assertThat(response.isRedirect()).isTrue();
        assertThat(response.status()).isEqualTo(302);
        assertThat(response.location())
                .isEqualTo("http://www.fabrikam.com/path?state=af0ifjsldkj&custom_parameter=custom_value");
    }

    @Test
    void statusFor_mapsErrorCodes() {
        assertThat(ResponseRenderer.statusFor("server_error")).isEqualTo(500);
        assertThat(ResponseRenderer.statusFor("temporarily_unavailable")).isEqualTo(503);
        assertThat(ResponseRenderer.statusFor("invalid_request")).isEqualTo(400);
        assertThat(ResponseRenderer.statusFor("custom_error")).isEqualTo(400);
    }

    @Test
    void serverError_hasGenericDescription() {
        EndpointResponse response = renderer.renderServerError();

        assertThat(response.status()).isEqualTo(500);
        assertThat(response.payload().get("error").asText()).isEqualTo("server_error");
    }
}
