package io.endsession.standalone.http;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.endsession.core.logout.ApplyLogoutResponseContext;
import io.endsession.core.pipeline.HandlerDescriptor;
import io.endsession.core.pipeline.Stage;
import io.endsession.core.spi.ConfirmationContributor;
import io.endsession.standalone.config.ApplicationConfig;
import io.endsession.standalone.config.ServerConfig;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** End-to-end tests over HTTP against a server on an ephemeral port. */
@DisplayName("End-session server over HTTP")
class EndSessionServerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String FORM = "application/x-www-form-urlencoded";

    private static ServerApp server;
    private static HttpClient client;

    @BeforeAll
    static void startServer() {
        ServerConfig config = ServerConfig.builder()
                .host("127.0.0.1")
                .port(0)
                .logoutPaths(List.of("/connect/logout", "/signout"))
                .applications(List.of(
                        new ApplicationConfig("fabrikam", List.of("ept:logout"), List.of("http://www.fabrikam.com/path")),
                        new ApplicationConfig("contoso", List.of(), List.of("http://www.contoso.com/bye"))))
                .build();
        ConfirmationContributor confirmation = (request, response) -> response.setParameter("name", "Bob le Magnifique");
        server = ServerApp.start(config, confirmation);
        client = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NEVER).build();
    }

    @AfterAll
    static void stopServer() {
        if (server != null) {
            server.stop();
        }
    }

    private static URI uri(String pathAndQuery) {
        return URI.create("http://127.0.0.1:" + server.port() + pathAndQuery);
    }

    private static HttpResponse<String> get(String pathAndQuery) throws Exception {
        return client.send(HttpRequest.newBuilder(uri(pathAndQuery)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private static HttpResponse<String> postForm(String path, String body) throws Exception {
        return client.send(
                HttpRequest.newBuilder(uri(path))
                        .header("Content-Type", FORM)
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(HttpResponse<String> response) throws Exception {
        return MAPPER.readTree(response.body());
    }

    @Nested
    @DisplayName("Logout endpoint")
    class Logout {

        @Test
        void plainGet_returnsHostConfirmation() throws Exception {
            HttpResponse<String> response = get("/connect/logout");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(v -> assertThat(v)
                    .startsWith("application/json"));
            assertThat(json(response).get("name").asText()).isEqualTo("Bob le Magnifique");
        }

        @Test
        void registeredRedirectUri_redirectsWithState() throws Exception {
            HttpResponse<String> response = postForm(
                    "/signout", "post_logout_redirect_uri=http%3A%2F%2Fwww.fabrikam.com%2Fpath&state=af0ifjsldkj");

            assertThat(response.statusCode()).isEqualTo(302);
            assertThat(response.headers().firstValue("Location"))
                    .contains("http://www.fabrikam.com/path?state=af0ifjsldkj");
        }

        @Test
        void applicationWithoutPermission_isRejected() throws Exception {
            HttpResponse<String> response =
                    get("/connect/logout?post_logout_redirect_uri=http%3A%2F%2Fwww.contoso.com%2Fbye");

            assertThat(response.statusCode()).isEqualTo(400);
            JsonNode body = json(response);
            assertThat(body.get("error").asText()).isEqualTo("invalid_request");
            assertThat(body.get("error_description").asText())
                    .isEqualTo("The specified 'post_logout_redirect_uri' parameter is not valid.");
        }

        @ParameterizedTest
        @ValueSource(strings = {"PUT", "DELETE", "PATCH", "TRACE", "PURGE"})
        void unexpectedMethod_returnsAnError(String method) throws Exception {
            HttpResponse<String> response = client.send(
                    HttpRequest.newBuilder(uri("/connect/logout"))
                            .method(method, HttpRequest.BodyPublishers.noBody())
                            .build(),
                    HttpResponse.BodyHandlers.ofString());

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(json(response).get("error_description").asText())
                    .isEqualTo("The specified HTTP method is not valid.");
        }

        @Test
        void unexpectedMethodOnUnknownPath_isNotServed() throws Exception {
            HttpResponse<String> response = client.send(
                    HttpRequest.newBuilder(uri("/connect/token"))
                            .method("PURGE", HttpRequest.BodyPublishers.noBody())
                            .build(),
                    HttpResponse.BodyHandlers.ofString());

            assertThat(response.statusCode()).isEqualTo(404);
        }

        @Test
        void requestId_isEchoed() throws Exception {
            HttpResponse<String> response = client.send(
                    HttpRequest.newBuilder(uri("/connect/logout"))
                            .header("X-Request-ID", "req-42")
                            .GET()
                            .build(),
                    HttpResponse.BodyHandlers.ofString());

            assertThat(response.headers().firstValue("x-request-id")).contains("req-42");
        }

        @Test
        void requestId_isGeneratedWhenAbsent() throws Exception {
            HttpResponse<String> response = get("/connect/logout");

            assertThat(response.headers().firstValue("x-request-id")).isPresent();
        }

        @Test
        void unknownPath_isNotServed() throws Exception {
            assertThat(get("/connect/token").statusCode()).isEqualTo(404);
        }
    }

    @Nested
    @DisplayName("Handlers registered after startup")
    class RuntimeHandlers {

        private static final String NAME = "runtime-apply";

        @AfterEach
        void removeHandler() {
            server.registry().remove(NAME);
        }

        @Test
        void applyHandler_addsParameter() throws Exception {
            server.registry()
                    .register(HandlerDescriptor.builder(ApplyLogoutResponseContext.class)
                            .name(NAME)
                            .stage(Stage.APPLY_RESPONSE)
                            .handler(context -> context.response().setParameter("custom_parameter", "custom_value"))
                            .build());

            HttpResponse<String> response = get("/connect/logout");

            assertThat(json(response).get("custom_parameter").asText()).isEqualTo("custom_value");
        }
    }

    @Test
    void healthEndpoint_reportsUp() throws Exception {
        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = json(response);
        assertThat(body.get("status").asText()).isEqualTo("UP");
        assertThat(body.get("logoutPaths").get(1).asText()).isEqualTo("/signout");
    }
}
