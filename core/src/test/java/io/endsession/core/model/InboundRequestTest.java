package io.endsession.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("InboundRequest and HttpHeaders")
class InboundRequestTest {

    private final Locale originalLocale = Locale.getDefault();

    @AfterEach
    void restoreLocale() {
        Locale.setDefault(originalLocale);
    }

    private static InboundRequest post(String contentType) {
        return new InboundRequest(
                "POST", "/connect/logout", null, HttpHeaders.of(Map.of("Content-Type", contentType)), "state=x");
    }

    @Test
    void headerLookup_ignoresCase() {
        HttpHeaders headers = HttpHeaders.ofMulti(Map.of("X-Request-ID", List.of("req-1", "req-2")));

        assertThat(headers.first("x-request-id")).isEqualTo("req-1");
        assertThat(headers.first("X-REQUEST-ID")).isEqualTo("req-1");
        assertThat(headers.first("content-type")).isNull();
    }

    @Test
    void namesDifferingInCase_areMerged() {
        HttpHeaders headers = HttpHeaders.ofMulti(Map.of("Accept", List.of("a"), "ACCEPT", List.of("b")));

        assertThat(headers.size()).isEqualTo(1);
        assertThat(headers.first("accept")).isIn("a", "b");
    }

    @Test
    void toString_omitsValues() {
        HttpHeaders headers = HttpHeaders.of(Map.of("Authorization", "Bearer secret"));

        assertThat(headers.toString()).contains("authorization").doesNotContain("secret");
    }

    @Test
    void contentTypeAndRequestId_comeFromHeaders() {
        InboundRequest request = new InboundRequest(
                "GET",
                "/connect/logout",
                null,
                HttpHeaders.of(Map.of("Content-Type", "text/plain", "X-Request-Id", "abc")),
                null);

        assertThat(request.contentType()).isEqualTo("text/plain");
        assertThat(request.requestId()).isEqualTo("abc");
    }

    @Test
    void blankRequestId_isTreatedAsAbsent() {
        InboundRequest request =
                new InboundRequest("GET", "/connect/logout", null, HttpHeaders.of(Map.of("X-Request-ID", " ")), null);

        assertThat(request.requestId()).isNull();
    }

    @Test
    void missingHeaders_defaultToEmpty() {
        InboundRequest request = new InboundRequest("GET", "/connect/logout", null, null, null);

        assertThat(request.contentType()).isNull();
        assertThat(request.isFormEncoded()).isFalse();
        assertThat(request.hasBody()).isFalse();
    }

    @ParameterizedTest
    @ValueSource(
            strings = {
                "application/x-www-form-urlencoded",
                "application/x-www-form-urlencoded; charset=UTF-8",
                "APPLICATION/X-WWW-FORM-URLENCODED"
            })
    void formContentType_isRecognized(String contentType) {
        assertThat(post(contentType).isFormEncoded()).isTrue();
    }

    @Test
    void formContentType_isRecognizedUnderTurkishLocale() {
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));

        assertThat(post("APPLICATION/X-WWW-FORM-URLENCODED").isFormEncoded()).isTrue();
    }

    @Test
    void otherContentType_isNotForm() {
        assertThat(post("application/json").isFormEncoded()).isFalse();
    }
}
