package fr.lapetina.domainlookup.infrastructure.rdap;

import fr.lapetina.domainlookup.domain.model.ErrorType;
import fr.lapetina.domainlookup.domain.model.LookupResult;
import fr.lapetina.domainlookup.domain.model.RegistrationStatus;
import fr.lapetina.domainlookup.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.domainlookup.integration.StubRdapServer;
import fr.lapetina.domainlookup.lookup.exception.LookupException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RdapClientTest {

    static final String REGISTERED_BODY = """
            {
              "objectClassName": "domain",
              "ldhName": "EXAMPLE.TEST",
              "events": [
                {"eventAction": "registration", "eventDate": "1995-08-14T04:00:00Z"},
                {"eventAction": "expiration", "eventDate": "2026-08-13T00:00:00Z"}
              ],
              "entities": [
                {
                  "roles": ["technical"],
                  "vcardArray": ["vcard", [["fn", {}, "text", "Tech Contact"]]]
                },
                {
                  "roles": ["sponsor", "registrar"],
                  "vcardArray": ["vcard", [["version", {}, "text", "4.0"], ["fn", {}, "text", "Example Inc."]]]
                }
              ]
            }
            """;

    private StubRdapServer server;
    private MetricsRegistry metrics;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() throws Exception {
        server = new StubRdapServer();
        metrics = new MetricsRegistry("test", false);
        httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();
    }

    @AfterEach
    void tearDown() {
        server.close();
        metrics.close();
    }

    private RdapClient clientFor(String... endpoints) {
        RdapBootstrapCache cache = RdapBootstrapCache.preloaded(Map.of("test", List.of(endpoints)), metrics);
        return new RdapClient(httpClient, cache, Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("should report available on 404 without optional fields")
    void shouldReportAvailableOn404() throws LookupException {
        server.route("/primary/domain/free.test", 404, "");

        LookupResult result = clientFor(server.baseUrl() + "/primary/").query("free.test");

        assertThat(result.status()).isEqualTo(RegistrationStatus.AVAILABLE);
        assertThat(result.registrar()).isNull();
        assertThat(result.expiry()).isNull();
    }

    @Test
    @DisplayName("should parse registrar and exact expiry on 200")
    void shouldParseRegisteredDomain() throws LookupException {
        server.route("/primary/domain/example.test", 200, REGISTERED_BODY);

        LookupResult result = clientFor(server.baseUrl() + "/primary").query("example.test");

        assertThat(result.status()).isEqualTo(RegistrationStatus.REGISTERED);
        assertThat(result.registrar()).isEqualTo("Example Inc.");
        assertThat(result.expiry()).isEqualTo(Instant.parse("2026-08-13T00:00:00Z"));
    }

    @Test
    @DisplayName("should leave expiry unset when the date is unparsable")
    void shouldIgnoreUnparsableExpiry() throws LookupException {
        server.route("/primary/domain/example.test", 200, """
                {"events": [{"eventAction": "expiration", "eventDate": "next tuesday"}]}
                """);

        LookupResult result = clientFor(server.baseUrl() + "/primary/").query("example.test");

        assertThat(result.status()).isEqualTo(RegistrationStatus.REGISTERED);
        assertThat(result.expiry()).isNull();
        assertThat(result.registrar()).isNull();
    }

    @Test
    @DisplayName("should move to next endpoint on non-decisive status")
    void shouldMoveToNextEndpointOnServerError() throws LookupException {
        server.route("/primary/domain/example.test", 503, "busy");
        server.route("/secondary/domain/example.test", 200, REGISTERED_BODY);

        LookupResult result = clientFor(server.baseUrl() + "/primary/", server.baseUrl() + "/secondary/")
                .query("example.test");

        assertThat(result.status()).isEqualTo(RegistrationStatus.REGISTERED);
        assertThat(server.hits("/primary/domain/example.test")).isEqualTo(1);
        assertThat(server.hits("/secondary/domain/example.test")).isEqualTo(1);
    }

    @Test
    @DisplayName("should move to next endpoint on unparsable body")
    void shouldMoveToNextEndpointOnBadBody() throws LookupException {
        server.route("/primary/domain/example.test", 200, "<html>oops</html>");
        server.route("/secondary/domain/example.test", 404, "");

        LookupResult result = clientFor(server.baseUrl() + "/primary/", server.baseUrl() + "/secondary/")
                .query("example.test");

        assertThat(result.status()).isEqualTo(RegistrationStatus.AVAILABLE);
    }

    @Test
    @DisplayName("should stop at the first decisive endpoint")
    void shouldStopAtFirstDecisiveEndpoint() throws LookupException {
        server.route("/primary/domain/example.test", 404, "");
        server.route("/secondary/domain/example.test", 200, REGISTERED_BODY);

        LookupResult result = clientFor(server.baseUrl() + "/primary/", server.baseUrl() + "/secondary/")
                .query("example.test");

        assertThat(result.status()).isEqualTo(RegistrationStatus.AVAILABLE);
        assertThat(server.hits("/secondary/domain/example.test")).isZero();
    }

    @Test
    @DisplayName("should fail with ALL_ENDPOINTS_FAILED when every endpoint fails")
    void shouldFailWhenAllEndpointsFail() {
        server.route("/primary/domain/example.test", 500, "");

        RdapClient client = clientFor(server.baseUrl() + "/primary/", "http://127.0.0.1:1/unreachable/");

        assertThatThrownBy(() -> client.query("example.test"))
                .isInstanceOf(LookupException.class)
                .satisfies(e -> assertThat(((LookupException) e).getErrorType())
                        .isEqualTo(ErrorType.ALL_ENDPOINTS_FAILED));
    }

    @Test
    @DisplayName("should propagate endpoint resolution failure")
    void shouldPropagateResolutionFailure() {
        RdapClient client = clientFor(server.baseUrl() + "/primary/");

        assertThatThrownBy(() -> client.query("example.zz"))
                .isInstanceOf(LookupException.class)
                .satisfies(e -> assertThat(((LookupException) e).getErrorType()).isEqualTo(ErrorType.NO_SERVER));
    }

    @Test
    @DisplayName("should join endpoint and domain path without doubled slashes")
    void shouldBuildUri() {
        assertThat(RdapClient.buildUri("https://rdap.example/v1//", "example.com"))
                .isEqualTo(URI.create("https://rdap.example/v1/domain/example.com"));
        assertThat(RdapClient.buildUri("https://rdap.example", "example.com"))
                .isEqualTo(URI.create("https://rdap.example/domain/example.com"));
    }
}
