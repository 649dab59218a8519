package fr.lapetina.domainlookup;

import fr.lapetina.domainlookup.infrastructure.config.LookupConfig;
import fr.lapetina.domainlookup.integration.StubRdapServer;
import fr.lapetina.domainlookup.integration.StubWhoisServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DomainLookupApplicationTest {

    private StubRdapServer rdap;
    private StubWhoisServer whois;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void setUp() throws Exception {
        rdap = new StubRdapServer();
        whois = new StubWhoisServer(query -> "No match for " + query + "\n");
        rdap.route("/dns.json", 200, """
                {"services": [[["test"], ["%s/rdap"]]]}
                """.formatted(rdap.baseUrl()));
        rdap.route("/rdap/domain/free.test", 404, "");
    }

    @AfterEach
    void tearDown() throws Exception {
        rdap.close();
        whois.close();
    }

    private LookupConfig config(String format) {
        LookupConfig config = new LookupConfig();
        config.getRdap().setBootstrapUrl(rdap.baseUrl() + "/dns.json");
        config.getWhois().setPort(whois.port());
        config.getWhois().setServers(Map.of("fb", "127.0.0.1"));
        config.getLookup().setTimeoutSeconds(2);
        config.getOutput().setFormat(format);
        config.getMetrics().setJvmMetrics(false);
        return config;
    }

    private int run(LookupConfig config, List<String> domains) throws InterruptedException {
        try (LookupServiceFactory factory = LookupServiceFactory.create(config)) {
            return new DomainLookupApplication(factory).run(domains,
                    new PrintStream(out, true, StandardCharsets.UTF_8),
                    new PrintStream(err, true, StandardCharsets.UTF_8));
        }
    }

    @Test
    @DisplayName("should exit 0 and print one line per domain when every lookup succeeds")
    void shouldPrintTextLines() throws Exception {
        int status = run(config("text"), List.of("free.test", "free.fb"));

        assertThat(status).isZero();
        String[] lines = out.toString(StandardCharsets.UTF_8).split("\\R");
        assertThat(lines).hasSize(2);
        assertThat(lines[0]).startsWith("free.test").endsWith("✓ available");
        assertThat(lines[1]).startsWith("free.fb").endsWith("✓ available");
        assertThat(err.toString(StandardCharsets.UTF_8)).isEmpty();
    }

    @Test
    @DisplayName("should exit 1 and report failures on the error stream")
    void shouldReportFailures() throws Exception {
        int status = run(config("text"), List.of("free.test", "nowhere.zz"));

        assertThat(status).isEqualTo(1);
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("free.test");
        assertThat(err.toString(StandardCharsets.UTF_8))
                .startsWith("nowhere.zz")
                .contains("? lookup failed:");
    }

    @Test
    @DisplayName("should print a JSON array in JSON mode")
    void shouldPrintJson() throws Exception {
        int status = run(config("json"), List.of("free.test"));

        assertThat(status).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8))
                .contains("\"domain\" : \"free.test\"")
                .contains("\"status\" : \"available\"")
                .contains("\"source\" : \"rdap\"");
    }

    @Test
    @DisplayName("should print usage with the configuration property")
    void shouldPrintUsage() {
        DomainLookupApplication.printUsage(new PrintStream(err, true, StandardCharsets.UTF_8));

        assertThat(err.toString(StandardCharsets.UTF_8))
                .startsWith("Usage:")
                .contains(DomainLookupApplication.CONFIG_PROPERTY);
    }
}
