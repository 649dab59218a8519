package fr.lapetina.domainlookup.infrastructure.config;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Root configuration object for domain lookups.
 * Designed to be populated from YAML.
 */
public class LookupConfig {

    private LookupSettings lookup = new LookupSettings();
    private RdapConfig rdap = new RdapConfig();
    private WhoisConfig whois = new WhoisConfig();
    private OutputConfig output = new OutputConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public LookupSettings getLookup() { return lookup; }
    public void setLookup(LookupSettings lookup) { this.lookup = lookup; }

    public RdapConfig getRdap() { return rdap; }
    public void setRdap(RdapConfig rdap) { this.rdap = rdap; }

    public WhoisConfig getWhois() { return whois; }
    public void setWhois(WhoisConfig whois) { this.whois = whois; }

    public OutputConfig getOutput() { return output; }
    public void setOutput(OutputConfig output) { this.output = output; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Batch settings.
     */
    public static class LookupSettings {
        static final int DEFAULT_TIMEOUT_SECONDS = 10;

        private int concurrency = 5;
        private int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;

        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }

        /**
         * Concurrency ceiling, at least 1.
         */
        public int effectiveConcurrency() {
            return Math.max(1, concurrency);
        }

        /**
         * Per-operation timeout; non-positive values fall back to the default.
         */
        public Duration effectiveTimeout() {
            return Duration.ofSeconds(timeoutSeconds > 0 ? timeoutSeconds : DEFAULT_TIMEOUT_SECONDS);
        }
    }

    /**
     * RDAP bootstrap configuration.
     */
    public static class RdapConfig {
        private String bootstrapUrl = "https://data.iana.org/rdap/dns.json";
        private long bootstrapTimeoutMs = 10000;

        public String getBootstrapUrl() { return bootstrapUrl; }
        public void setBootstrapUrl(String bootstrapUrl) { this.bootstrapUrl = bootstrapUrl; }

        public long getBootstrapTimeoutMs() { return bootstrapTimeoutMs; }
        public void setBootstrapTimeoutMs(long bootstrapTimeoutMs) { this.bootstrapTimeoutMs = bootstrapTimeoutMs; }
    }

    /**
     * WHOIS configuration.
     */
    public static class WhoisConfig {
        private int port = 43;
        private Map<String, String> servers = new HashMap<>();

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public Map<String, String> getServers() { return servers; }
        public void setServers(Map<String, String> servers) { this.servers = servers; }
    }

    /**
     * Result rendering configuration.
     */
    public static class OutputConfig {
        private String format = "text";
        private boolean verbose = false;

        public String getFormat() { return format; }
        public void setFormat(String format) { this.format = format; }

        public boolean isVerbose() { return verbose; }
        public void setVerbose(boolean verbose) { this.verbose = verbose; }

        public boolean isJson() {
            return "json".equalsIgnoreCase(format);
        }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean jvmMetrics = true;
        private String prefix = "domain_lookup";

        public boolean isJvmMetrics() { return jvmMetrics; }
        public void setJvmMetrics(boolean jvmMetrics) { this.jvmMetrics = jvmMetrics; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
