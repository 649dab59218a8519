package fr.lapetina.domainlookup;

import fr.lapetina.domainlookup.infrastructure.config.ConfigLoader;
import fr.lapetina.domainlookup.infrastructure.config.LookupConfig;
import fr.lapetina.domainlookup.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.domainlookup.infrastructure.rdap.RdapBootstrapCache;
import fr.lapetina.domainlookup.infrastructure.whois.WhoisServerTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;

/**
 * Factory for creating a fully-wired {@link DomainLookupService} from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (LookupServiceFactory factory = LookupServiceFactory.create("config.yaml")) {
 *     List<LookupResult> results = factory.getService()
 *             .queryBatch(List.of("example.com"), 5, Duration.ofSeconds(10));
 * }
 * }</pre>
 */
public class LookupServiceFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LookupServiceFactory.class);

    private final LookupConfig config;
    private final MetricsRegistry metricsRegistry;
    private final DomainLookupService service;

    protected LookupServiceFactory(LookupConfig config) {
        this.config = config;

        this.metricsRegistry = new MetricsRegistry(
                config.getMetrics().getPrefix(),
                config.getMetrics().isJvmMetrics()
        );

        RdapBootstrapCache bootstrapCache = new RdapBootstrapCache(
                URI.create(config.getRdap().getBootstrapUrl()),
                Duration.ofMillis(config.getRdap().getBootstrapTimeoutMs()),
                metricsRegistry
        );

        WhoisServerTable whoisServers = WhoisServerTable.withOverrides(config.getWhois().getServers());

        this.service = new DomainLookupService(
                bootstrapCache,
                whoisServers,
                config.getWhois().getPort(),
                metricsRegistry
        );

        log.debug("LookupServiceFactory initialized: bootstrapUrl={}, whoisServers={}, whoisPort={}",
                config.getRdap().getBootstrapUrl(), whoisServers.size(), config.getWhois().getPort());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static LookupServiceFactory create(String configPath) {
        return new LookupServiceFactory(new ConfigLoader(configPath).load());
    }

    /**
     * Creates a factory from an already loaded configuration.
     */
    public static LookupServiceFactory create(LookupConfig config) {
        return new LookupServiceFactory(config);
    }

    public DomainLookupService getService() {
        return service;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public LookupConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        metricsRegistry.close();
    }
}
