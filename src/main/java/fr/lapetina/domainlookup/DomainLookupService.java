package fr.lapetina.domainlookup;

import fr.lapetina.domainlookup.domain.model.LookupResult;
import fr.lapetina.domainlookup.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.domainlookup.infrastructure.rdap.RdapBootstrapCache;
import fr.lapetina.domainlookup.infrastructure.rdap.RdapClient;
import fr.lapetina.domainlookup.infrastructure.whois.WhoisClient;
import fr.lapetina.domainlookup.infrastructure.whois.WhoisServerTable;
import fr.lapetina.domainlookup.lookup.BatchDispatcher;
import fr.lapetina.domainlookup.lookup.DomainChecker;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;

/**
 * Caller-facing lookup API.
 *
 * Owns the process-wide RDAP bootstrap cache; every batch shares it, while the
 * protocol clients are built per batch with that batch's timeout.
 */
public class DomainLookupService {

    private final RdapBootstrapCache bootstrapCache;
    private final WhoisServerTable whoisServers;
    private final int whoisPort;
    private final MetricsRegistry metricsRegistry;
    private final BatchDispatcher dispatcher;

    public DomainLookupService(
            RdapBootstrapCache bootstrapCache,
            WhoisServerTable whoisServers,
            int whoisPort,
            MetricsRegistry metricsRegistry
    ) {
        this.bootstrapCache = bootstrapCache;
        this.whoisServers = whoisServers;
        this.whoisPort = whoisPort;
        this.metricsRegistry = metricsRegistry;
        this.dispatcher = new BatchDispatcher(metricsRegistry);
    }

    /**
     * Looks up every domain, at most {@code concurrency} at a time.
     *
     * @param domains     domain names as typed by the caller
     * @param concurrency maximum number of lookups in flight
     * @param timeout     bound applied to each individual network operation
     * @return one result per input domain, in input order
     * @throws InterruptedException if interrupted while waiting for the batch
     */
    public List<LookupResult> queryBatch(List<String> domains, int concurrency, Duration timeout)
            throws InterruptedException {
        return dispatcher.dispatch(domains, concurrency, newChecker(timeout));
    }

    /**
     * Builds a checker whose clients use the given per-operation timeout.
     */
    public DomainChecker newChecker(Duration timeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        return new DomainChecker(
                new RdapClient(httpClient, bootstrapCache, timeout),
                new WhoisClient(whoisServers, whoisPort, timeout),
                metricsRegistry
        );
    }

    /**
     * Returns true if any result is UNKNOWN.
     */
    public static boolean hasFailures(List<LookupResult> results) {
        return results.stream().anyMatch(LookupResult::isUnknown);
    }

    public RdapBootstrapCache getBootstrapCache() {
        return bootstrapCache;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }
}
