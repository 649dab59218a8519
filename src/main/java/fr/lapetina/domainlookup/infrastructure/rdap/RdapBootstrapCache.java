package fr.lapetina.domainlookup.infrastructure.rdap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.domainlookup.domain.model.ErrorType;
import fr.lapetina.domainlookup.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.domainlookup.lookup.DomainNames;
import fr.lapetina.domainlookup.lookup.exception.LookupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Lazily loaded mapping from TLD to RDAP endpoint base URLs.
 *
 * The bootstrap document is fetched by the first caller that needs it; concurrent
 * first callers block on the write lock and observe the loaded map once it is released.
 * A failed fetch leaves the cache unloaded so a later lookup retries it.
 * Once loaded, the map is never refreshed and lookups only take the read lock.
 */
public final class RdapBootstrapCache {

    private static final Logger log = LoggerFactory.getLogger(RdapBootstrapCache.class);

    public static final URI IANA_BOOTSTRAP_URI = URI.create("https://data.iana.org/rdap/dns.json");

    private final HttpClient httpClient;
    private final URI bootstrapUri;
    private final Duration timeout;
    private final ObjectMapper objectMapper;
    private final MetricsRegistry metricsRegistry;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, List<String>> endpoints = new HashMap<>();
    private final AtomicInteger fetchCount = new AtomicInteger(0);
    private volatile boolean loaded;

    public RdapBootstrapCache(URI bootstrapUri, Duration timeout, MetricsRegistry metricsRegistry) {
        this.bootstrapUri = bootstrapUri;
        this.timeout = timeout;
        this.metricsRegistry = metricsRegistry;
        this.objectMapper = new ObjectMapper();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Creates a cache that is already loaded with the given entries and never fetches.
     */
    public static RdapBootstrapCache preloaded(Map<String, List<String>> entries, MetricsRegistry metricsRegistry) {
        RdapBootstrapCache cache = new RdapBootstrapCache(IANA_BOOTSTRAP_URI, Duration.ofSeconds(10), metricsRegistry);
        entries.forEach((tld, urls) -> cache.endpoints.put(tld.toLowerCase(Locale.ROOT), List.copyOf(urls)));
        cache.loaded = true;
        return cache;
    }

    /**
     * Returns the ordered endpoint base URLs serving the domain's TLD.
     *
     * @param domain normalized domain name
     * @return an immutable copy of the endpoint list
     * @throws LookupException INVALID_DOMAIN, BOOTSTRAP_ERROR or NO_SERVER
     */
    public List<String> endpointsFor(String domain) throws LookupException {
        List<String> candidates = DomainNames.tldCandidates(domain);
        ensureLoaded();

        lock.readLock().lock();
        try {
            for (String candidate : candidates) {
                List<String> urls = endpoints.get(candidate);
                if (urls != null) {
                    return urls;
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        throw new LookupException(ErrorType.NO_SERVER,
                "No RDAP endpoint for TLD: " + DomainNames.lastLabel(domain));
    }

    public boolean isLoaded() {
        return loaded;
    }

    /**
     * Number of bootstrap fetch attempts made by this instance.
     */
    public int getFetchCount() {
        return fetchCount.get();
    }

    private void ensureLoaded() throws LookupException {
        if (loaded) {
            return;
        }

        lock.writeLock().lock();
        try {
            if (loaded) {
                return;
            }
            Map<String, List<String>> fetched = fetch();
            endpoints.putAll(fetched);
            loaded = true;
            metricsRegistry.recordBootstrapFetch(true);
            log.info("RDAP bootstrap loaded: uri={}, tlds={}", bootstrapUri, fetched.size());
        } catch (LookupException e) {
            metricsRegistry.recordBootstrapFetch(false);
            log.warn("RDAP bootstrap fetch failed: uri={}, error={}", bootstrapUri, e.getMessage());
            throw e;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Map<String, List<String>> fetch() throws LookupException {
        fetchCount.incrementAndGet();

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(bootstrapUri)
                    .timeout(timeout)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new LookupException(ErrorType.BOOTSTRAP_ERROR,
                    "Invalid RDAP bootstrap URI: " + e.getMessage(), e);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new LookupException(ErrorType.BOOTSTRAP_ERROR,
                    "Failed to fetch RDAP bootstrap: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LookupException(ErrorType.BOOTSTRAP_ERROR, "Interrupted while fetching RDAP bootstrap", e);
        }

        if (response.statusCode() != 200) {
            throw new LookupException(ErrorType.BOOTSTRAP_ERROR,
                    "Failed to fetch RDAP bootstrap: HTTP " + response.statusCode());
        }
        return parse(response.body());
    }

    Map<String, List<String>> parse(String body) throws LookupException {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new LookupException(ErrorType.BOOTSTRAP_ERROR,
                    "Failed to parse RDAP bootstrap JSON: " + e.getOriginalMessage(), e);
        }

        JsonNode services = root == null ? null : root.get("services");
        if (services == null || !services.isArray()) {
            throw new LookupException(ErrorType.BOOTSTRAP_ERROR, "RDAP bootstrap has no services array");
        }

        // Each service is [[tld, ...], [url, ...]]
        Map<String, List<String>> parsed = new HashMap<>();
        for (JsonNode service : services) {
            if (!service.isArray() || service.size() < 2) {
                continue;
            }
            List<String> urls = textValues(service.get(1));
            for (String tld : textValues(service.get(0))) {
                parsed.put(tld.toLowerCase(Locale.ROOT), urls);
            }
        }
        return parsed;
    }

    private static List<String> textValues(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array != null && array.isArray()) {
            for (JsonNode value : array) {
                if (value.isTextual()) {
                    values.add(value.asText());
                }
            }
        }
        return List.copyOf(values);
    }
}
