package fr.lapetina.domainlookup.lookup;

import fr.lapetina.domainlookup.domain.model.ErrorType;
import fr.lapetina.domainlookup.domain.model.LookupResult;
import fr.lapetina.domainlookup.domain.model.LookupSource;
import fr.lapetina.domainlookup.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.domainlookup.lookup.exception.LookupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Two-tier lookup: RDAP first, WHOIS when RDAP cannot answer.
 *
 * Never throws for lookup failures. When both tiers fail the result is UNKNOWN
 * and carries the WHOIS error.
 */
public final class DomainChecker {

    private static final Logger log = LoggerFactory.getLogger(DomainChecker.class);

    private final RegistrationLookup structured;
    private final RegistrationLookup legacy;
    private final MetricsRegistry metricsRegistry;

    public DomainChecker(RegistrationLookup structured, RegistrationLookup legacy, MetricsRegistry metricsRegistry) {
        this.structured = structured;
        this.legacy = legacy;
        this.metricsRegistry = metricsRegistry;
    }

    /**
     * Checks a domain as typed by the caller.
     *
     * @param rawDomain domain name, normalized before dispatch
     * @return a result whose source is set unless the status is UNKNOWN
     */
    public LookupResult check(String rawDomain) {
        String domain = DomainNames.normalize(rawDomain);
        LookupResult result = doCheck(domain);
        metricsRegistry.recordLookup(result);
        return result;
    }

    private LookupResult doCheck(String domain) {
        try {
            return timed(structured, domain).withSource(LookupSource.STRUCTURED);
        } catch (LookupException e) {
            metricsRegistry.incrementFallback(e.getErrorType());
            log.debug("Structured lookup failed, falling back: domain={}, errorType={}, error={}",
                    domain, e.getErrorType(), e.getMessage());
        } catch (RuntimeException e) {
            metricsRegistry.incrementFallback(ErrorType.INTERNAL_ERROR);
            log.warn("Structured lookup failed unexpectedly, falling back: domain={}", domain, e);
        }

        try {
            return timed(legacy, domain).withSource(LookupSource.LEGACY);
        } catch (LookupException e) {
            log.warn("Lookup failed: domain={}, errorType={}, error={}",
                    domain, e.getErrorType(), e.getMessage());
            return LookupResult.unknown(domain, e.getMessage());
        }
    }

    private LookupResult timed(RegistrationLookup lookup, String domain) throws LookupException {
        Instant start = Instant.now();
        try {
            return lookup.query(domain);
        } finally {
            metricsRegistry.recordLatency(lookup.getName(), Duration.between(start, Instant.now()));
        }
    }
}
