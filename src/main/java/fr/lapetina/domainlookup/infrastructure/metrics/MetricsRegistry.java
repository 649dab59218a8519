package fr.lapetina.domainlookup.infrastructure.metrics;

import fr.lapetina.domainlookup.domain.model.ErrorType;
import fr.lapetina.domainlookup.domain.model.LookupResult;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Lookup counters per status and source
 * - Lookup latency per protocol tier
 * - Fallback and bootstrap fetch counters
 * - In-flight lookup gauge
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private static final String NO_SOURCE = "none";

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> lookupCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> fallbackCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> bootstrapCounters = new ConcurrentHashMap<>();

    private final AtomicInteger inFlight = new AtomicInteger(0);

    public MetricsRegistry(String prefix, boolean bindJvmMetrics) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        if (bindJvmMetrics) {
            new JvmMemoryMetrics().bindTo(registry);
            new JvmThreadMetrics().bindTo(registry);
        }

        Gauge.builder(prefix + "_inflight_lookups", inFlight, AtomicInteger::get)
                .description("Number of lookups currently running")
                .register(registry);

        log.debug("MetricsRegistry initialized with prefix: {}", prefix);
    }

    /**
     * Counts a finished lookup by status and source.
     */
    public void recordLookup(LookupResult result) {
        String status = result.status().getLabel();
        String source = result.source() != null ? result.source().getLabel() : NO_SOURCE;
        lookupCounters.computeIfAbsent(status + ":" + source, k ->
                Counter.builder(prefix + "_lookups_total")
                        .description("Total number of domain lookups")
                        .tag("status", status)
                        .tag("source", source)
                        .register(registry)
        ).increment();
    }

    /**
     * Records how long a lookup tier took to answer or fail.
     */
    public void recordLatency(String tier, Duration latency) {
        latencyTimers.computeIfAbsent(tier, k ->
                Timer.builder(prefix + "_lookup_latency")
                        .description("Lookup latency per protocol tier")
                        .tag("tier", tier)
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Counts a fallback from the structured tier, by the error that caused it.
     */
    public void incrementFallback(ErrorType reason) {
        fallbackCounters.computeIfAbsent(reason.name(), k ->
                Counter.builder(prefix + "_fallbacks_total")
                        .description("Lookups that fell back to WHOIS")
                        .tag("reason", reason.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Counts an RDAP bootstrap fetch attempt.
     */
    public void recordBootstrapFetch(boolean success) {
        String outcome = success ? "success" : "failure";
        bootstrapCounters.computeIfAbsent(outcome, k ->
                Counter.builder(prefix + "_bootstrap_fetches_total")
                        .description("RDAP bootstrap fetch attempts")
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    public void lookupStarted() {
        inFlight.incrementAndGet();
    }

    public void lookupFinished() {
        inFlight.decrementAndGet();
    }

    public int getInFlight() {
        return inFlight.get();
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
