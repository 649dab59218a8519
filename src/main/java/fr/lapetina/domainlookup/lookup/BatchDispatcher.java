package fr.lapetina.domainlookup.lookup;

import fr.lapetina.domainlookup.domain.model.LookupResult;
import fr.lapetina.domainlookup.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a {@link DomainChecker} over a batch of domains with bounded parallelism.
 *
 * Each domain's output slot is fixed by its input position before the task starts,
 * so results come back in input order whatever the completion order.
 * A semaphore sized to the concurrency ceiling admits tasks; a slot is released
 * only when its task has written its result. A slot left empty by a task that
 * died is reported as UNKNOWN.
 */
public final class BatchDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BatchDispatcher.class);

    private final MetricsRegistry metricsRegistry;

    public BatchDispatcher(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    /**
     * Checks every domain and returns one result per input, in input order.
     *
     * @param domains     domains as typed by the caller
     * @param concurrency maximum number of lookups in flight, clamped to at least 1
     * @param checker     lookup to run for each domain
     * @return results positionally matching {@code domains}
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public List<LookupResult> dispatch(List<String> domains, int concurrency, DomainChecker checker)
            throws InterruptedException {
        int size = domains.size();
        if (size == 0) {
            return List.of();
        }

        int permits = Math.max(1, concurrency);
        LookupResult[] results = new LookupResult[size];
        Semaphore admission = new Semaphore(permits);
        CountDownLatch done = new CountDownLatch(size);
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(permits, size), workerThreadFactory());

        log.info("Batch started: domains={}, concurrency={}", size, permits);
        try {
            for (int i = 0; i < size; i++) {
                final int slot = i;
                final String domain = domains.get(i);
                admission.acquire();
                executor.execute(() -> {
                    try {
                        results[slot] = runOne(checker, domain);
                    } finally {
                        admission.release();
                        done.countDown();
                    }
                });
            }
            done.await();
        } finally {
            executor.shutdownNow();
        }

        for (int i = 0; i < size; i++) {
            if (results[i] == null) {
                results[i] = LookupResult.unknown(DomainNames.normalize(domains.get(i)),
                        "Internal error: lookup did not complete");
            }
        }

        log.info("Batch finished: domains={}, unknown={}",
                size, Arrays.stream(results).filter(LookupResult::isUnknown).count());
        return List.of(results);
    }

    private LookupResult runOne(DomainChecker checker, String domain) {
        metricsRegistry.lookupStarted();
        try {
            return checker.check(domain);
        } catch (RuntimeException e) {
            log.error("Unexpected error checking domain: domain={}", domain, e);
            return LookupResult.unknown(DomainNames.normalize(domain),
                    "Internal error: " + e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            metricsRegistry.lookupFinished();
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger(0);
        return r -> {
            Thread t = new Thread(r, "lookup-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler((thread, e) ->
                    log.error("Lookup worker died: thread={}", thread.getName(), e));
            return t;
        };
    }
}
