package fr.lapetina.domainlookup;

import fr.lapetina.domainlookup.api.ResultRenderer;
import fr.lapetina.domainlookup.domain.model.LookupResult;
import fr.lapetina.domainlookup.infrastructure.config.LookupConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.List;

/**
 * Main entry point: checks the domains given as arguments and prints one result each.
 *
 * The configuration path is read from the {@code domainlookup.config} system property.
 * Exits with status 1 when no domain is given or when any lookup ended UNKNOWN.
 */
public class DomainLookupApplication {

    private static final Logger log = LoggerFactory.getLogger(DomainLookupApplication.class);

    static final String CONFIG_PROPERTY = "domainlookup.config";

    private final LookupServiceFactory factory;
    private final ResultRenderer renderer;

    public DomainLookupApplication(LookupServiceFactory factory) {
        this.factory = factory;
        this.renderer = new ResultRenderer(factory.getConfig().getOutput().isVerbose());
    }

    /**
     * Looks up the domains and writes the rendered results.
     *
     * @return the process exit status
     */
    public int run(List<String> domains, PrintStream out, PrintStream err) throws InterruptedException {
        LookupConfig config = factory.getConfig();
        List<LookupResult> results = factory.getService().queryBatch(
                domains,
                config.getLookup().effectiveConcurrency(),
                config.getLookup().effectiveTimeout()
        );

        if (config.getOutput().isJson()) {
            out.println(renderer.toJson(results));
        } else {
            for (LookupResult result : results) {
                (result.isUnknown() ? err : out).println(renderer.toLine(result));
            }
        }

        log.debug("Metrics after batch:\n{}", factory.getMetricsRegistry().scrape());
        return DomainLookupService.hasFailures(results) ? 1 : 0;
    }

    static void printUsage(PrintStream err) {
        err.println("Usage: domain-lookup [-D" + CONFIG_PROPERTY + "=config.yaml] <domain>...");
        err.println();
        err.println("Examples:");
        err.println("  domain-lookup example.com example.net");
    }

    public static void main(String[] args) {
        if (args.length == 0) {
            printUsage(System.err);
            System.exit(1);
        }

        String configPath = System.getProperty(CONFIG_PROPERTY, "config.yaml");
        int status;
        try (LookupServiceFactory factory = LookupServiceFactory.create(configPath)) {
            status = new DomainLookupApplication(factory).run(List.of(args), System.out, System.err);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while waiting for lookups");
            status = 1;
        } catch (Exception e) {
            log.error("Failed to run domain lookup", e);
            status = 1;
        }
        System.exit(status);
    }
}
