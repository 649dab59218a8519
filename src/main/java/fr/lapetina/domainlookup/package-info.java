/**
 * Domain Lookup - checks whether domain names are registered.
 *
 * <p>Each domain is looked up over RDAP first, using endpoints discovered from the IANA
 * bootstrap registry, and over WHOIS (TCP port 43) when RDAP cannot answer. Batches run
 * concurrently under a fixed ceiling and return results in input order.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.domainlookup.LookupServiceFactory} - Main entry point for creating
 *       a fully-configured service from YAML configuration</li>
 *   <li>{@link fr.lapetina.domainlookup.DomainLookupService} - Batch lookup API</li>
 *   <li>{@link fr.lapetina.domainlookup.DomainLookupApplication} - Command-line runner</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (LookupServiceFactory factory = LookupServiceFactory.create("config.yaml")) {
 *     List<LookupResult> results = factory.getService()
 *             .queryBatch(List.of("example.com", "example.net"), 5, Duration.ofSeconds(10));
 *
 *     results.forEach(r -> System.out.println(r.domain() + " " + r.status()));
 * }
 * }</pre>
 *
 * @see fr.lapetina.domainlookup.LookupServiceFactory
 * @see fr.lapetina.domainlookup.lookup.DomainChecker
 */
package fr.lapetina.domainlookup;
