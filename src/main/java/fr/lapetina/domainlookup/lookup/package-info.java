/**
 * Protocol-independent lookup orchestration.
 *
 * <h2>Flow</h2>
 * <pre>
 * BatchDispatcher ──► DomainChecker ──► RDAP tier ──(LookupException)──► WHOIS tier
 *      (per domain, bounded)                                                 │
 *      ◄──────────────── LookupResult written to the domain's input slot ◄───┘
 * </pre>
 *
 * <h2>Error Handling</h2>
 * <p>Tiers signal failure with {@link fr.lapetina.domainlookup.lookup.exception.LookupException}.
 * {@link fr.lapetina.domainlookup.lookup.DomainChecker} recovers from every such failure:
 * a batch never aborts because one domain failed.
 */
package fr.lapetina.domainlookup.lookup;
