/**
 * Domain model classes shared by both lookup tiers.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.domainlookup.domain.model.LookupResult} - Immutable outcome of one lookup</li>
 *   <li>{@link fr.lapetina.domainlookup.domain.model.RegistrationStatus} - REGISTERED, AVAILABLE, UNKNOWN</li>
 *   <li>{@link fr.lapetina.domainlookup.domain.model.LookupSource} - Which protocol tier answered</li>
 *   <li>{@link fr.lapetina.domainlookup.domain.model.ErrorType} - Categorized lookup failures</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Every type in this package is immutable and may be shared freely between worker threads.
 */
package fr.lapetina.domainlookup.domain.model;
