package fr.lapetina.domainlookup.lookup;

import fr.lapetina.domainlookup.domain.model.LookupResult;
import fr.lapetina.domainlookup.lookup.exception.LookupException;

/**
 * One protocol tier able to tell whether a domain is registered.
 *
 * Implementations must be thread-safe: the same instance serves every
 * worker of a batch.
 */
public interface RegistrationLookup {

    /**
     * Queries the registration state of a normalized domain.
     *
     * @param domain lowercase, trimmed domain name
     * @return a REGISTERED or AVAILABLE result without a source
     * @throws LookupException if this tier cannot answer definitively
     */
    LookupResult query(String domain) throws LookupException;

    /**
     * Returns the name of this tier, used in logs.
     */
    String getName();
}
