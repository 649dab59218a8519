package fr.lapetina.domainlookup.domain.model;

/**
 * Error taxonomy for domain lookups.
 * Provides clear categorization for fallback decisions and metrics.
 */
public enum ErrorType {
    /** Malformed domain name (fewer than two labels) */
    INVALID_DOMAIN,

    /** No RDAP endpoint or WHOIS server is known for the TLD */
    NO_SERVER,

    /** RDAP bootstrap document could not be fetched or parsed */
    BOOTSTRAP_ERROR,

    /** Connect, read or write failure */
    TRANSPORT_ERROR,

    /** Network operation exceeded the per-query timeout */
    TIMEOUT,

    /** Response could not be parsed or classified */
    PROTOCOL_ERROR,

    /** Every RDAP endpoint for the TLD failed */
    ALL_ENDPOINTS_FAILED,

    /** Internal system error */
    INTERNAL_ERROR
}
