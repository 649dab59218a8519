package fr.lapetina.domainlookup.domain.model;

/**
 * Protocol tier that produced a result.
 */
public enum LookupSource {
    /** HTTPS+JSON registry lookup (RDAP) */
    STRUCTURED("rdap"),

    /** Plain-text lookup over TCP port 43 (WHOIS) */
    LEGACY("whois");

    private final String label;

    LookupSource(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
