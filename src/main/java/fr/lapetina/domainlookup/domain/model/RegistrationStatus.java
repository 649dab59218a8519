package fr.lapetina.domainlookup.domain.model;

/**
 * Registration state of a queried domain.
 *
 * REGISTERED: a registry reports the domain as delegated
 * AVAILABLE: a registry reports no such domain
 * UNKNOWN: no lookup tier produced a usable answer
 */
public enum RegistrationStatus {
    REGISTERED("registered"),
    AVAILABLE("available"),
    UNKNOWN("unknown");

    private final String label;

    RegistrationStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
