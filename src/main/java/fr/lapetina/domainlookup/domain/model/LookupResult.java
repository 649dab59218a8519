package fr.lapetina.domainlookup.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of a single domain lookup.
 * Immutable and thread-safe.
 *
 * <p>{@code errorDetail} is present exactly when the status is {@link RegistrationStatus#UNKNOWN};
 * an unknown result never carries a source.
 */
public record LookupResult(
        String domain,
        RegistrationStatus status,
        String registrar,
        Instant expiry,
        LookupSource source,
        String errorDetail
) {
    public LookupResult {
        Objects.requireNonNull(domain, "Domain is required");
        Objects.requireNonNull(status, "Status is required");
        if (status == RegistrationStatus.UNKNOWN) {
            if (errorDetail == null || errorDetail.isBlank()) {
                throw new IllegalArgumentException("Unknown result requires an error detail");
            }
            if (source != null) {
                throw new IllegalArgumentException("Unknown result cannot carry a source");
            }
        } else if (errorDetail != null) {
            throw new IllegalArgumentException("Error detail is only allowed on unknown results");
        }
        if (registrar != null && registrar.isBlank()) {
            registrar = null;
        }
    }

    public boolean isUnknown() {
        return status == RegistrationStatus.UNKNOWN;
    }

    /**
     * Returns a copy stamped with the tier that produced it.
     */
    public LookupResult withSource(LookupSource source) {
        return new LookupResult(domain, status, registrar, expiry, source, errorDetail);
    }

    public static LookupResult available(String domain) {
        return new LookupResult(domain, RegistrationStatus.AVAILABLE, null, null, null, null);
    }

    public static LookupResult unknown(String domain, String errorDetail) {
        return new LookupResult(domain, RegistrationStatus.UNKNOWN, null, null, null, errorDetail);
    }

    public static Builder registered(String domain) {
        return new Builder(domain);
    }

    /**
     * Builder for registered results, whose optional fields are filled in as parsing proceeds.
     */
    public static final class Builder {
        private final String domain;
        private String registrar;
        private Instant expiry;
        private LookupSource source;

        private Builder(String domain) {
            this.domain = domain;
        }

        public Builder registrar(String registrar) {
            this.registrar = registrar;
            return this;
        }

        public Builder expiry(Instant expiry) {
            this.expiry = expiry;
            return this;
        }

        public Builder source(LookupSource source) {
            this.source = source;
            return this;
        }

        public LookupResult build() {
            return new LookupResult(domain, RegistrationStatus.REGISTERED, registrar, expiry, source, null);
        }
    }
}
