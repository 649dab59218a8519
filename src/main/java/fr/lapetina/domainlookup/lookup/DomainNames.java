package fr.lapetina.domainlookup.lookup;

import fr.lapetina.domainlookup.domain.model.ErrorType;
import fr.lapetina.domainlookup.lookup.exception.LookupException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Domain name helpers shared by the RDAP and WHOIS tiers.
 */
public final class DomainNames {

    private DomainNames() {
    }

    /**
     * Trims and lowercases a domain as typed by the caller.
     */
    public static String normalize(String domain) {
        return domain == null ? "" : domain.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the TLD keys to try for a domain, most specific first.
     *
     * <p>A domain with three or more labels yields its last two labels
     * ({@code co.uk}) followed by its last label ({@code uk}); a two-label
     * domain yields only its last label.
     *
     * @throws LookupException with {@link ErrorType#INVALID_DOMAIN} for fewer than two labels
     */
    public static List<String> tldCandidates(String domain) throws LookupException {
        String[] labels = domain.split("\\.", -1);
        if (labels.length < 2) {
            throw new LookupException(ErrorType.INVALID_DOMAIN, "Invalid domain: " + domain);
        }

        List<String> candidates = new ArrayList<>(2);
        if (labels.length >= 3) {
            candidates.add(labels[labels.length - 2] + "." + labels[labels.length - 1]);
        }
        candidates.add(labels[labels.length - 1]);
        return candidates;
    }

    /**
     * Returns the last label of a domain, used in "not found" diagnostics.
     */
    public static String lastLabel(String domain) {
        int dot = domain.lastIndexOf('.');
        return dot < 0 ? domain : domain.substring(dot + 1);
    }
}
