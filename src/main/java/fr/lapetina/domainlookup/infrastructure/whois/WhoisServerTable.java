package fr.lapetina.domainlookup.infrastructure.whois;

import fr.lapetina.domainlookup.domain.model.ErrorType;
import fr.lapetina.domainlookup.lookup.DomainNames;
import fr.lapetina.domainlookup.lookup.exception.LookupException;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable mapping from TLD (or compound second-level label such as {@code co.uk})
 * to the WHOIS server answering for it.
 */
public final class WhoisServerTable {

    private static final Map<String, String> DEFAULT_SERVERS = Map.ofEntries(
            Map.entry("ac", "whois.nic.ac"),
            Map.entry("ae", "whois.aeda.net.ae"),
            Map.entry("ai", "whois.nic.ai"),
            Map.entry("app", "whois.nic.google"),
            Map.entry("au", "whois.auda.org.au"),
            Map.entry("biz", "whois.biz"),
            Map.entry("ca", "whois.cira.ca"),
            Map.entry("cc", "ccwhois.verisign-grs.com"),
            Map.entry("cn", "whois.cnnic.cn"),
            Map.entry("co", "whois.nic.co"),
            Map.entry("com", "whois.verisign-grs.com"),
            Map.entry("de", "whois.denic.de"),
            Map.entry("dev", "whois.nic.google"),
            Map.entry("edu", "whois.educause.edu"),
            Map.entry("fr", "whois.nic.fr"),
            Map.entry("hk", "whois.hkirc.hk"),
            Map.entry("info", "whois.afilias.net"),
            Map.entry("io", "whois.nic.io"),
            Map.entry("jp", "whois.jprs.jp"),
            Map.entry("kr", "whois.kr"),
            Map.entry("me", "whois.nic.me"),
            Map.entry("mobi", "whois.dotmobiregistry.net"),
            Map.entry("net", "whois.verisign-grs.com"),
            Map.entry("org", "whois.pir.org"),
            Map.entry("ru", "whois.tcinet.ru"),
            Map.entry("sh", "whois.nic.sh"),
            Map.entry("so", "whois.nic.so"),
            Map.entry("tv", "tvwhois.verisign-grs.com"),
            Map.entry("uk", "whois.nic.uk"),
            Map.entry("us", "whois.nic.us"),
            Map.entry("xyz", "whois.nic.xyz")
    );

    private final Map<String, String> servers;

    private WhoisServerTable(Map<String, String> servers) {
        this.servers = Map.copyOf(servers);
    }

    /**
     * Returns the built-in table.
     */
    public static WhoisServerTable defaults() {
        return new WhoisServerTable(DEFAULT_SERVERS);
    }

    /**
     * Returns the built-in table with the given entries added or replacing existing ones.
     */
    public static WhoisServerTable withOverrides(Map<String, String> overrides) {
        Map<String, String> merged = new HashMap<>(DEFAULT_SERVERS);
        if (overrides != null) {
            overrides.forEach((tld, server) -> merged.put(tld.toLowerCase(Locale.ROOT), server));
        }
        return new WhoisServerTable(merged);
    }

    /**
     * Returns a table holding only the given entries.
     */
    public static WhoisServerTable of(Map<String, String> servers) {
        return new WhoisServerTable(servers);
    }

    /**
     * Resolves the WHOIS server for a domain, trying the compound label before the TLD.
     *
     * @throws LookupException INVALID_DOMAIN or NO_SERVER
     */
    public String serverFor(String domain) throws LookupException {
        for (String candidate : DomainNames.tldCandidates(domain)) {
            String server = servers.get(candidate);
            if (server != null) {
                return server;
            }
        }
        throw new LookupException(ErrorType.NO_SERVER,
                "No WHOIS server for TLD: " + DomainNames.lastLabel(domain));
    }

    public int size() {
        return servers.size();
    }
}
