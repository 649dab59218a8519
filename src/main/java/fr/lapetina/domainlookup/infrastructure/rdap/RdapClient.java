package fr.lapetina.domainlookup.infrastructure.rdap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.domainlookup.domain.model.ErrorType;
import fr.lapetina.domainlookup.domain.model.LookupResult;
import fr.lapetina.domainlookup.lookup.RegistrationLookup;
import fr.lapetina.domainlookup.lookup.exception.LookupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * RDAP client for domain registration lookups.
 *
 * Uses java.net.http.HttpClient with a per-request timeout.
 * Endpoints for a TLD are tried in bootstrap order; the first one that answers
 * 200 or 404 decides the result. Any other status, a transport error or an
 * unparsable body only moves on to the next endpoint.
 */
public final class RdapClient implements RegistrationLookup {

    private static final Logger log = LoggerFactory.getLogger(RdapClient.class);

    private static final String RDAP_MEDIA_TYPE = "application/rdap+json";
    private static final String EXPIRATION_ACTION = "expiration";
    private static final String REGISTRAR_ROLE = "registrar";

    private final HttpClient httpClient;
    private final RdapBootstrapCache bootstrapCache;
    private final Duration requestTimeout;
    private final ObjectMapper objectMapper;

    public RdapClient(HttpClient httpClient, RdapBootstrapCache bootstrapCache, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.bootstrapCache = bootstrapCache;
        this.requestTimeout = requestTimeout;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String getName() {
        return "rdap";
    }

    @Override
    public LookupResult query(String domain) throws LookupException {
        List<String> endpoints = bootstrapCache.endpointsFor(domain);

        for (String endpoint : endpoints) {
            try {
                LookupResult result = queryEndpoint(endpoint, domain);
                log.debug("RDAP endpoint answered: domain={}, endpoint={}, status={}",
                        domain, endpoint, result.status());
                return result;
            } catch (EndpointException e) {
                log.debug("RDAP endpoint failed: domain={}, endpoint={}, error={}",
                        domain, endpoint, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LookupException(ErrorType.INTERNAL_ERROR, "Interrupted during RDAP lookup: " + domain, e);
            }
        }

        throw new LookupException(ErrorType.ALL_ENDPOINTS_FAILED, "All RDAP servers failed: " + domain);
    }

    static URI buildUri(String endpoint, String domain) {
        String base = endpoint;
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + "/domain/" + domain);
    }

    private LookupResult queryEndpoint(String endpoint, String domain) throws EndpointException, InterruptedException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(buildUri(endpoint, domain))
                    .timeout(requestTimeout)
                    .header("Accept", RDAP_MEDIA_TYPE + ", application/json")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new EndpointException("Invalid endpoint URI: " + e.getMessage());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new EndpointException(e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        int statusCode = response.statusCode();
        if (statusCode == 404) {
            return LookupResult.available(domain);
        }
        if (statusCode != 200) {
            throw new EndpointException("HTTP " + statusCode);
        }
        return parseDomain(domain, response.body());
    }

    LookupResult parseDomain(String domain, String body) throws EndpointException {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new EndpointException("Failed to parse RDAP response: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            throw new EndpointException("RDAP response is not a JSON object");
        }

        LookupResult.Builder builder = LookupResult.registered(domain);
        extractExpiry(root.path("events")).ifPresent(builder::expiry);
        extractRegistrar(root.path("entities")).ifPresent(builder::registrar);
        return builder.build();
    }

    private static Optional<Instant> extractExpiry(JsonNode events) {
        Instant expiry = null;
        for (JsonNode event : events) {
            if (!EXPIRATION_ACTION.equals(event.path("eventAction").asText())) {
                continue;
            }
            try {
                expiry = OffsetDateTime.parse(event.path("eventDate").asText(), DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                        .toInstant();
            } catch (DateTimeParseException e) {
                log.debug("Ignoring unparsable RDAP expiration date: {}", event.path("eventDate").asText());
            }
        }
        return Optional.ofNullable(expiry);
    }

    private static Optional<String> extractRegistrar(JsonNode entities) {
        for (JsonNode entity : entities) {
            for (JsonNode role : entity.path("roles")) {
                if (REGISTRAR_ROLE.equals(role.asText())) {
                    return VCardParser.formattedName(entity.get("vcardArray"));
                }
            }
        }
        return Optional.empty();
    }

    static final class EndpointException extends Exception {
        EndpointException(String message) {
            super(message);
        }
    }
}
