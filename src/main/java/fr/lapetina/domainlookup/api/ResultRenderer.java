package fr.lapetina.domainlookup.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.domainlookup.api.dto.LookupResultDto;
import fr.lapetina.domainlookup.domain.model.LookupResult;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Renders lookup results as a JSON document or as one human-readable line per domain.
 */
public final class ResultRenderer {

    private static final DateTimeFormatter DATE_ONLY = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;
    private final boolean verbose;

    public ResultRenderer(boolean verbose) {
        this.verbose = verbose;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Renders all results as a pretty-printed JSON array.
     */
    public String toJson(List<LookupResult> results) {
        List<LookupResultDto> dtos = results.stream()
                .map(LookupResultDto::fromLookupResult)
                .toList();
        try {
            return objectMapper.writeValueAsString(dtos);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize lookup results", e);
        }
    }

    /**
     * Renders a single result as a text line without a trailing newline.
     */
    public String toLine(LookupResult result) {
        String domainColumn = String.format("%-40s", result.domain());
        return switch (result.status()) {
            case AVAILABLE -> domainColumn + " ✓ available";
            case REGISTERED -> domainColumn + " ✗ registered" + (verbose ? details(result) : "");
            case UNKNOWN -> domainColumn + " ? lookup failed: " + result.errorDetail();
        };
    }

    private static String details(LookupResult result) {
        StringBuilder extra = new StringBuilder();
        if (result.registrar() != null) {
            extra.append("  registrar: ").append(result.registrar());
        }
        if (result.expiry() != null) {
            extra.append("  expires: ").append(DATE_ONLY.format(result.expiry()));
        }
        if (result.source() != null) {
            extra.append("  [").append(result.source().getLabel()).append(']');
        }
        return extra.toString();
    }
}
