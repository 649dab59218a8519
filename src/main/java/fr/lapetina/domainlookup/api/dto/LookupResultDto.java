package fr.lapetina.domainlookup.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import fr.lapetina.domainlookup.domain.model.LookupResult;

import java.time.Instant;

/**
 * Machine-readable form of a lookup result.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"domain", "status", "registrar", "expiry", "source", "error"})
public class LookupResultDto {

    private String domain;
    private String status;
    private String registrar;
    private Instant expiry;
    private String source;
    private String error;

    // Getters and setters
    public String getDomain() { return domain; }
    public void setDomain(String domain) { this.domain = domain; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getRegistrar() { return registrar; }
    public void setRegistrar(String registrar) { this.registrar = registrar; }

    public Instant getExpiry() { return expiry; }
    public void setExpiry(Instant expiry) { this.expiry = expiry; }

    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    /**
     * Creates from domain LookupResult.
     */
    public static LookupResultDto fromLookupResult(LookupResult result) {
        LookupResultDto dto = new LookupResultDto();
        dto.setDomain(result.domain());
        dto.setStatus(result.status().getLabel());
        dto.setRegistrar(result.registrar());
        dto.setExpiry(result.expiry());
        if (result.source() != null) {
            dto.setSource(result.source().getLabel());
        }
        dto.setError(result.errorDetail());
        return dto;
    }
}
