package fr.lapetina.domainlookup.lookup.exception;

import fr.lapetina.domainlookup.domain.model.ErrorType;

/**
 * Exception thrown when a lookup tier cannot produce a definitive answer.
 *
 * This occurs when:
 * - The domain is malformed
 * - No endpoint or server is known for the TLD
 * - The transport fails or times out
 * - The response cannot be parsed or classified
 */
public final class LookupException extends Exception {

    private final ErrorType errorType;

    public LookupException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public LookupException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
