package fr.lapetina.domainlookup.infrastructure.rdap;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Reads properties out of an RDAP {@code vcardArray} (jCard, RFC 7095).
 *
 * The structure is {@code ["vcard", [[name, params, type, value], ...]]}.
 * Any deviation from that shape yields an empty result rather than an error.
 */
final class VCardParser {

    static final String FORMATTED_NAME = "fn";

    private static final int NAME_INDEX = 0;
    private static final int VALUE_INDEX = 3;

    private VCardParser() {
    }

    /**
     * Returns the text value of the first {@code fn} property.
     */
    static Optional<String> formattedName(JsonNode vcardArray) {
        return textProperty(vcardArray, FORMATTED_NAME);
    }

    static Optional<String> textProperty(JsonNode vcardArray, String propertyName) {
        if (vcardArray == null || !vcardArray.isArray() || vcardArray.size() < 2) {
            return Optional.empty();
        }

        JsonNode properties = vcardArray.get(1);
        if (!properties.isArray()) {
            return Optional.empty();
        }

        for (JsonNode property : properties) {
            if (!property.isArray() || property.size() <= VALUE_INDEX) {
                continue;
            }
            JsonNode name = property.get(NAME_INDEX);
            if (!name.isTextual() || !propertyName.equals(name.asText())) {
                continue;
            }
            JsonNode value = property.get(VALUE_INDEX);
            if (value.isTextual()) {
                return Optional.of(value.asText());
            }
        }
        return Optional.empty();
    }
}
