package fr.lapetina.domainlookup.infrastructure.rdap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VCardParserTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Test
    @DisplayName("should read fn from the property list")
    void shouldReadFormattedName() throws Exception {
        JsonNode vcard = json("""
                ["vcard", [
                  ["version", {}, "text", "4.0"],
                  ["fn", {}, "text", "Example Registrar, Inc."]
                ]]
                """);

        assertThat(VCardParser.formattedName(vcard)).contains("Example Registrar, Inc.");
    }

    @Test
    @DisplayName("should skip fn properties whose value is not text")
    void shouldSkipNonTextValues() throws Exception {
        JsonNode vcard = json("""
                ["vcard", [
                  ["fn", {}, "text", ["structured"]],
                  ["fn", {}, "text", "Second Name"]
                ]]
                """);

        assertThat(VCardParser.formattedName(vcard)).contains("Second Name");
    }

    @Test
    @DisplayName("should return empty for unexpected shapes")
    void shouldReturnEmptyForUnexpectedShapes() throws Exception {
        assertThat(VCardParser.formattedName(null)).isEmpty();
        assertThat(VCardParser.formattedName(json("{\"fn\": \"x\"}"))).isEmpty();
        assertThat(VCardParser.formattedName(json("[\"vcard\"]"))).isEmpty();
        assertThat(VCardParser.formattedName(json("[\"vcard\", \"fn\"]"))).isEmpty();
        assertThat(VCardParser.formattedName(json("[\"vcard\", [[\"fn\", {}, \"text\"]]]"))).isEmpty();
        assertThat(VCardParser.formattedName(json("[\"vcard\", [\"fn\", 42]]"))).isEmpty();
    }
}
