package fr.lapetina.domainlookup.infrastructure.whois;

import fr.lapetina.domainlookup.domain.model.LookupResult;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Classifies free-form WHOIS responses.
 *
 * <p>The lowercased body is scanned for {@link #NOT_REGISTERED_MARKERS} first and
 * {@link #REGISTERED_MARKERS} second. The order matters: several registries answer
 * "not found" with text that also contains field labels. A body matching neither
 * list yields an UNKNOWN result.
 */
public final class WhoisResponseParser {

    /** Substrings that mark a domain as not registered, in scan order. */
    public static final List<String> NOT_REGISTERED_MARKERS = List.of(
            "no match for",
            "not found",
            "no entries found",
            "no data found",
            "object does not exist",
            "no objects found",
            "domain not found",
            "status: free",
            "available for registration",
            "this domain name has not been registered"
    );

    /** Field labels that mark a domain as registered, in scan order. */
    public static final List<String> REGISTERED_MARKERS = List.of(
            "domain name:",
            "registrar:",
            "creation date:",
            "registered on:",
            "domain status:",
            "registrant:",
            "registry domain id:",
            "nserver:"
    );

    /** Expiry field labels, highest priority first. */
    public static final List<String> EXPIRY_FIELDS = List.of(
            "Registry Expiry Date",
            "Expiry Date",
            "Expiration Date",
            "paid-till"
    );

    static final String REGISTRAR_FIELD = "Registrar";

    private static final List<DateFormat> DATE_FORMATS = List.of(
            new DateFormat(DateTimeFormatter.ISO_OFFSET_DATE_TIME,
                    t -> OffsetDateTime.from(t).toInstant()),
            new DateFormat(DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss'Z'", Locale.ROOT)
                    .withResolverStyle(ResolverStyle.STRICT),
                    t -> LocalDateTime.from(t).toInstant(ZoneOffset.UTC)),
            new DateFormat(DateTimeFormatter.ofPattern("uuuu-MM-dd", Locale.ROOT)
                    .withResolverStyle(ResolverStyle.STRICT),
                    WhoisResponseParser::startOfDay),
            new DateFormat(new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .appendPattern("dd-MMM-uuuu")
                    .toFormatter(Locale.ENGLISH)
                    .withResolverStyle(ResolverStyle.STRICT),
                    WhoisResponseParser::startOfDay),
            new DateFormat(DateTimeFormatter.ofPattern("uuuu.MM.dd", Locale.ROOT)
                    .withResolverStyle(ResolverStyle.STRICT),
                    WhoisResponseParser::startOfDay),
            new DateFormat(DateTimeFormatter.ofPattern("dd/MM/uuuu", Locale.ROOT)
                    .withResolverStyle(ResolverStyle.STRICT),
                    WhoisResponseParser::startOfDay)
    );

    private WhoisResponseParser() {
    }

    /**
     * Classifies a WHOIS body and extracts registrar and expiry when registered.
     *
     * @return AVAILABLE, REGISTERED, or UNKNOWN when no marker matches
     */
    public static LookupResult parse(String domain, String body) {
        String lower = body.toLowerCase(Locale.ROOT);

        for (String marker : NOT_REGISTERED_MARKERS) {
            if (lower.contains(marker)) {
                return LookupResult.available(domain);
            }
        }

        for (String marker : REGISTERED_MARKERS) {
            if (lower.contains(marker)) {
                LookupResult.Builder builder = LookupResult.registered(domain);
                field(body, REGISTRAR_FIELD).ifPresent(builder::registrar);
                expiry(body).ifPresent(builder::expiry);
                return builder.build();
            }
        }

        return LookupResult.unknown(domain, "Unable to classify WHOIS response: " + domain);
    }

    /**
     * Returns the value of the first line starting with {@code label:}, ignoring case
     * and leading whitespace.
     */
    public static Optional<String> field(String body, String label) {
        String prefix = label.toLowerCase(Locale.ROOT) + ":";
        for (String line : body.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.toLowerCase(Locale.ROOT).startsWith(prefix)) {
                String value = trimmed.substring(trimmed.indexOf(':') + 1).trim();
                return value.isEmpty() ? Optional.empty() : Optional.of(value);
            }
        }
        return Optional.empty();
    }

    static Optional<Instant> expiry(String body) {
        for (String label : EXPIRY_FIELDS) {
            Optional<Instant> parsed = field(body, label).flatMap(WhoisResponseParser::parseDate);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    /**
     * Parses a WHOIS date with the first accepted format that matches.
     * Date-only values resolve to midnight UTC.
     */
    public static Optional<Instant> parseDate(String value) {
        String trimmed = value.trim();
        for (DateFormat format : DATE_FORMATS) {
            Optional<Instant> parsed = format.tryParse(trimmed);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private static Instant startOfDay(TemporalAccessor parsed) {
        return LocalDate.from(parsed).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    private record DateFormat(DateTimeFormatter formatter, Function<TemporalAccessor, Instant> toInstant) {

        Optional<Instant> tryParse(String value) {
            try {
                return Optional.of(toInstant.apply(formatter.parse(value)));
            } catch (DateTimeException e) {
                return Optional.empty();
            }
        }
    }
}
