package villagecompute.reports.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.function.Function;

import org.jboss.logging.Logger;

/**
 * Canonical text encoding for persisted timestamps.
 *
 * <p>
 * Timestamps are written as UTC {@code yyyy-MM-dd HH:mm:ss}. Reads accept, in order:
 * <ol>
 * <li>the canonical form</li>
 * <li>{@code yyyy-MM-dd HH:mm:ss +hhmm ZONE} (older rows written with a zone abbreviation)</li>
 * <li>{@code yyyy-MM-dd HH:mm:ss +hhmm}</li>
 * <li>ISO-8601 / RFC 3339 with offset</li>
 * </ol>
 * Text matching none of them is logged and read as absent.
 */
public final class TimestampFormats {

    private static final Logger LOG = Logger.getLogger(TimestampFormats.class);

    public static final DateTimeFormatter CANONICAL = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final DateTimeFormatter WITH_OFFSET = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss").optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd().appendPattern(" Z").toFormatter();

    private static final List<Function<String, Instant>> PARSERS = List.of(
            text -> LocalDateTime.parse(text, CANONICAL).toInstant(ZoneOffset.UTC),
            text -> parseWithOffset(stripZoneName(text)), TimestampFormats::parseWithOffset,
            text -> OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant());

    private TimestampFormats() {
    }

    /**
     * Formats an instant as canonical UTC text, truncated to seconds.
     *
     * @return canonical text, or {@code null} for a null instant
     */
    public static String format(Instant instant) {
        if (instant == null) {
            return null;
        }
        return CANONICAL.format(instant.truncatedTo(ChronoUnit.SECONDS).atOffset(ZoneOffset.UTC));
    }

    /**
     * Parses persisted timestamp text leniently.
     *
     * @return the instant, or {@code null} when the text is blank or matches no accepted layout
     */
    public static Instant parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String trimmed = text.trim();
        for (Function<String, Instant> parser : PARSERS) {
            try {
                return parser.apply(trimmed);
            } catch (DateTimeParseException e) {
                // next layout
            }
        }
        LOG.warnf("Unparseable timestamp '%s', treating as absent", text);
        return null;
    }

    private static Instant parseWithOffset(String text) {
        return OffsetDateTime.parse(text, WITH_OFFSET).toInstant();
    }

    /** Drops a trailing zone abbreviation such as {@code UTC} or {@code EST}. */
    private static String stripZoneName(String text) {
        int lastSpace = text.lastIndexOf(' ');
        if (lastSpace < 0) {
            throw new DateTimeParseException("no zone name", text, 0);
        }
        String suffix = text.substring(lastSpace + 1);
        if (suffix.isEmpty() || !Character.isLetter(suffix.charAt(0))) {
            throw new DateTimeParseException("no zone name", text, lastSpace);
        }
        return text.substring(0, lastSpace);
    }
}
