package villagecompute.reports.util;

import java.time.Instant;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Maps {@link Instant} entity fields to the canonical UTC text column layout described in {@link TimestampFormats}.
 */
@Converter
public class UtcTimestampConverter implements AttributeConverter<Instant, String> {

    @Override
    public String convertToDatabaseColumn(Instant attribute) {
        return TimestampFormats.format(attribute);
    }

    @Override
    public Instant convertToEntityAttribute(String dbData) {
        return TimestampFormats.parse(dbData);
    }
}
