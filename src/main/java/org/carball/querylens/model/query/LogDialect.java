package org.carball.querylens.model.query;

import lombok.Getter;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;

/**
 * The log formats the parser understands, with the timestamp layout each one writes.
 */
@Getter
public enum LogDialect {

    POSTGRES("PostgreSQL", '.'),
    SQLALCHEMY("SQLAlchemy", ',');

    private final String displayName;
    private final DateTimeFormatter timestampFormatter;

    LogDialect(String displayName, char fractionSeparator) {
        this.displayName = displayName;
        this.timestampFormatter = new DateTimeFormatterBuilder()
                .appendPattern("yyyy-MM-dd HH:mm:ss")
                .appendLiteral(fractionSeparator)
                .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, false)
                .toFormatter();
    }

    /**
     * Parses a timestamp as written by this dialect.
     *
     * @throws java.time.format.DateTimeParseException when the text is not a valid timestamp
     */
    public LocalDateTime parseTimestamp(String text) {
        return LocalDateTime.parse(text, timestampFormatter);
    }
}
