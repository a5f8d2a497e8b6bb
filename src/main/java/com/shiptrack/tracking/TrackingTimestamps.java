package com.shiptrack.tracking;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;

/**
 * Lenient parsing of provider date strings. Shippo sends ISO-8601 but not
 * always with an offset; values without one are taken as UTC.
 */
@Slf4j
public final class TrackingTimestamps {

    private static final List<Function<String, Instant>> PARSERS = List.of(
        value -> OffsetDateTime.parse(value).toInstant(),
        value -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC),
        value -> LocalDate.parse(value).atStartOfDay().toInstant(ZoneOffset.UTC)
    );

    private TrackingTimestamps() {
    }

    /**
     * @return the parsed instant, or null for blank or unparseable input
     */
    public static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (Function<String, Instant> parser : PARSERS) {
            try {
                return parser.apply(value.trim());
            } catch (DateTimeParseException e) {
                log.trace("Date {} did not match: {}", value, e.getMessage());
            }
        }
        log.warn("Unparseable provider date: {}", value);
        return null;
    }
}
