package com.libragraph.plotstore.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * ISO-8601 timestamps as stored in the metadata document.
 *
 * <p>New values are written with an explicit {@code Z}. Older documents carry local
 * date-times without an offset ({@code 2025-01-01T00:00:00.123456}); those are read as UTC.
 */
public final class UtcTimestamps {

    private static final List<Function<String, Instant>> PARSERS = List.of(
            text -> OffsetDateTime.parse(text).toInstant(),
            text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC)
    );

    private UtcTimestamps() {
    }

    public static String format(Instant instant) {
        return instant.toString();
    }

    /**
     * Parses a stored timestamp. Returns empty for null, blank or unparsable input.
     */
    public static Optional<Instant> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        for (Function<String, Instant> parser : PARSERS) {
            Instant parsed = tryParse(parser, trimmed);
            if (parsed != null) {
                return Optional.of(parsed);
            }
        }
        return Optional.empty();
    }

    private static Instant tryParse(Function<String, Instant> parser, String text) {
        try {
            return parser.apply(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
