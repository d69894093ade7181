package com.egressoptimizer.ingestion;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Best-effort timestamp parsing for collected metric series.
 *
 * Accepted forms, tried in order:
 * - ISO instants ({@code 2024-01-15T10:00:00Z})
 * - offset date-times ({@code 2024-01-15T10:00:00+02:00})
 * - local date-times, read as UTC, with {@code T} or a space separator
 * - dates, read as midnight UTC
 * - epoch seconds, or epoch milliseconds above 10^11
 *
 * Anything else, including epoch values outside the {@link Instant} range, yields empty.
 */
public final class TimestampParser {

    private static final long EPOCH_MILLIS_CUTOFF = 100_000_000_000L;

    private static final DateTimeFormatter SPACE_SEPARATED = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral(' ')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .toFormatter();

    private static final List<Function<String, Instant>> PARSERS = List.of(
            Instant::parse,
            text -> OffsetDateTime.parse(text).toInstant(),
            text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
            text -> LocalDateTime.parse(text, SPACE_SEPARATED).toInstant(ZoneOffset.UTC),
            text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    private TimestampParser() {
        // Utility class
    }

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

        try {
            long epoch = Long.parseLong(trimmed);
            return Optional.of(epoch >= EPOCH_MILLIS_CUTOFF
                    ? Instant.ofEpochMilli(epoch)
                    : Instant.ofEpochSecond(epoch));
        } catch (NumberFormatException | DateTimeException e) {
            return Optional.empty();
        }
    }

    private static Instant tryParse(Function<String, Instant> parser, String text) {
        try {
            return parser.apply(text);
        } catch (DateTimeException e) {
            return null;
        }
    }
}
