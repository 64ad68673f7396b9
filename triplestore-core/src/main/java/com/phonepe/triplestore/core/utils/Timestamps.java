package com.phonepe.triplestore.core.utils;

import com.google.common.base.Strings;
import com.phonepe.triplestore.core.errors.ValidationError;
import lombok.experimental.UtilityClass;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Conversions between {@link Instant} and the fixed-width UTC strings used wherever timestamps are persisted or
 * compared as text.
 * <p>
 * Every rendered value has the same width and the same zone, so lexicographic order of the strings is chronological
 * order of the instants. Only years 0000 to 9999 can be represented that way; anything else is rejected.
 */
@UtilityClass
public class Timestamps {
    private static final DateTimeFormatter SORTABLE = DateTimeFormatter
            .ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSSSS'Z'")
            .withZone(ZoneOffset.UTC);

    private static final Instant MIN = Instant.parse("0000-01-01T00:00:00Z");
    private static final Instant MAX = Instant.parse("9999-12-31T23:59:59.999999999Z");

    /**
     * Current time in UTC, truncated to milliseconds
     */
    public static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    /**
     * Parses ISO-8601 / RFC-3339 input. Accepts an explicit offset ({@code Z}, {@code +02:00}), a local date-time or a
     * bare date; the latter two are read as UTC.
     *
     * @param value text to parse
     * @return the instant, never null
     * @throws ValidationError if the value is blank, unparseable or outside the representable range
     */
    public static Instant parse(final String value) {
        if (Strings.isNullOrEmpty(value) || value.isBlank()) {
            throw new ValidationError("timestamp must not be blank");
        }
        final var text = value.trim();
        Instant parsed;
        try {
            parsed = OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        }
        catch (DateTimeParseException offsetFailure) {
            try {
                parsed = LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC);
            }
            catch (DateTimeParseException localFailure) {
                try {
                    parsed = LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE)
                            .atStartOfDay()
                            .toInstant(ZoneOffset.UTC);
                }
                catch (DateTimeParseException dateFailure) {
                    throw new ValidationError("'%s' is not an ISO-8601 timestamp".formatted(text), offsetFailure);
                }
            }
        }
        return requireRepresentable(parsed);
    }

    /**
     * Renders an instant in the fixed-width sortable form, e.g. {@code 2026-01-01T00:00:00.000000000Z}
     */
    public static String format(final Instant instant) {
        return SORTABLE.format(requireRepresentable(instant));
    }

    /**
     * @return the same instant if it can be rendered in the sortable form
     * @throws ValidationError otherwise
     */
    public static Instant requireRepresentable(final Instant instant) {
        if (instant.isBefore(MIN) || instant.isAfter(MAX)) {
            throw new ValidationError("timestamp %s is outside the supported range 0000-9999".formatted(instant));
        }
        return instant;
    }
}
