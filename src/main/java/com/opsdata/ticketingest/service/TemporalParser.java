package com.opsdata.ticketingest.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses export timestamps and duration strings. Nothing here throws on bad input; an
 * unparseable value comes back as {@link Optional#empty()}.
 */
@Component
public class TemporalParser {

    private static final Logger logger = LoggerFactory.getLogger(TemporalParser.class);

    // Remedy export format, e.g. "08/18/2025, 07:11:50 PM"
    private static final DateTimeFormatter SOURCE_FORMAT = localFormat("M/d/uuuu, h:mm:ss a");

    private static final List<DateTimeFormatter> FALLBACK_DATE_TIME_FORMATS = List.of(
            localFormat("M/d/uuuu h:mm:ss a"),
            localFormat("M/d/uuuu, h:mm a"),
            localFormat("M/d/uuuu h:mm a"),
            localFormat("M/d/uuuu H:mm:ss"),
            localFormat("M/d/uuuu H:mm"),
            localFormat("uuuu-MM-dd HH:mm:ss"),
            DateTimeFormatter.ISO_LOCAL_DATE_TIME
    );

    private static final List<DateTimeFormatter> FALLBACK_DATE_FORMATS = List.of(
            localFormat("M/d/uuuu"),
            DateTimeFormatter.ISO_LOCAL_DATE
    );

    private static final DateTimeFormatter OFFSET_SPACE_FORMAT = localFormat("uuuu-MM-dd HH:mm:ssXXX");

    private static final Pattern HOURS_MINUTES_SECONDS = Pattern.compile("^(\\d+):(\\d+):(\\d+)$");
    private static final Pattern MINUTES_SECONDS = Pattern.compile("^(\\d+):(\\d+)$");
    private static final Pattern BARE_SECONDS = Pattern.compile("^\\d+$");

    private static final BigDecimal SECONDS_PER_MINUTE = BigDecimal.valueOf(60);

    private final ZoneId sourceZone;

    public TemporalParser(@Value("${app.ingestion.source-timezone:UTC}") String sourceTimezone) {
        this.sourceZone = ZoneId.of(sourceTimezone);
    }

    private static DateTimeFormatter localFormat(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.US)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * Interprets {@code raw} in the source system's format first, then in the fallback formats.
     * Values without an offset are taken to be in the configured source timezone.
     */
    public Optional<OffsetDateTime> parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();

        Optional<LocalDateTime> local = tryLocalDateTime(value, SOURCE_FORMAT);
        if (local.isPresent()) {
            return Optional.of(local.get().atZone(sourceZone).toOffsetDateTime());
        }
        for (DateTimeFormatter format : FALLBACK_DATE_TIME_FORMATS) {
            local = tryLocalDateTime(value, format);
            if (local.isPresent()) {
                return Optional.of(local.get().atZone(sourceZone).toOffsetDateTime());
            }
        }
        for (DateTimeFormatter format : List.of(DateTimeFormatter.ISO_OFFSET_DATE_TIME, OFFSET_SPACE_FORMAT)) {
            try {
                return Optional.of(OffsetDateTime.parse(value, format));
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        for (DateTimeFormatter format : FALLBACK_DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(value, format).atStartOfDay(sourceZone).toOffsetDateTime());
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        logger.debug("Unrecognized timestamp '{}', storing as absent.", value);
        return Optional.empty();
    }

    private Optional<LocalDateTime> tryLocalDateTime(String value, DateTimeFormatter format) {
        try {
            return Optional.of(LocalDateTime.parse(value, format));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Converts {@code HH:MM:SS}, {@code MM:SS} or a bare number of seconds into seconds.
     * Hours must be 0-23 and minutes/seconds 0-59.
     */
    public Optional<Integer> parseDurationSeconds(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        try {
            Matcher hms = HOURS_MINUTES_SECONDS.matcher(value);
            if (hms.matches()) {
                int hours = Integer.parseInt(hms.group(1));
                int minutes = Integer.parseInt(hms.group(2));
                int seconds = Integer.parseInt(hms.group(3));
                if (hours > 23 || minutes > 59 || seconds > 59) {
                    return Optional.empty();
                }
                return Optional.of(hours * 3600 + minutes * 60 + seconds);
            }
            Matcher ms = MINUTES_SECONDS.matcher(value);
            if (ms.matches()) {
                int minutes = Integer.parseInt(ms.group(1));
                int seconds = Integer.parseInt(ms.group(2));
                if (minutes > 59 || seconds > 59) {
                    return Optional.empty();
                }
                return Optional.of(minutes * 60 + seconds);
            }
            if (BARE_SECONDS.matcher(value).matches()) {
                return Optional.of(Integer.parseInt(value));
            }
        } catch (NumberFormatException e) {
            logger.debug("Duration '{}' out of integer range.", value);
        }
        return Optional.empty();
    }

    /**
     * {@link #parseDurationSeconds(String)} in minutes, rounded half-up to two decimals.
     */
    public Optional<BigDecimal> parseDurationMinutes(String raw) {
        return parseDurationSeconds(raw)
                .map(seconds -> BigDecimal.valueOf(seconds).divide(SECONDS_PER_MINUTE, 2, RoundingMode.HALF_UP));
    }
}
