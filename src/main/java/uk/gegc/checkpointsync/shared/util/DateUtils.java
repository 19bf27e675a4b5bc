package uk.gegc.checkpointsync.shared.util;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Wall-clock access for timestamp generation, backed by the application {@link Clock}.
 * <p>
 * {@link #nowIso()} never hands out the same instant twice: when the clock has not advanced
 * since the previous call (coarse clock, fixed test clock) the result moves one microsecond
 * past the last value issued.
 */
@Component
public class DateUtils {

    private final Clock clock;
    private final AtomicReference<Instant> lastIssued = new AtomicReference<>(Instant.EPOCH);

    public DateUtils(Clock clock) {
        this.clock = clock;
    }

    public Instant now() {
        return clock.instant();
    }

    public long currentTimeMillis() {
        return clock.millis();
    }

    /**
     * Current time as an ISO-8601 UTC string, strictly later than any value previously returned.
     */
    public String nowIso() {
        Instant issued = lastIssued.updateAndGet(previous -> {
            Instant current = clock.instant().truncatedTo(ChronoUnit.MICROS);
            return current.isAfter(previous) ? current : previous.plus(1, ChronoUnit.MICROS);
        });
        return DateTimeFormatter.ISO_INSTANT.format(issued);
    }

    /**
     * True when {@code value} is an ISO-8601 date-time, with or without an offset.
     */
    public static boolean isIsoTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        try {
            DateTimeFormatter.ISO_DATE_TIME.parse(value.trim());
            return true;
        } catch (DateTimeParseException ex) {
            return false;
        }
    }

    /**
     * Reads {@code value} as a timestamp: ISO-8601 date-times are returned trimmed, plain ISO
     * dates become midnight UTC, anything else is empty.
     */
    public static Optional<String> toIsoTimestamp(String value) {
        if (isIsoTimestamp(value)) {
            return Optional.of(value.trim());
        }
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            LocalDate date = LocalDate.parse(value.trim());
            return Optional.of(date + "T00:00:00Z");
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }
}
