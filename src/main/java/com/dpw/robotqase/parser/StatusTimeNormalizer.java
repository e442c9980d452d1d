package com.dpw.robotqase.parser;

import com.dpw.robotqase.exception.ReportParseException;
import com.dpw.robotqase.exception.ReportParseException.Reason;
import com.dpw.robotqase.model.SchemaVersion;
import com.dpw.robotqase.model.StatusTiming;
import com.dpw.robotqase.model.TestStatus;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;

/**
 * Decodes the {@code <status>} element of a test record into status, start time and duration.
 *
 * <p>Two timing conventions exist. Reports written by Robot Framework 7 and later carry
 * {@code start="2024-01-01T10:00:00.123456"} and {@code elapsed="1.500000"}; older reports carry
 * {@code starttime="20240101 10:00:00.123"} and {@code endtime}. The convention is picked per
 * element from the presence of {@code start}, so a report mixing both still decodes.
 */
@Component
public class StatusTimeNormalizer {

    static final String STATUS = "status";
    static final String START = "start";
    static final String ELAPSED = "elapsed";
    static final String START_TIME = "starttime";
    static final String END_TIME = "endtime";

    static final DateTimeFormatter LEGACY_TIME_FORMAT = new DateTimeFormatterBuilder()
            .appendValue(ChronoField.YEAR, 4)
            .appendValue(ChronoField.MONTH_OF_YEAR, 2)
            .appendValue(ChronoField.DAY_OF_MONTH, 2)
            .appendLiteral(' ')
            .appendPattern("HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .toFormatter();

    static final DateTimeFormatter CURRENT_TIME_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral('T')
            .appendPattern("HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .toFormatter();

    public StatusTiming normalize(Element statusElement) {
        TestStatus status = decodeStatus(statusElement);
        SchemaVersion version = detectVersion(statusElement);
        LocalDateTime startTime = decodeStartTime(statusElement, version);
        long durationMs = decodeDurationMs(statusElement, version, startTime);
        return new StatusTiming(status, startTime, durationMs, version);
    }

    public TestStatus decodeStatus(Element statusElement) {
        String statusText = statusElement.attr(STATUS);
        if (statusText.isEmpty()) {
            throw new ReportParseException(Reason.MISSING_STATUS_ATTRIBUTE, "Cannot find status attribute");
        }
        return TestStatus.fromRobotStatus(statusText);
    }

    public SchemaVersion detectVersion(Element statusElement) {
        return statusElement.attr(START).isEmpty() ? SchemaVersion.LEGACY : SchemaVersion.CURRENT;
    }

    public LocalDateTime decodeStartTime(Element statusElement, SchemaVersion version) {
        if (version == SchemaVersion.CURRENT) {
            return parseTime(START, statusElement.attr(START), CURRENT_TIME_FORMAT);
        }

        String startTimeText = statusElement.attr(START_TIME);
        if (startTimeText.isEmpty()) {
            throw new ReportParseException(Reason.MISSING_START_TIME, "Cannot find starttime attribute");
        }
        return parseTime(START_TIME, startTimeText, LEGACY_TIME_FORMAT);
    }

    public long decodeDurationMs(Element statusElement, SchemaVersion version, LocalDateTime startTime) {
        switch (version) {
            case CURRENT:
                return elapsedMillis(statusElement);
            case LEGACY:
                return legacyMillis(statusElement, startTime);
            default:
                throw new IllegalArgumentException("Unsupported schema version " + version);
        }
    }

    private long elapsedMillis(Element statusElement) {
        String elapsedText = statusElement.attr(ELAPSED);
        if (elapsedText.isEmpty()) {
            throw new ReportParseException(Reason.MISSING_ELAPSED, "Cannot find elapsed attribute");
        }
        try {
            // seconds to millis, fraction below a millisecond is dropped
            BigDecimal seconds = new BigDecimal(elapsedText.trim());
            // integer digits of the millisecond value, checked before any rescaling of an extreme exponent
            long integerDigits = (long) seconds.precision() - seconds.scale() + 3;
            if (integerDigits <= 0) {
                return 0L;
            }
            if (integerDigits > 19) {
                throw new ArithmeticException("Elapsed time out of range");
            }
            return seconds.movePointRight(3).setScale(0, RoundingMode.DOWN).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw ReportParseException.timeParseError(ELAPSED, elapsedText, e);
        }
    }

    private long legacyMillis(Element statusElement, LocalDateTime startTime) {
        String endTimeText = statusElement.attr(END_TIME);
        if (endTimeText.isEmpty()) {
            throw new ReportParseException(Reason.MISSING_END_TIME, "Cannot find endtime attribute");
        }
        LocalDateTime endTime = parseTime(END_TIME, endTimeText, LEGACY_TIME_FORMAT);
        return Duration.between(startTime, endTime).toMillis();
    }

    private LocalDateTime parseTime(String attribute, String text, DateTimeFormatter format) {
        try {
            return LocalDateTime.parse(text.trim(), format);
        } catch (DateTimeParseException e) {
            throw ReportParseException.timeParseError(attribute, text, e);
        }
    }
}
