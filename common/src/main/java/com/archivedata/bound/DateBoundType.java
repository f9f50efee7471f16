package com.archivedata.bound;

import com.archivedata.exception.InvalidBoundFormatException;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.util.regex.Pattern;

/**
 * Elasticsearch {@code date} fields.  Values are kept at millisecond precision, the resolution
 * of the field type, and written as ISO-8601 UTC ({@code 2024-01-01T00:00:00.000Z}).
 *
 * <p>Parsing also accepts a bare date or a date-time without offset, both read as UTC.
 * Bounds discovered from the index come from sort values, which are epoch milliseconds
 * whatever the field's mapping format.</p>
 */
public class DateBoundType implements BoundType<Instant> {

    public static final DateBoundType INSTANCE = new DateBoundType();

    /** Accepts the canonical form as well as epoch milliseconds. */
    public static final String QUERY_FORMAT = "strict_date_optional_time||epoch_millis";

    private static final DateTimeFormatter CANONICAL =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSX").withZone(ZoneOffset.UTC);

    private static final Pattern EPOCH_MILLIS = Pattern.compile("-?\\d+");

    private static final DateTimeFormatter INPUT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalEnd()
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
            .parseDefaulting(ChronoField.OFFSET_SECONDS, 0)
            .toFormatter();

    @Override
    public Instant parse(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidBoundFormatException(String.valueOf(text), describeFormat());
        }
        try {
            return INPUT.parse(text.trim(), Instant::from)
                    .truncatedTo(ChronoUnit.MILLIS);
        } catch (DateTimeParseException e) {
            throw new InvalidBoundFormatException(text, describeFormat(), e);
        }
    }

    @Override
    public String format(Instant value) {
        return CANONICAL.format(value);
    }

    @Override
    public Instant fromSortValue(Object raw) {
        if (raw instanceof Number) {
            return Instant.ofEpochMilli(((Number) raw).longValue());
        }
        if (raw instanceof String) {
            String text = ((String) raw).trim();
            if (EPOCH_MILLIS.matcher(text).matches()) {
                return Instant.ofEpochMilli(Long.parseLong(text));
            }
            return parse(text);
        }
        throw new InvalidBoundFormatException(String.valueOf(raw), describeFormat());
    }

    @Override
    public Instant bisect(Instant lower, Instant upper) {
        long lo = lower.toEpochMilli();
        long hi = upper.toEpochMilli();
        return Instant.ofEpochMilli(lo + (hi - lo) / 2);
    }

    @Override
    public int compare(Instant a, Instant b) {
        return a.compareTo(b);
    }

    @Override
    public String queryFormat() {
        return QUERY_FORMAT;
    }

    @Override
    public String describeFormat() {
        return "an ISO-8601 date or date-time, e.g. 2024-01-01T00:00:00.000Z";
    }
}
