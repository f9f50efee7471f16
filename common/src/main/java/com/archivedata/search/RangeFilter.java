package com.archivedata.search;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A filter on the ordering field: {@code lowerBound <= field < upperBound}, or
 * {@code <= upperBound} when {@link #upperInclusive} is set.  A {@code null} bound leaves
 * that side open; {@link #all(String)} matches every document.
 *
 * <p>Bounds are carried in their canonical text form so that the filter can be rebuilt from a
 * partition file without knowing the field's Java type.</p>
 */
@Data
@AllArgsConstructor
public class RangeFilter {

    private final String field;
    private final String lowerBound;
    private final String upperBound;
    private final boolean upperInclusive;

    /** Format the bounds are written in, or {@code null} to read them with the field's mapping format. */
    private final String format;

    public RangeFilter(String field, String lowerBound, String upperBound, boolean upperInclusive) {
        this(field, lowerBound, upperBound, upperInclusive, null);
    }

    /** Matches every document of the index. */
    public static RangeFilter all(String field) {
        return new RangeFilter(field, null, null, false);
    }

    /** {@code lowerBound <= field < upperBound}. */
    public static RangeFilter halfOpen(String field, String lowerBound, String upperBound) {
        return new RangeFilter(field, lowerBound, upperBound, false);
    }

    /** {@code lowerBound <= field <= upperBound}. */
    public static RangeFilter closed(String field, String lowerBound, String upperBound) {
        return new RangeFilter(field, lowerBound, upperBound, true);
    }

    /** The same range with its bounds read in the given format. */
    public RangeFilter withFormat(String format) {
        return new RangeFilter(field, lowerBound, upperBound, upperInclusive, format);
    }

    public boolean isUnbounded() {
        return lowerBound == null && upperBound == null;
    }

    /**
     * Renders the filter as an Elasticsearch query body.
     */
    public Map<String, Object> toQuery() {
        if (isUnbounded()) {
            return Map.of("match_all", Map.of());
        }
        Map<String, Object> range = new LinkedHashMap<>();
        if (lowerBound != null) {
            range.put("gte", lowerBound);
        }
        if (upperBound != null) {
            range.put(upperInclusive ? "lte" : "lt", upperBound);
        }
        if (format != null) {
            range.put("format", format);
        }
        return Map.of("range", Map.of(field, range));
    }

    @Override
    public String toString() {
        if (isUnbounded()) {
            return field + ":*";
        }
        return field + ":[" + (lowerBound == null ? "*" : lowerBound) + ", "
                + (upperBound == null ? "*" : upperBound) + (upperInclusive ? "]" : ")");
    }
}
