package com.archivedata.bound;

import java.util.Comparator;

/**
 * A totally ordered, bisectable type of ordering field.
 *
 * <p>This is the only place that knows how values of a field type are written, read and split,
 * so new field types can be supported without touching partitioning or export.</p>
 *
 * @param <T> the Java representation of a field value
 */
public interface BoundType<T> extends Comparator<T> {

    /**
     * Parses the canonical text form.
     *
     * @throws com.archivedata.exception.InvalidBoundFormatException if the text is malformed
     */
    T parse(String text);

    /** Writes the canonical text form, accepted by {@link #parse(String)} and by range queries. */
    String format(T value);

    /**
     * Converts the sort value the backend reports for a hit sorted on the field.  Sort values
     * are independent of how the document was indexed; dates come back as epoch milliseconds.
     *
     * @throws com.archivedata.exception.InvalidBoundFormatException if the value cannot be converted
     */
    T fromSortValue(Object raw);

    /**
     * Returns a value between {@code lower} and {@code upper}, rounded towards {@code lower}.
     * When the two are adjacent or equal the result equals {@code lower}.
     */
    T bisect(T lower, T upper);

    /**
     * Format hint sent with range queries so the backend reads bounds in canonical form
     * whatever the field's mapping format, or {@code null} when none is needed.
     */
    String queryFormat();

    /** Human readable description of the canonical form, used in error messages. */
    String describeFormat();
}
