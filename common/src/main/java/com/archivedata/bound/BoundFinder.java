package com.archivedata.bound;

import com.archivedata.exception.EmptyCollectionException;
import com.archivedata.search.SearchBackend;
import com.archivedata.search.SortDirection;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Finds the smallest and largest value of the ordering field currently in the index by asking
 * for the single top document sorted ascending, then descending.  Read-only; one round-trip
 * per bound.
 *
 * <p>The bound is taken from the hit's sort value rather than its source, so it does not
 * depend on the format the field was indexed in.</p>
 */
@Slf4j
public class BoundFinder {

    private final SearchBackend backend;

    public BoundFinder(SearchBackend backend) {
        this.backend = backend;
    }

    public <T> T findLowerBound(String fieldName, BoundType<T> type) throws IOException {
        return findBound(fieldName, type, SortDirection.ASC);
    }

    public <T> T findUpperBound(String fieldName, BoundType<T> type) throws IOException {
        return findBound(fieldName, type, SortDirection.DESC);
    }

    /**
     * Validates the field and returns both bounds in canonical text form.
     */
    public Bounds findBounds(String fieldName) throws IOException {
        BoundType<?> type = BoundTypes.forField(fieldName, backend.describeField(fieldName));
        return findBounds(fieldName, type);
    }

    private <T> Bounds findBounds(String fieldName, BoundType<T> type) throws IOException {
        String lower = type.format(findLowerBound(fieldName, type));
        String upper = type.format(findUpperBound(fieldName, type));
        log.info("Bounds of {}.{}: [{}, {}]", backend.getIndexName(), fieldName, lower, upper);
        return new Bounds(lower, upper);
    }

    private <T> T findBound(String fieldName, BoundType<T> type, SortDirection direction)
            throws IOException {
        Object sortValue = backend.firstSortValue(fieldName, direction);
        if (sortValue == null) {
            throw new EmptyCollectionException(fieldName);
        }
        T value = type.fromSortValue(sortValue);
        log.debug("{} bound of {}: {}", direction == SortDirection.ASC ? "Lower" : "Upper",
                fieldName, type.format(value));
        return value;
    }
}
