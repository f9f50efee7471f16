package com.archivedata.bound;

import com.archivedata.exception.InvalidBoundFormatException;

/**
 * Integral numeric fields ({@code long}, {@code integer}, {@code short}, {@code byte}).
 */
public class LongBoundType implements BoundType<Long> {

    public static final LongBoundType INSTANCE = new LongBoundType();

    @Override
    public Long parse(String text) {
        if (text == null) {
            throw new InvalidBoundFormatException("null", describeFormat());
        }
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new InvalidBoundFormatException(text, describeFormat(), e);
        }
    }

    @Override
    public String format(Long value) {
        return Long.toString(value);
    }

    @Override
    public Long fromSortValue(Object raw) {
        if (raw instanceof Number) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof String) {
            return parse((String) raw);
        }
        throw new InvalidBoundFormatException(String.valueOf(raw), describeFormat());
    }

    @Override
    public Long bisect(Long lower, Long upper) {
        // floor of the mean without overflowing
        return (lower >> 1) + (upper >> 1) + (lower & upper & 1);
    }

    @Override
    public int compare(Long a, Long b) {
        return Long.compare(a, b);
    }

    @Override
    public String queryFormat() {
        return null;
    }

    @Override
    public String describeFormat() {
        return "a decimal integer";
    }
}
