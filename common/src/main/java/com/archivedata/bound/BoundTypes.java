package com.archivedata.bound;

import com.archivedata.exception.UnsupportedFieldException;
import com.archivedata.search.FieldDescriptor;

import java.util.List;
import java.util.Map;

/**
 * Maps backend field types to the {@link BoundType} that partitions them.
 */
public final class BoundTypes {

    private static final Map<String, BoundType<?>> BY_FIELD_TYPE = Map.of(
            "date", DateBoundType.INSTANCE,
            "long", LongBoundType.INSTANCE,
            "integer", LongBoundType.INSTANCE,
            "short", LongBoundType.INSTANCE,
            "byte", LongBoundType.INSTANCE);

    private BoundTypes() {
        // utility class
    }

    /** Backend field types that can be partitioned. */
    public static List<String> supportedFieldTypes() {
        return List.of("date", "long", "integer", "short", "byte");
    }

    /**
     * Validates that the field can drive partitioning and returns its bound type.
     *
     * @param fieldName  the requested field, for error messages
     * @param descriptor the backend's description, or {@code null} if the field does not exist
     */
    public static BoundType<?> forField(String fieldName, FieldDescriptor descriptor) {
        if (descriptor == null) {
            throw new UnsupportedFieldException("Could not find field '" + fieldName + "'");
        }
        if (!descriptor.isFilterable() || !descriptor.isSortable()) {
            throw new UnsupportedFieldException("Field '" + fieldName + "' must be sortable and filterable");
        }
        return forType(fieldName, descriptor.getType());
    }

    /**
     * Returns the bound type of a backend field type, as recorded in a partition file.
     */
    public static BoundType<?> forType(String fieldName, String fieldType) {
        BoundType<?> type = fieldType == null ? null : BY_FIELD_TYPE.get(fieldType);
        if (type == null) {
            throw new UnsupportedFieldException("Field '" + fieldName + "' is of type " + fieldType
                    + ", supported types " + String.join(", ", supportedFieldTypes()));
        }
        return type;
    }
}
