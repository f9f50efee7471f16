package com.archivedata.search;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What the backend reports about a single field of the index.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FieldDescriptor {

    private String name;

    /** Backend type name, e.g. {@code date} or {@code long}. */
    private String type;

    private boolean filterable;
    private boolean sortable;
}
