package com.archivedata.search;

/**
 * Sort direction of a page query on the ordering field.
 */
public enum SortDirection {
    ASC,
    DESC
}
