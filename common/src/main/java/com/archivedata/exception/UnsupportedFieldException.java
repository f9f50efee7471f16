package com.archivedata.exception;

/**
 * Thrown when the ordering field is missing, not filterable/sortable, or of a type that
 * cannot be range-partitioned.
 */
public class UnsupportedFieldException extends ArchiveException {

    private static final long serialVersionUID = 1L;

    public UnsupportedFieldException(String message) {
        super(message);
    }
}
