package com.archivedata.exception;

/**
 * Thrown when bound discovery finds no document carrying a value for the ordering field.
 */
public class EmptyCollectionException extends ArchiveException {

    private static final long serialVersionUID = 1L;

    public EmptyCollectionException(String fieldName) {
        super("No documents with a value for field '" + fieldName + "'");
    }
}
