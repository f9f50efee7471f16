package com.archivedata.exception;

/**
 * Root of the errors raised by bound discovery, partitioning and export.
 */
public class ArchiveException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ArchiveException(String message) {
        super(message);
    }

    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
