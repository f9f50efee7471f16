package com.archivedata.exception;

/**
 * Thrown when a user-supplied or persisted bound cannot be parsed.
 */
public class InvalidBoundFormatException extends ArchiveException {

    private static final long serialVersionUID = 1L;

    public InvalidBoundFormatException(String value, String expected) {
        super("Invalid bound '" + value + "', expected " + expected);
    }

    public InvalidBoundFormatException(String value, String expected, Throwable cause) {
        super("Invalid bound '" + value + "', expected " + expected, cause);
    }
}
