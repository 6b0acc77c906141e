package org.dubbl.archive;

/**
 * Raised when the game archive cannot be opened, written or read.
 */
public class ArchiveException extends RuntimeException {

    public ArchiveException(String message) {
        super(message);
    }

    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
