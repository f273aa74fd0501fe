package uk.gegc.courseblocks.shared.exception;

/**
 * Exception thrown when a definition file cannot be written during export.
 */
public class ContentExportException extends RuntimeException {

    public ContentExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
