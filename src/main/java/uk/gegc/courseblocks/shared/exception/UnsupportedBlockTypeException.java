package uk.gegc.courseblocks.shared.exception;

/**
 * Exception thrown when no handler is registered for an OLX tag.
 */
public class UnsupportedBlockTypeException extends RuntimeException {

    public UnsupportedBlockTypeException(String message) {
        super(message);
    }
}
