package uk.gegc.courseblocks.shared.exception;

/**
 * Exception thrown when a block definition is structurally unusable, e.g. a poll without answers.
 */
public class InvalidDefinitionException extends RuntimeException {

    public InvalidDefinitionException(String message) {
        super(message);
    }

    public InvalidDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
