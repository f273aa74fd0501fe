package uk.gegc.courseblocks.shared.exception;

public class FieldSerializationException extends RuntimeException {

    public FieldSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
