package uk.gegc.courseblocks.shared.exception;

import lombok.Getter;

/**
 * Thrown when a file referenced from OLX cannot be read or parsed. Fatal to the import of that node.
 */
@Getter
public class UnresolvedContentReferenceException extends RuntimeException {

    private final String path;
    private final String definitionId;

    public UnresolvedContentReferenceException(String path, String definitionId, Throwable cause) {
        super(String.format("Unable to load file contents at path %s for item %s: %s",
                path, definitionId, cause != null ? cause.getMessage() : "unknown error"), cause);
        this.path = path;
        this.definitionId = definitionId;
    }
}
