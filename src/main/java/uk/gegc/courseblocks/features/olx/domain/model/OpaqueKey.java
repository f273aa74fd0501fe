package uk.gegc.courseblocks.features.olx.domain.model;

/**
 * Marker for identifier types whose canonical form is their {@link #toString()}.
 * JSON encoding of field values writes such keys as plain strings.
 */
public interface OpaqueKey {
}
