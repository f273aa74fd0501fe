package uk.gegc.courseblocks.features.olx.domain.model;

/**
 * Storage scope of a block field. Only {@link #SETTINGS} fields are written as XML attributes on export.
 */
public enum FieldScope {
    CONTENT,
    SETTINGS,
    CHILDREN,
    USER_STATE,
    USER_STATE_SUMMARY
}
