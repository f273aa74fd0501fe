package uk.gegc.courseblocks.features.olx.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Where a definition was read from: the path actually resolved and the name declared in the markup.
 * Kept only for export bookkeeping and diagnostics; never parsed back.
 */
public record DefinitionFilename(String resolvedPath, String declaredFilename) {

    public static final DefinitionFilename NONE = new DefinitionFilename("", null);

    /**
     * Two-element list form stored under {@code xml_attributes["filename"]}.
     */
    public List<String> asList() {
        List<String> pair = new ArrayList<>(2);
        pair.add(resolvedPath);
        pair.add(declaredFilename);
        return pair;
    }
}
