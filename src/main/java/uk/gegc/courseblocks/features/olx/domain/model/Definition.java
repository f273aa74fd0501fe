package uk.gegc.courseblocks.features.olx.domain.model;

import org.dom4j.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Transient result of loading a definition node; discarded once merged into a block.
 */
public class Definition {

    private final Map<String, Object> fields = new LinkedHashMap<>();
    private final List<Element> asideChildren = new ArrayList<>();
    private DefinitionFilename filename = DefinitionFilename.NONE;
    private String definitionMetadata;

    public Definition(Map<String, Object> fields) {
        if (fields != null) {
            this.fields.putAll(fields);
        }
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    public DefinitionFilename getFilename() {
        return filename;
    }

    public void setFilename(DefinitionFilename filename) {
        this.filename = filename == null ? DefinitionFilename.NONE : filename;
    }

    /**
     * Raw JSON text taken from an inline {@code <meta>} element, or {@code null}.
     */
    public String getDefinitionMetadata() {
        return definitionMetadata;
    }

    public void setDefinitionMetadata(String definitionMetadata) {
        this.definitionMetadata = definitionMetadata;
    }

    public List<Element> getAsideChildren() {
        return asideChildren;
    }

    public void addAsideChildren(List<Element> fragments) {
        asideChildren.addAll(fragments);
    }
}
