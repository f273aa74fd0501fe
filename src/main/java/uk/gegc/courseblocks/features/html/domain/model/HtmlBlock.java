package uk.gegc.courseblocks.features.html.domain.model;

import uk.gegc.courseblocks.features.olx.domain.model.Block;
import uk.gegc.courseblocks.features.olx.domain.model.BlockSchema;
import uk.gegc.courseblocks.features.olx.domain.model.CourseKey;
import uk.gegc.courseblocks.features.olx.domain.model.FieldDefinition;
import uk.gegc.courseblocks.features.olx.domain.model.FieldScope;
import uk.gegc.courseblocks.features.olx.domain.model.FieldType;
import uk.gegc.courseblocks.features.olx.domain.model.ScopeIds;

import java.util.Map;

/**
 * Rich text content block. The HTML body lives in {@code data}.
 */
public class HtmlBlock extends Block {

    public static final String CATEGORY = "html";
    public static final String USER_ID_PLACEHOLDER = "%%USER_ID%%";
    public static final String COURSE_ID_PLACEHOLDER = "%%COURSE_ID%%";

    public static final BlockSchema SCHEMA = BlockSchema.of(
            FieldDefinition.of("display_name", FieldScope.SETTINGS, FieldType.STRING, "Text"),
            FieldDefinition.of("data", FieldScope.CONTENT, FieldType.STRING, ""),
            FieldDefinition.of("source_code", FieldScope.SETTINGS, FieldType.STRING),
            FieldDefinition.of("use_latex_compiler", FieldScope.SETTINGS, FieldType.BOOLEAN, false),
            FieldDefinition.of("editor", FieldScope.SETTINGS, FieldType.STRING, "visual"),
            FieldDefinition.of(BlockSchema.XML_ATTRIBUTES, FieldScope.SETTINGS, FieldType.DICT, Map.of())
    );

    public HtmlBlock(ScopeIds scopeIds) {
        super(scopeIds, SCHEMA);
    }

    public String getData() {
        return (String) getField("data");
    }

    public void setData(String data) {
        setField("data", data);
    }

    public String getSourceCode() {
        return (String) getField("source_code");
    }

    public void setSourceCode(String sourceCode) {
        setField("source_code", sourceCode);
    }

    public boolean isUseLatexCompiler() {
        return Boolean.TRUE.equals(getField("use_latex_compiler"));
    }

    public void setUseLatexCompiler(boolean useLatexCompiler) {
        setField("use_latex_compiler", useLatexCompiler);
    }

    public String getEditor() {
        return (String) getField("editor");
    }

    public void setEditor(String editor) {
        setField("editor", editor);
    }

    /**
     * HTML to render, with {@value #USER_ID_PLACEHOLDER} replaced by the viewer's anonymous id when one is
     * known and {@value #COURSE_ID_PLACEHOLDER} replaced by the course key.
     */
    public String getHtml(String anonymousUserId) {
        String data = getData();
        if (data == null || data.isEmpty()) {
            return data;
        }
        if (anonymousUserId != null && !anonymousUserId.isEmpty()) {
            data = data.replace(USER_ID_PLACEHOLDER, anonymousUserId);
        }
        CourseKey courseKey = getLocation().courseKey();
        if (courseKey != null) {
            data = data.replace(COURSE_ID_PLACEHOLDER, courseKey.toString());
        }
        return data;
    }
}
