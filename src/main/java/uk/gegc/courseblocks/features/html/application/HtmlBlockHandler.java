package uk.gegc.courseblocks.features.html.application;

import org.dom4j.Element;
import org.springframework.stereotype.Component;
import uk.gegc.courseblocks.features.html.domain.model.HtmlBlock;
import uk.gegc.courseblocks.features.olx.application.BlockXmlHandler;
import uk.gegc.courseblocks.features.olx.application.OlxXml;
import uk.gegc.courseblocks.features.olx.application.PointerTags;
import uk.gegc.courseblocks.features.olx.domain.model.Block;
import uk.gegc.courseblocks.features.olx.domain.model.BlockSchema;
import uk.gegc.courseblocks.features.olx.domain.model.DefinitionContent;
import uk.gegc.courseblocks.features.olx.domain.model.OlxSettings;
import uk.gegc.courseblocks.features.olx.domain.model.ScopeIds;
import uk.gegc.courseblocks.features.olx.domain.model.UsageKey;
import uk.gegc.courseblocks.features.olx.domain.runtime.ResourceStore;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * OLX handling for {@code <html>}.
 * <p>
 * The body is kept as an HTML snippet rather than parsed XML: on export it goes to
 * {@code html/<url_name>.html} and the definition element only names that file. Inline definitions are
 * read from the element's inner markup.
 */
@Component
public class HtmlBlockHandler implements BlockXmlHandler {

    static final String HTML_EXTENSION = "html";
    static final String FILENAME_ATTRIBUTE = "filename";

    @Override
    public String category() {
        return HtmlBlock.CATEGORY;
    }

    @Override
    public BlockSchema schema() {
        return HtmlBlock.SCHEMA;
    }

    @Override
    public Block newBlock(ScopeIds keys) {
        return new HtmlBlock(keys);
    }

    @Override
    public DefinitionContent extractContent(Element definitionXml) {
        return DefinitionContent.of(Map.of("data", OlxXml.stringifyChildren(definitionXml)));
    }

    @Override
    public Optional<String> rawContentExtension() {
        return Optional.of(HTML_EXTENSION);
    }

    @Override
    public DefinitionContent extractRawContent(String content, String path) {
        return DefinitionContent.of(Map.of("data", content));
    }

    /**
     * {@code filename} is relative to the directory of the block's own pointer path, and always names an
     * {@code .html} file.
     */
    @Override
    public String filenameReferencePath(String tag, String filename, UsageKey usageId, OlxSettings settings) {
        String pointerPath = HtmlBlock.CATEGORY + "/" + PointerTags.nameToPathname(usageId.blockId());
        return PointerTags.parentOf(pointerPath) + "/" + filename + "." + HTML_EXTENSION;
    }

    @Override
    public Element definitionToXml(Block block, ResourceStore exportStore) throws IOException {
        HtmlBlock html = (HtmlBlock) block;
        String pathname = PointerTags.nameToPathname(html.getUrlName());
        String filepath = html.getCategory() + "/" + pathname + "." + HTML_EXTENSION;

        exportStore.makedirs(PointerTags.parentOf(filepath));
        String data = html.getData();
        exportStore.write(filepath, (data == null ? "" : data).getBytes(StandardCharsets.UTF_8));

        Element element = OlxXml.createElement(HtmlBlock.CATEGORY);
        element.addAttribute(FILENAME_ATTRIBUTE, PointerTags.baseName(pathname));
        return element;
    }
}
