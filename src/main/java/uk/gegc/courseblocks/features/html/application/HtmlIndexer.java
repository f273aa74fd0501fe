package uk.gegc.courseblocks.features.html.application;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;
import uk.gegc.courseblocks.features.html.domain.model.HtmlBlock;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Builds the search index document for an {@link HtmlBlock}: its display name and the visible text of its
 * body.
 */
@Component
public class HtmlIndexer {

    public static final String CONTENT_TYPE = "Text";

    private static final Pattern WHITESPACE = Pattern.compile("(\\s|\\u00a0|//)+");
    private static final Pattern COMMENT = Pattern.compile("<!--.*-->");
    private static final Pattern CDATA = Pattern.compile("<!\\[CDATA\\[.*]]>");

    public Map<String, Object> indexDictionary(HtmlBlock block) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("html_content", htmlToIndexText(block.getData()));
        content.put("display_name", block.getDisplayName());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("content", content);
        body.put("content_type", CONTENT_TYPE);
        return body;
    }

    /**
     * Visible text of {@code html}: scripts and styles dropped, image alt text kept, runs of whitespace,
     * non-breaking spaces and {@code //} collapsed to a single space.
     */
    String htmlToIndexText(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        Document doc = Jsoup.parseBodyFragment(html);
        doc.select("script,style").remove();
        for (Element img : doc.select("img[alt]")) {
            img.replaceWith(new TextNode(img.attr("alt")));
        }
        String text = WHITESPACE.matcher(doc.body().wholeText()).replaceAll(" ");
        text = CDATA.matcher(text).replaceAll("");
        return COMMENT.matcher(text).replaceAll("");
    }
}
