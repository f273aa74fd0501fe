package uk.gegc.courseblocks.features.olx.application;

import org.dom4j.Attribute;
import org.dom4j.Element;
import org.dom4j.Node;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Recognises pointer tags ({@code <html url_name="intro"/>}) and computes the files they refer to.
 */
public final class PointerTags {

    public static final String URL_NAME = "url_name";
    public static final String COURSE_CATEGORY = "course";

    private static final Set<String> POINTER_ATTRIBUTES = Set.of(URL_NAME);
    private static final Set<String> COURSE_POINTER_ATTRIBUTES = Set.of(URL_NAME, "course", "org");

    private PointerTags() {
    }

    /**
     * A pointer has no child elements, no text and exactly the {@code url_name} attribute
     * ({@code url_name}, {@code course} and {@code org} for a course root). Any other attribute makes the
     * node an inline definition.
     */
    public static boolean isPointer(Element node) {
        Set<String> expected = COURSE_CATEGORY.equals(node.getName())
                ? COURSE_POINTER_ATTRIBUTES
                : POINTER_ATTRIBUTES;
        Set<String> actual = new HashSet<>();
        for (Attribute attribute : node.attributes()) {
            actual.add(attribute.getQualifiedName());
        }
        return !hasChildNodes(node) && actual.equals(expected) && !OlxXml.hasText(node);
    }

    /**
     * Whether {@code node} has children other than text, counting comments and processing instructions.
     */
    private static boolean hasChildNodes(Element node) {
        for (Node child : node.content()) {
            short type = child.getNodeType();
            if (type != Node.TEXT_NODE && type != Node.CDATA_SECTION_NODE && type != Node.NAMESPACE_NODE) {
                return true;
            }
        }
        return false;
    }

    /**
     * Location names may use {@code :} to organise content into directories.
     */
    public static String nameToPathname(String name) {
        return name.replace(":", "/");
    }

    public static String formatFilepath(String category, String name, String extension) {
        return category + "/" + name + "." + extension;
    }

    public static String pointerPath(Element node, String extension) {
        String urlName = node.attributeValue(URL_NAME);
        if (urlName == null) {
            throw new IllegalArgumentException("Pointer tag <" + node.getName() + "> has no url_name");
        }
        return formatFilepath(node.getName(), nameToPathname(urlName), extension);
    }

    /**
     * Historical locations to try when {@code filepath} does not exist: {@code .html.xml} and
     * {@code .html.html} are corrected to {@code .html}, each shorter suffix of the path is tried, and
     * then {@code .html} variants of every {@code .xml} candidate.
     */
    public static List<String> backcompatPaths(String filepath) {
        String path = filepath;
        if (path.endsWith(".html.xml")) {
            path = path.substring(0, path.length() - 9) + ".html";
        }
        if (path.endsWith(".html.html")) {
            path = path.substring(0, path.length() - 5);
        }
        List<String> candidates = new ArrayList<>();
        while (path.contains("/")) {
            candidates.add(path);
            path = path.substring(path.indexOf('/') + 1);
        }
        List<String> htmlCandidates = new ArrayList<>();
        for (String candidate : candidates) {
            if (candidate.endsWith(".xml")) {
                htmlCandidates.add(candidate.substring(0, candidate.length() - 4) + ".html");
            }
        }
        candidates.addAll(htmlCandidates);
        return candidates;
    }

    /**
     * Parent directory of a relative path, or {@code ""} at the top level.
     */
    public static String parentOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }

    public static String baseName(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }
}
