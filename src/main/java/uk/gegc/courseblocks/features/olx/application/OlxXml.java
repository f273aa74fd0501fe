package uk.gegc.courseblocks.features.olx.application;

import org.dom4j.Document;
import org.dom4j.DocumentException;
import org.dom4j.DocumentHelper;
import org.dom4j.Element;
import org.dom4j.Node;
import org.dom4j.io.OutputFormat;
import org.dom4j.io.SAXReader;
import org.dom4j.io.XMLWriter;
import org.xml.sax.SAXException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

/**
 * dom4j helpers for reading and writing OLX.
 * <p>
 * Files are read as UTF-8 without loading external DTDs, and whitespace-only text between elements is
 * dropped.
 */
public final class OlxXml {

    private OlxXml() {
    }

    public static Element parse(InputStream input) throws DocumentException {
        return newReader().read(input).getRootElement();
    }

    public static Element parse(String xml) throws DocumentException {
        return newReader().read(new StringReader(xml)).getRootElement();
    }

    /**
     * Inner markup of {@code node} without its own tags: {@code <a x="1">Hi <b>there</b></a>} gives
     * {@code Hi <b>there</b>}. Text before the first child element is returned unescaped.
     */
    public static String stringifyChildren(Element node) {
        StringBuilder sb = new StringBuilder();
        boolean seenElement = false;
        for (Node child : node.content()) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                seenElement = true;
                sb.append(child.asXML());
            } else if (!seenElement && child.getNodeType() == Node.TEXT_NODE) {
                sb.append(child.getText());
            } else {
                sb.append(child.asXML());
            }
        }
        return sb.toString();
    }

    /**
     * Detached deep copy of {@code element}.
     */
    public static Element copyOf(Element element) {
        return element.createCopy();
    }

    public static Element createElement(String name) {
        return DocumentHelper.createElement(name);
    }

    /**
     * Whether {@code element} has any text directly under it that is not whitespace.
     */
    public static boolean hasText(Element element) {
        for (Node child : element.content()) {
            short type = child.getNodeType();
            if ((type == Node.TEXT_NODE || type == Node.CDATA_SECTION_NODE) && !child.getText().isBlank()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Pretty-printed UTF-8 document holding a copy of {@code element}.
     */
    public static byte[] toPrettyBytes(Element element) throws IOException {
        Document document = DocumentHelper.createDocument(element.createCopy());
        OutputFormat format = new OutputFormat("  ", true, StandardCharsets.UTF_8.name());
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        XMLWriter writer = new XMLWriter(buffer, format);
        writer.write(document);
        writer.flush();
        return buffer.toByteArray();
    }

    /**
     * Compact XML for a single element, without an XML declaration.
     */
    public static String toXmlString(Element element) throws IOException {
        OutputFormat format = new OutputFormat();
        format.setSuppressDeclaration(true);
        StringWriter out = new StringWriter();
        XMLWriter writer = new XMLWriter(out, format);
        writer.write(element);
        writer.flush();
        return out.toString();
    }

    private static SAXReader newReader() {
        SAXReader reader = SAXReader.createDefault();
        reader.setEncoding(StandardCharsets.UTF_8.name());
        reader.setStripWhitespaceText(true);
        reader.setMergeAdjacentText(true);
        try {
            reader.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        } catch (SAXException ex) {
            throw new IllegalStateException("XML parser does not support disabling external DTDs", ex);
        }
        return reader;
    }
}
