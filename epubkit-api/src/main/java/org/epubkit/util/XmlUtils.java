package org.epubkit.util;

import lombok.experimental.UtilityClass;
import org.epubkit.exception.EpubError;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * DOM helpers that match elements by local name, so prefixed ({@code dc:title}) and
 * default-namespace documents are read the same way.
 */
@UtilityClass
public class XmlUtils {

    public static Document parse(byte[] data, String sourceName) {
        try {
            DocumentBuilder builder = SecureXmlUtils.createSecureDocumentBuilder(true);
            return builder.parse(new ByteArrayInputStream(data));
        } catch (SAXException | IOException | ParserConfigurationException e) {
            throw EpubError.DECODE_ERROR.createException(e, sourceName, e.getMessage());
        }
    }

    public static List<Element> childElements(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node instanceof Element el && localName.equals(localName(el))) {
                result.add(el);
            }
        }
        return result;
    }

    public static Optional<Element> firstChild(Element parent, String localName) {
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            if (children.item(i) instanceof Element el && localName.equals(localName(el))) {
                return Optional.of(el);
            }
        }
        return Optional.empty();
    }

    /**
     * Trimmed text of the first matching child, or an empty string.
     */
    public static String childText(Element parent, String localName) {
        return firstChild(parent, localName)
                .map(el -> el.getTextContent().trim())
                .orElse("");
    }

    /**
     * Untrimmed text of the last matching child, or an empty string. A repeated element
     * overwrites the value read from the ones before it.
     */
    public static String lastChildText(Element parent, String localName) {
        List<Element> matches = childElements(parent, localName);
        return matches.isEmpty() ? "" : matches.get(matches.size() - 1).getTextContent();
    }

    /**
     * Same as {@link Element#getAttribute(String)}, which already yields "" for absent attributes;
     * the value is trimmed.
     */
    public static String attribute(Element element, String name) {
        return element.getAttribute(name).trim();
    }

    private static String localName(Element element) {
        String name = element.getLocalName();
        if (name != null) {
            return name;
        }
        String tagName = element.getTagName();
        int colon = tagName.indexOf(':');
        return colon >= 0 ? tagName.substring(colon + 1) : tagName;
    }
}
