package edu.harvard.hms.dbmi.avillach.kinetics.etl.experiment;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Helpers for walking experiment documents. Only direct children are searched, elements are matched on their local name
 * so that documents with or without a default namespace read the same.
 */
public class XmlElementUtil {

    private XmlElementUtil() {
    }

    public static List<Element> children(Element parent) {
        List<Element> children = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                children.add((Element) node);
            }
        }
        return children;
    }

    public static List<Element> children(Element parent, String name) {
        return children(parent).stream().filter(child -> name.equals(nameOf(child))).toList();
    }

    public static Optional<Element> firstChild(Element parent, String name) {
        return children(parent).stream().filter(child -> name.equals(nameOf(child))).findFirst();
    }

    /**
     * @return trimmed text of the first child called {@code name}, if there is one
     */
    public static Optional<String> childText(Element parent, String name) {
        return firstChild(parent, name).map(XmlElementUtil::text);
    }

    public static String text(Element element) {
        return trim(element.getTextContent());
    }

    /**
     * @return the attribute value, or empty when the attribute is missing or blank
     */
    public static Optional<String> attribute(Element element, String name) {
        String value = trim(element.getAttribute(name));
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    public static String nameOf(Element element) {
        return element.getLocalName() != null ? element.getLocalName() : element.getTagName();
    }

    public static String trim(@Nullable String maybeString) {
        return maybeString == null ? "" : maybeString.trim();
    }
}
