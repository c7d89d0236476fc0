package com.czesl.vert.xml;

import java.util.ArrayList;
import java.util.List;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Small helpers over {@code org.w3c.dom} that match elements by local name, so the layer files can be
 * read whether or not they declare the PML namespace.
 */
public final class XmlElements {

    private XmlElements() {}

    public static String localName(Node node) {
        String local = node.getLocalName();
        return local != null ? local : node.getNodeName();
    }

    public static boolean isElement(Node node, String name) {
        return node.getNodeType() == Node.ELEMENT_NODE && name.equals(localName(node));
    }

    /** Direct child elements with the given local name, in document order. */
    public static List<Element> children(Element parent, String name) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (isElement(node, name)) {
                result.add((Element) node);
            }
        }
        return result;
    }

    /** First direct child element with the given local name, or {@code null}. */
    public static Element child(Element parent, String name) {
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (isElement(node, name)) {
                return (Element) node;
            }
        }
        return null;
    }

    /** Descendant elements with the given local name, in document order, excluding {@code root}. */
    public static List<Element> descendants(Element root, String name) {
        List<Element> result = new ArrayList<>();
        collect(root, name, result);
        return result;
    }

    private static void collect(Element parent, String name, List<Element> out) {
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() != Node.ELEMENT_NODE) {
                continue;
            }
            if (name.equals(localName(node))) {
                out.add((Element) node);
            }
            collect((Element) node, name, out);
        }
    }

    /** Text of the first direct child with the given name, or {@code null} when the child is absent. */
    public static String childText(Element parent, String name) {
        Element child = child(parent, name);
        return child == null ? null : child.getTextContent();
    }

    /** Attribute value, or {@code null} when the attribute is absent or empty. */
    public static String attribute(Element element, String name) {
        String value = element.getAttribute(name);
        return value == null || value.isEmpty() ? null : value;
    }

    /** Strips a {@code <prefix>#} reference prefix; ids without one are returned trimmed. */
    public static String stripReference(String reference) {
        String trimmed = reference.trim();
        int hash = trimmed.indexOf('#');
        return hash >= 0 ? trimmed.substring(hash + 1) : trimmed;
    }

    /** The first element named {@code name} in document order, {@code root} itself included. */
    public static Element findFirst(Element root, String name) {
        if (name.equals(localName(root))) {
            return root;
        }
        List<Element> found = descendants(root, name);
        return found.isEmpty() ? null : found.get(0);
    }
}
