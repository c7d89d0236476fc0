package com.czesl.vert.convert;

import java.io.IOException;
import java.io.StringReader;
import java.util.Objects;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Document;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/** Parsed W, A and B files of one document set. */
public final class LayerTrees {
    private final String name;
    private final Document w;
    private final Document a;
    private final Document b;

    public LayerTrees(String name, Document w, Document a, Document b) {
        this.name = Objects.requireNonNull(name, "name");
        this.w = Objects.requireNonNull(w, "w");
        this.a = Objects.requireNonNull(a, "a");
        this.b = Objects.requireNonNull(b, "b");
    }

    public static LayerTrees parse(String name, String wXml, String aXml, String bXml)
            throws ConversionException {
        DocumentBuilder builder = newDocumentBuilder();
        return new LayerTrees(
                name,
                parse(builder, name + ".w", wXml),
                parse(builder, name + ".a", aXml),
                parse(builder, name + ".b", bXml));
    }

    public String getName() {
        return name;
    }

    public Document getW() {
        return w;
    }

    public Document getA() {
        return a;
    }

    public Document getB() {
        return b;
    }

    private static Document parse(DocumentBuilder builder, String source, String xml)
            throws ConversionException {
        try {
            builder.reset();
            InputSource input = new InputSource(new StringReader(xml));
            input.setSystemId(source);
            return builder.parse(input);
        } catch (SAXException | IOException ex) {
            throw new ConversionException("Unable to parse " + source + ": " + ex.getMessage(), ex);
        }
    }

    private static DocumentBuilder newDocumentBuilder() throws ConversionException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException ex) {
            throw new ConversionException("Unable to configure XML parser", ex);
        }
    }
}
