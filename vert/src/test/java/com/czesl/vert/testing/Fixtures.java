package com.czesl.vert.testing;

import com.czesl.vert.io.MetaXml;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import javax.xml.parsers.DocumentBuilderFactory;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;

public final class Fixtures {

    private Fixtures() {}

    /** Reads {@code fixtures/<name>} from the test classpath. */
    public static String resource(String name) throws IOException {
        String path = "fixtures/" + name;
        try (InputStream in = Fixtures.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IOException("Missing classpath resource: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /** The {@code fixtures/<base>.{w,a,b}.xml} document set. */
    public static MetaXml metaXml(String base) throws IOException {
        return new MetaXml(
                base,
                resource(base + ".w.xml"),
                resource(base + ".a.xml"),
                resource(base + ".b.xml"));
    }

    /** Parses an XML snippet and returns its root element. */
    public static Element element(String xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            return factory.newDocumentBuilder()
                    .parse(new InputSource(new StringReader(xml)))
                    .getDocumentElement();
        } catch (Exception ex) {
            throw new IllegalStateException("Invalid test XML: " + xml, ex);
        }
    }

    /** A W token element. */
    public static String w(String id, String text) {
        return "<w id=\"" + id + "\"><token>" + text + "</token></w>";
    }

    /** An A or B token element with one analysis and an edge from {@code from}. */
    public static String token(
            String id, String text, String lemma, String tag, String from, String... errorTags) {
        return "<w id=\""
                + id
                + "\"><token>"
                + text
                + "</token><lex><lemma>"
                + lemma
                + "</lemma><mtag>"
                + tag
                + "</mtag></lex>"
                + edge(from, errorTags)
                + "</w>";
    }

    /** An edge from the comma separated references in {@code from}, with optional error tags. */
    public static String edge(String from, String... errorTags) {
        StringBuilder builder = new StringBuilder("<edge>");
        for (String ref : from.split(",")) {
            builder.append("<from>").append(ref).append("</from>");
        }
        if (errorTags.length > 0) {
            builder.append("<error>");
            for (String tag : errorTags) {
                builder.append("<tag>").append(tag).append("</tag>");
            }
            builder.append("</error>");
        }
        return builder.append("</edge>").toString();
    }

    public static String para(String id, String lowerRef, String... content) {
        String ref = lowerRef == null ? "" : " lowerpara.rf=\"" + lowerRef + "\"";
        return "<para id=\"" + id + "\"" + ref + ">" + String.join("", content) + "</para>";
    }

    public static String sentence(String id, String... tokens) {
        return "<s id=\"" + id + "\">" + String.join("", tokens) + "</s>";
    }
}
