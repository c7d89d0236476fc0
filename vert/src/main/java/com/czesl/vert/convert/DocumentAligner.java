package com.czesl.vert.convert;

import com.czesl.vert.layer.LayerName;
import com.czesl.vert.xml.XmlElements;
import java.util.ArrayList;
import java.util.List;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Finds the lower-layer counterparts of documents and paragraphs. An explicit {@code lowerdoc.rf} or
 * {@code lowerpara.rf} reference is tried first, then the id with its layer prefix swapped, then the
 * id unchanged.
 */
public final class DocumentAligner {
    static final String LOWER_DOC_REF = "lowerdoc.rf";
    static final String LOWER_PARA_REF = "lowerpara.rf";

    /** The {@code doc} elements of a layer file, in document order. */
    public List<Element> documents(Document tree) {
        Element root = tree.getDocumentElement();
        Element data = XmlElements.findFirst(root, "wdata");
        if (data == null) {
            data = XmlElements.findFirst(root, "ldata");
        }
        return XmlElements.children(data != null ? data : root, "doc");
    }

    public Element findLowerDocument(Element upperDoc, LayerName upper, List<Element> lowerDocs)
            throws ConversionException {
        for (String candidate : candidateIds(upperDoc, LOWER_DOC_REF, upper)) {
            for (Element lowerDoc : lowerDocs) {
                if (candidate.equals(lowerDoc.getAttribute("id"))) {
                    return lowerDoc;
                }
            }
        }
        throw new ConversionException(
                "No "
                        + upper.lower()
                        + " document found for "
                        + upper
                        + " document "
                        + upperDoc.getAttribute("id"));
    }

    public Element findLowerParagraph(Element upperPara, LayerName upper, Element lowerDoc)
            throws ConversionException {
        List<Element> lowerParas = XmlElements.children(lowerDoc, "para");
        for (String candidate : candidateIds(upperPara, LOWER_PARA_REF, upper)) {
            for (Element lowerPara : lowerParas) {
                if (candidate.equals(lowerPara.getAttribute("id"))) {
                    return lowerPara;
                }
            }
        }
        throw new ConversionException(
                "No "
                        + upper.lower()
                        + " paragraph found for "
                        + upper
                        + " paragraph "
                        + upperPara.getAttribute("id"));
    }

    /**
     * Fails when the B document is empty although its A counterpart has tokens, which means the
     * annotation of the B layer was never completed.
     */
    public void checkConsistency(Element bDoc, Element aDoc) throws ConversionException {
        int bTokens = XmlElements.descendants(bDoc, "w").size();
        int aTokens = XmlElements.descendants(aDoc, "w").size();
        if (bTokens == 0 && aTokens > 0) {
            throw new ConversionException(
                    "B document "
                            + bDoc.getAttribute("id")
                            + " has no tokens while A document "
                            + aDoc.getAttribute("id")
                            + " has "
                            + aTokens);
        }
    }

    /** Id shared by the layers of a paragraph: the part after the first {@code -}. */
    public static String commonId(String id) {
        int dash = id.indexOf('-');
        return dash >= 0 ? id.substring(dash + 1) : id;
    }

    static String swapLayerPrefix(String id, LayerName upper) {
        if (id.isEmpty() || id.charAt(0) != upper.getPrefix()) {
            return null;
        }
        return upper.lower().getPrefix() + id.substring(1);
    }

    static List<String> candidateIds(Element upper, String refAttribute, LayerName layer) {
        List<String> candidates = new ArrayList<>(3);
        String reference = XmlElements.attribute(upper, refAttribute);
        if (reference != null) {
            candidates.add(XmlElements.stripReference(reference));
        }
        String id = upper.getAttribute("id");
        String swapped = swapLayerPrefix(id, layer);
        if (swapped != null && !candidates.contains(swapped)) {
            candidates.add(swapped);
        }
        if (!id.isEmpty() && !candidates.contains(id)) {
            candidates.add(id);
        }
        return candidates;
    }
}
