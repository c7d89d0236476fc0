package com.czesl.vert.convert;

import com.czesl.vert.diagnostics.Diagnostics;
import com.czesl.vert.layer.LayerName;
import com.czesl.vert.layer.LinkedLayers;
import com.czesl.vert.vertical.VerticalFormat;
import com.czesl.vert.vertical.VerticalSerializer;
import com.czesl.vert.xml.XmlElements;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.w3c.dom.Element;

/** Entry point turning the parsed layer files of one document set into vertical text. */
public final class VertConverter {
    private static final Logger LOGGER = Logger.getLogger(VertConverter.class.getName());

    private final ConverterOptions options;
    private final DocumentAligner aligner = new DocumentAligner();

    public VertConverter() {
        this(ConverterOptions.defaults());
    }

    public VertConverter(ConverterOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public ConversionResult convert(LayerTrees trees) {
        Diagnostics diagnostics = new Diagnostics();
        String output = convert(trees, diagnostics);
        return new ConversionResult(output, diagnostics.getMessages());
    }

    /**
     * Converts every B document of the set, in document order. Messages go to {@code diagnostics}. A
     * document that cannot be aligned or is inconsistent is reported as an error and left out; the
     * other documents of the set are still written.
     *
     * @return the vertical text, one line per record or tag, newline terminated
     */
    public String convert(LayerTrees trees, Diagnostics diagnostics) {
        List<Element> wDocs = aligner.documents(trees.getW());
        List<Element> aDocs = aligner.documents(trees.getA());
        List<String> lines = new ArrayList<>();
        for (Element bDoc : aligner.documents(trees.getB())) {
            String bDocId = bDoc.getAttribute("id");
            diagnostics.enterDocument(bDocId);
            try {
                lines.addAll(convertDocument(bDoc, aDocs, wDocs, diagnostics));
            } catch (ConversionException ex) {
                diagnostics.error(bDocId, "Skipping document: " + ex.getMessage());
                LOGGER.log(
                        Level.WARNING,
                        "Skipping document " + bDocId + " of " + trees.getName(),
                        ex);
            } finally {
                diagnostics.leaveDocument();
            }
        }
        LOGGER.log(
                Level.FINE,
                "Converted {0} into {1} lines",
                new Object[] {trees.getName(), lines.size()});
        if (lines.isEmpty()) {
            return "";
        }
        return String.join("\n", lines) + "\n";
    }

    List<String> convertDocument(
            Element bDoc, List<Element> aDocs, List<Element> wDocs, Diagnostics diagnostics)
            throws ConversionException {
        Element aDoc = aligner.findLowerDocument(bDoc, LayerName.B, aDocs);
        Element wDoc = aligner.findLowerDocument(aDoc, LayerName.A, wDocs);
        aligner.checkConsistency(bDoc, aDoc);

        List<String> lines = new ArrayList<>();
        lines.add(VerticalFormat.openStructure("doc", bDoc.getAttribute("id")));
        for (Element bPara : XmlElements.children(bDoc, "para")) {
            lines.addAll(convertParagraph(bPara, aDoc, wDoc, diagnostics));
        }
        lines.add(VerticalFormat.close("doc"));
        return lines;
    }

    List<String> convertParagraph(Element bPara, Element aDoc, Element wDoc, Diagnostics diagnostics)
            throws ConversionException {
        Element aPara = aligner.findLowerParagraph(bPara, LayerName.B, aDoc);
        Element wPara = aligner.findLowerParagraph(aPara, LayerName.A, wDoc);

        LinkedLayers layers =
                LinkedLayers.build(wPara, aPara, bPara, options.isGuessErrors(), diagnostics);

        List<String> lines = new ArrayList<>();
        String paraId = DocumentAligner.commonId(bPara.getAttribute("id"));
        lines.add(VerticalFormat.openStructure("p", paraId));
        lines.addAll(new VerticalSerializer(diagnostics).serialize(layers.getW()));
        lines.add(VerticalFormat.close("p"));
        return lines;
    }
}
